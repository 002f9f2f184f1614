package com.timeclock.app;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Аргументы одной команды: позиционные значения, опции вида {@code --key value}
 * и флаги без значения.
 */
final class CommandArguments {

  private final List<String> positional = new ArrayList<>();
  private final Map<String, String> options = new HashMap<>();
  private final Set<String> flags = new HashSet<>();

  private CommandArguments() {
  }

  /**
   * Разбирает аргументы, начиная со второго (первый — имя команды).
   *
   * @param flagNames Опции, которые не принимают значения.
   * @throws IllegalArgumentException если у опции нет значения.
   */
  static CommandArguments parse(String[] args, Set<String> flagNames) {
    CommandArguments parsed = new CommandArguments();
    for (int i = 1; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--")) {
        parsed.positional.add(arg);
      } else if (flagNames.contains(arg)) {
        parsed.flags.add(arg);
      } else if (i + 1 < args.length) {
        parsed.options.put(arg, args[++i]);
      } else {
        throw new IllegalArgumentException("Для " + arg + " не указано значение");
      }
    }
    return parsed;
  }

  int positionalCount() {
    return positional.size();
  }

  String positional(int index) {
    return positional.get(index);
  }

  Optional<String> option(String name) {
    return Optional.ofNullable(options.get(name));
  }

  boolean flag(String name) {
    return flags.contains(name);
  }

  /**
   * @throws IllegalArgumentException если значение не является целым числом.
   */
  static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " должен быть целым числом: " + value, e);
    }
  }

  static long parseLong(String name, String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " должен быть целым числом: " + value, e);
    }
  }
}
