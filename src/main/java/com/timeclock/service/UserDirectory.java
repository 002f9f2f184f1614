package com.timeclock.service;

import com.timeclock.model.UserRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Поиск по списку пользователей, полученному с терминала.
 */
public final class UserDirectory {

  private final List<UserRecord> users;

  public UserDirectory(List<UserRecord> users) {
    this.users = Collections.unmodifiableList(new ArrayList<>(users));
  }

  public List<UserRecord> all() {
    return users;
  }

  /**
   * Точное совпадение табельного номера.
   */
  public List<UserRecord> findByUserId(String userId) {
    String query = userId == null ? "" : userId.trim();
    List<UserRecord> matched = new ArrayList<>();
    if (query.isEmpty()) {
      return matched;
    }
    for (UserRecord user : users) {
      if (user.getUserId().equals(query)) {
        matched.add(user);
      }
    }
    return matched;
  }

  /**
   * Поиск по части имени без учёта регистра.
   */
  public List<UserRecord> findByName(String keyword) {
    String query = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
    List<UserRecord> matched = new ArrayList<>();
    if (query.isEmpty()) {
      return matched;
    }
    for (UserRecord user : users) {
      if (user.getName().toLowerCase(Locale.ROOT).contains(query)) {
        matched.add(user);
      }
    }
    return matched;
  }

  public List<UserRecord> admins() {
    List<UserRecord> matched = new ArrayList<>();
    for (UserRecord user : users) {
      if (user.isAdmin()) {
        matched.add(user);
      }
    }
    return matched;
  }

  public Optional<UserRecord> findByUid(int uid) {
    for (UserRecord user : users) {
      if (user.getUid() == uid) {
        return Optional.of(user);
      }
    }
    return Optional.empty();
  }
}
