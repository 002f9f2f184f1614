package com.timeclock.registry;

/**
 * Файл реестра терминалов не прочитан или имеет неверную структуру.
 * Единственная фатальная ошибка запуска: без реестра обходить нечего.
 */
public class RegistryException extends RuntimeException {

  public RegistryException(String message) {
    super(message);
  }

  public RegistryException(String message, Throwable cause) {
    super(message, cause);
  }
}
