package com.timeclock.db;

/**
 * Локальное хранилище недоступно или не удалось создать схему.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
