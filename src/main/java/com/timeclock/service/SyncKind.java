package com.timeclock.service;

/**
 * Что синхронизируется с парком терминалов.
 */
public enum SyncKind {
  USERS("пользователей"),
  ATTENDANCE("отметок");

  private final String noun;

  SyncKind(String noun) {
    this.noun = noun;
  }

  /**
   * Родительный падеж для сообщений лога ("синхронизация пользователей").
   */
  public String noun() {
    return noun;
  }
}
