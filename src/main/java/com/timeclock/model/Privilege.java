package com.timeclock.model;

/**
 * Уровень доступа пользователя на терминале.
 */
public enum Privilege {
  DEFAULT(0, "User"),
  ADMIN(14, "Admin");

  private final int code;
  private final String label;

  Privilege(int code, String label) {
    this.code = code;
    this.label = label;
  }

  /**
   * Код уровня доступа в протоколе терминала.
   */
  public int code() {
    return code;
  }

  /**
   * Подпись для таблиц, CSV и столбца privilege в БД.
   */
  public String label() {
    return label;
  }

  /**
   * Всё, что не ниже административного кода, считается администратором.
   */
  public static Privilege fromCode(int rawCode) {
    return rawCode >= ADMIN.code ? ADMIN : DEFAULT;
  }

  /**
   * Разбирает подпись из ввода оператора; всё, кроме "Admin", — обычный пользователь.
   */
  public static Privilege fromLabel(String label) {
    return ADMIN.label.equalsIgnoreCase(label == null ? "" : label.trim()) ? ADMIN : DEFAULT;
  }
}
