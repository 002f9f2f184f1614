package com.timeclock.db;

import java.util.List;

/**
 * Различия SQLite и PostgreSQL, которые нужны хранилищу: DDL и управление
 * гарантиями записи на время массовой загрузки.
 * <p>
 * Сами INSERT ... ON CONFLICT одинаковы для обеих СУБД.
 */
public enum SqlDialect {

  SQLITE(
      "INTEGER PRIMARY KEY AUTOINCREMENT",
      "TIMESTAMP DEFAULT CURRENT_TIMESTAMP",
      "PRAGMA synchronous = OFF",
      "PRAGMA synchronous = FULL"
  ),
  POSTGRESQL(
      "BIGSERIAL PRIMARY KEY",
      "TIMESTAMPTZ DEFAULT NOW()",
      "SET synchronous_commit TO OFF",
      "SET synchronous_commit TO ON"
  );

  private final String identityColumn;
  private final String createdAtColumn;
  private final String relaxDurability;
  private final String restoreDurability;

  SqlDialect(String identityColumn, String createdAtColumn, String relaxDurability, String restoreDurability) {
    this.identityColumn = identityColumn;
    this.createdAtColumn = createdAtColumn;
    this.relaxDurability = relaxDurability;
    this.restoreDurability = restoreDurability;
  }

  /**
   * Определяет диалект по JDBC URL.
   *
   * @throws IllegalArgumentException для неподдерживаемой СУБД.
   */
  public static SqlDialect fromUrl(String jdbcUrl) {
    if (jdbcUrl != null) {
      if (jdbcUrl.startsWith("jdbc:sqlite:")) {
        return SQLITE;
      }
      if (jdbcUrl.startsWith("jdbc:postgresql:")) {
        return POSTGRESQL;
      }
    }
    throw new IllegalArgumentException("Неподдерживаемая СУБД: " + jdbcUrl + ". Поддерживаются jdbc:sqlite: и jdbc:postgresql:");
  }

  /**
   * Таблицы только создаются, если их нет: существующие данные никогда не удаляются.
   */
  List<String> schemaStatements() {
    String users = """
        CREATE TABLE IF NOT EXISTS users (
            id %s,
            device_ip TEXT NOT NULL,
            uid INTEGER NOT NULL,
            name TEXT,
            privilege TEXT,
            password TEXT,
            group_id TEXT,
            user_id TEXT,
            card TEXT,
            synced_at %s,
            UNIQUE (device_ip, uid)
        )
        """.formatted(identityColumn, createdAtColumn);
    String attendance = """
        CREATE TABLE IF NOT EXISTS attendance (
            id %s,
            device_ip TEXT NOT NULL,
            uid INTEGER,
            user_id TEXT NOT NULL,
            name TEXT,
            timestamp TEXT NOT NULL,
            status INTEGER,
            punch INTEGER,
            imported_at %s,
            UNIQUE (device_ip, user_id, timestamp)
        )
        """.formatted(identityColumn, createdAtColumn);
    return List.of(users, attendance);
  }

  String relaxDurabilityStatement() {
    return relaxDurability;
  }

  String restoreDurabilityStatement() {
    return restoreDurability;
  }
}
