package com.timeclock.db;

import com.timeclock.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Класс для управления соединением с локальным хранилищем и инициализации таблиц.
 * <p>
 * Поддерживаются SQLite (по умолчанию, файл zkteco.db) и PostgreSQL;
 * диалект определяется по JDBC URL. Каждая операция DAO открывает своё соединение.
 */
public class DatabaseConnection {

  private static final Logger logger = LoggerFactory.getLogger(DatabaseConnection.class);

  static final String DEFAULT_URL = "jdbc:sqlite:zkteco.db";

  private final String url;
  private final String user;
  private final String password;
  private final SqlDialect dialect;

  public DatabaseConnection(String url, String user, String password) {
    if (url == null || url.trim().isEmpty()) {
      throw new IllegalArgumentException("Параметр 'db.url' не задан");
    }
    this.url = url.trim();
    this.user = user;
    this.password = password;
    this.dialect = SqlDialect.fromUrl(this.url);
  }

  /**
   * Соединение по параметрам db.url, db.user, db.password из application.properties
   * (или системных свойств).
   */
  public static DatabaseConnection fromConfig() {
    return new DatabaseConnection(
        Config.getProperty("db.url", DEFAULT_URL),
        Config.getProperty("db.user", null),
        Config.getProperty("db.password", null)
    );
  }

  public SqlDialect getDialect() {
    return dialect;
  }

  public String getUrl() {
    return url;
  }

  /**
   * Создаёт новое соединение с базой данных.
   * @return Новое соединение; закрывает вызывающий.
   * @throws SQLException если подключение не удалось.
   */
  public Connection getConnection() throws SQLException {
    Connection conn = DriverManager.getConnection(url, user, password);
    logger.debug("Подключение к БД {} открыто", url);
    return conn;
  }

  /**
   * Инициализирует базу данных: создаёт таблицы users и attendance, если они отсутствуют.
   * Повторный вызов безопасен, существующие данные не затрагиваются.
   * @throws StorageException если не удалось подключиться или создать таблицы.
   */
  public void initializeDatabase() {
    try (Connection conn = getConnection();
         Statement stmt = conn.createStatement()) {
      for (String ddl : dialect.schemaStatements()) {
        stmt.execute(ddl);
      }
      logger.info("✅ Таблицы 'users' и 'attendance' созданы или уже существуют ({})", url);
    } catch (SQLException e) {
      throw new StorageException(
          "Не удалось инициализировать базу данных " + url
              + ". Проверьте, что хранилище доступно и параметры подключения верны.",
          e
      );
    }
  }

  /**
   * Сообщает ли драйвер число строк по каждому оператору пачки.
   * PostgreSQL с {@code reWriteBatchedInserts=true} склеивает пачку в один INSERT
   * и отвечает {@link Statement#SUCCESS_NO_INFO}, по которому вставку не отличить от дубликата.
   */
  public boolean reportsBatchRowCounts() {
    return !(dialect == SqlDialect.POSTGRESQL
        && url.toLowerCase(Locale.ROOT).contains("rewritebatchedinserts=true"));
  }

  /**
   * Ослабляет гарантии записи на диск для текущего соединения на время массовой загрузки.
   * Вызывать в режиме autocommit.
   */
  void relaxDurability(Connection conn) throws SQLException {
    try (Statement stmt = conn.createStatement()) {
      stmt.execute(dialect.relaxDurabilityStatement());
    }
  }

  /**
   * Возвращает строгую запись на диск. Ошибка только логируется: соединение всё равно
   * закрывается следом, а настройка действует лишь в его пределах.
   */
  void restoreDurability(Connection conn) {
    try (Statement stmt = conn.createStatement()) {
      stmt.execute(dialect.restoreDurabilityStatement());
    } catch (SQLException e) {
      logger.warn("Не удалось вернуть строгий режим записи для {}: {}", url, e.getMessage());
    }
  }
}
