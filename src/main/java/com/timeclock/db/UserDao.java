package com.timeclock.db;

import com.timeclock.model.Privilege;
import com.timeclock.model.UserRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO-класс для операций с таблицей users.
 * <p>
 * Строка однозначно определяется парой (device_ip, uid). Последняя синхронизация
 * перезаписывает предыдущую: атрибуты пользователя меняются, актуально последнее состояние.
 */
public class UserDao {

  private static final Logger logger = LoggerFactory.getLogger(UserDao.class);

  private static final String UPSERT_SQL = """
      INSERT INTO users (device_ip, uid, name, privilege, password, group_id, user_id, card, synced_at)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
      ON CONFLICT (device_ip, uid) DO UPDATE SET
          name = excluded.name,
          privilege = excluded.privilege,
          password = excluded.password,
          group_id = excluded.group_id,
          user_id = excluded.user_id,
          card = excluded.card,
          synced_at = CURRENT_TIMESTAMP
      """;

  private final DatabaseConnection database;

  public UserDao(DatabaseConnection database) {
    this.database = database;
  }

  /**
   * Сохраняет список пользователей терминала одной транзакцией.
   * <p>
   * На время загрузки гарантии записи на диск ослаблены и восстанавливаются после неё.
   * Ошибка не выбрасывается наружу: все строки пачки учитываются как errors.
   *
   * @param deviceIp IP терминала, с которого получен список.
   * @param users    Нормализованные пользователи.
   * @return Итог: inserted — число записанных (вставленных или обновлённых) строк.
   */
  public SaveSummary upsertUsers(String deviceIp, List<UserRecord> users) {
    if (users.isEmpty()) {
      return SaveSummary.empty();
    }
    try (Connection conn = database.getConnection()) {
      database.relaxDurability(conn);
      try {
        conn.setAutoCommit(false);
        try (PreparedStatement pstmt = conn.prepareStatement(UPSERT_SQL)) {
          for (UserRecord user : users) {
            pstmt.setString(1, deviceIp);
            pstmt.setInt(2, user.getUid());
            pstmt.setString(3, user.getName());
            pstmt.setString(4, user.getPrivilege().label());
            pstmt.setString(5, user.getPassword());
            pstmt.setString(6, user.getGroupId());
            pstmt.setString(7, user.getUserId());
            pstmt.setString(8, user.cardText());
            pstmt.addBatch();
          }
          pstmt.executeBatch();
          conn.commit();
        } catch (SQLException e) {
          rollbackQuietly(conn);
          logger.error("❌ Не удалось сохранить пользователей терминала {} ({} записей)", deviceIp, users.size(), e);
          return new SaveSummary(0, 0, 0, users.size());
        } finally {
          conn.setAutoCommit(true);
        }
      } finally {
        database.restoreDurability(conn);
      }
    } catch (SQLException e) {
      logger.error("❌ Нет соединения с БД при сохранении пользователей терминала {}", deviceIp, e);
      return new SaveSummary(0, 0, 0, users.size());
    }
    logger.info("✅ Пользователи терминала {} сохранены: {}", deviceIp, users.size());
    return new SaveSummary(users.size(), 0, 0, 0);
  }

  /**
   * Пользователи терминала из БД, упорядоченные по uid.
   */
  public List<UserRecord> findByDevice(String deviceIp) {
    String sql = "SELECT uid, user_id, name, privilege, password, group_id, card FROM users WHERE device_ip = ? ORDER BY uid";
    List<UserRecord> users = new ArrayList<>();
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceIp);
      try (ResultSet rs = pstmt.executeQuery()) {
        while (rs.next()) {
          users.add(new UserRecord(
              rs.getInt("uid"),
              nullToEmpty(rs.getString("user_id")),
              rs.getString("name"),
              Privilege.fromLabel(rs.getString("privilege")),
              rs.getString("password"),
              rs.getString("group_id"),
              parseCard(rs.getString("card"))
          ));
        }
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать пользователей терминала " + deviceIp, e);
    }
    return users;
  }

  public int countByDevice(String deviceIp) {
    String sql = "SELECT COUNT(*) FROM users WHERE device_ip = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceIp);
      try (ResultSet rs = pstmt.executeQuery()) {
        rs.next();
        return rs.getInt(1);
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось посчитать пользователей терминала " + deviceIp, e);
    }
  }

  static void rollbackQuietly(Connection conn) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      logger.warn("Откат транзакции не удался: {}", e.getMessage());
    }
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private static long parseCard(String card) {
    if (card == null || card.isBlank()) {
      return 0;
    }
    try {
      return Long.parseLong(card.trim());
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
