package com.timeclock.db;

import com.timeclock.config.Config;
import com.timeclock.model.AttendanceRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO-класс для операций с таблицей attendance.
 * <p>
 * Отметка однозначно определяется тройкой (device_ip, user_id, timestamp) и после
 * записи не меняется: повторная синхронизация того же журнала ничего не добавляет.
 * Две отметки одного сотрудника в одну и ту же секунду на одном терминале
 * (например, двойное считывание прошивкой) сохраняются как одна.
 */
public class AttendanceDao {

  private static final Logger logger = LoggerFactory.getLogger(AttendanceDao.class);

  public static final int DEFAULT_CHUNK_SIZE = 1000;

  /** Сколько ошибок пачек выводить подробно; остальные только считаются. */
  private static final int VERBOSE_ERROR_LIMIT = 3;

  private static final String INSERT_SQL = """
      INSERT INTO attendance (device_ip, uid, user_id, name, timestamp, status, punch)
      VALUES (?, ?, ?, ?, ?, ?, ?)
      ON CONFLICT (device_ip, user_id, timestamp) DO NOTHING
      """;

  private final DatabaseConnection database;
  private final int chunkSize;

  public AttendanceDao(DatabaseConnection database) {
    this(database, Config.getIntProperty("store.chunk-size", DEFAULT_CHUNK_SIZE));
  }

  public AttendanceDao(DatabaseConnection database, int chunkSize) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("Размер пачки должен быть положительным: " + chunkSize);
    }
    this.database = database;
    this.chunkSize = chunkSize;
  }

  public int getChunkSize() {
    return chunkSize;
  }

  /**
   * Добавляет отметки пачками по {@link #getChunkSize()} строк, каждая пачка — отдельная транзакция.
   * <p>
   * Пачка, которую не удалось записать, откатывается целиком, её размер добавляется к errors,
   * следующие пачки всё равно записываются. Гарантии записи на диск ослаблены на всё время
   * вызова и возвращаются только после последней пачки: прерывание посреди загрузки может
   * потерять текущую пачку, но не затрагивает уже зафиксированные.
   * <p>
   * Вставленные строки считаются по ответу драйвера на пачку. Если драйвер не сообщает
   * число строк ({@link DatabaseConnection#reportsBatchRowCounts()}), inserted считается
   * как прирост COUNT(*) таблицы внутри транзакции пачки. Прочие драйверы, отвечающие
   * {@link Statement#SUCCESS_NO_INFO}, засчитывают такую строку как вставленную.
   *
   * @param rows Строки для записи (уже нормализованные и с именами).
   * @return Итог: inserted, duplicates (проигнорированы ограничением уникальности), errors.
   */
  public SaveSummary appendAttendance(List<AttendanceRow> rows) {
    if (rows.isEmpty()) {
      return SaveSummary.empty();
    }
    int inserted = 0;
    int duplicates = 0;
    int errors = 0;
    int failedChunks = 0;

    boolean countByDelta = !database.reportsBatchRowCounts();
    logger.info("Начинаем сохранение {} отметок (пачки по {})", rows.size(), chunkSize);
    try (Connection conn = database.getConnection()) {
      database.relaxDurability(conn);
      try {
        conn.setAutoCommit(false);
        try (PreparedStatement pstmt = conn.prepareStatement(INSERT_SQL)) {
          for (int from = 0; from < rows.size(); from += chunkSize) {
            List<AttendanceRow> chunk = rows.subList(from, Math.min(from + chunkSize, rows.size()));
            try {
              long before = countByDelta ? countAll(conn) : 0;
              int written = insertChunk(pstmt, chunk);
              if (countByDelta) {
                written = (int) (countAll(conn) - before);
              }
              conn.commit();
              inserted += written;
              duplicates += chunk.size() - written;
              logger.info("Прогресс: {} из {} отметок обработано", from + chunk.size(), rows.size());
            } catch (SQLException e) {
              UserDao.rollbackQuietly(conn);
              pstmt.clearBatch();
              errors += chunk.size();
              failedChunks++;
              if (failedChunks <= VERBOSE_ERROR_LIMIT) {
                logger.warn("⚠️ Ошибка пачки [{}..{}): {}", from, from + chunk.size(), e.getMessage());
              }
            }
          }
        } finally {
          conn.setAutoCommit(true);
        }
      } finally {
        database.restoreDurability(conn);
      }
    } catch (SQLException e) {
      // соединение потеряно: всё, что не успели зафиксировать, — ошибки
      int unprocessed = rows.size() - inserted - duplicates - errors;
      errors += unprocessed;
      logger.error("❌ Ошибка соединения с БД при сохранении отметок", e);
    }

    SaveSummary summary = new SaveSummary(inserted, duplicates, 0, errors);
    if (failedChunks > VERBOSE_ERROR_LIMIT) {
      logger.warn("⚠️ Ещё {} пачек с ошибками не показано", failedChunks - VERBOSE_ERROR_LIMIT);
    }
    logger.info("✅ Сохранение отметок завершено: {}", summary);
    return summary;
  }

  private int insertChunk(PreparedStatement pstmt, List<AttendanceRow> chunk) throws SQLException {
    for (AttendanceRow row : chunk) {
      pstmt.setString(1, row.getDeviceIp());
      pstmt.setInt(2, row.getUid());
      pstmt.setString(3, row.getUserId());
      pstmt.setString(4, row.getName());
      pstmt.setString(5, row.getTimestamp());
      pstmt.setInt(6, row.getStatus());
      pstmt.setInt(7, row.getPunch());
      pstmt.addBatch();
    }
    int written = 0;
    for (int count : pstmt.executeBatch()) {
      // драйвер может не сообщить число строк: считаем такую строку записанной
      if (count > 0 || count == Statement.SUCCESS_NO_INFO) {
        written++;
      }
    }
    return written;
  }

  private static long countAll(Connection conn) throws SQLException {
    try (Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM attendance")) {
      rs.next();
      return rs.getLong(1);
    }
  }

  public int countByDevice(String deviceIp) {
    String sql = "SELECT COUNT(*) FROM attendance WHERE device_ip = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceIp);
      try (ResultSet rs = pstmt.executeQuery()) {
        rs.next();
        return rs.getInt(1);
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось посчитать отметки терминала " + deviceIp, e);
    }
  }

  /**
   * Отметки сотрудника на терминале в хронологическом порядке.
   */
  public List<AttendanceRow> findByUser(String deviceIp, String userId) {
    String sql = "SELECT device_ip, uid, user_id, name, timestamp, status, punch FROM attendance "
        + "WHERE device_ip = ? AND user_id = ? ORDER BY timestamp";
    List<AttendanceRow> rows = new ArrayList<>();
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, deviceIp);
      pstmt.setString(2, userId);
      try (ResultSet rs = pstmt.executeQuery()) {
        while (rs.next()) {
          rows.add(new AttendanceRow(
              rs.getString("device_ip"),
              rs.getInt("uid"),
              rs.getString("user_id"),
              rs.getString("name"),
              rs.getString("timestamp"),
              rs.getInt("status"),
              rs.getInt("punch")
          ));
        }
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать отметки " + userId + " на терминале " + deviceIp, e);
    }
    return rows;
  }
}
