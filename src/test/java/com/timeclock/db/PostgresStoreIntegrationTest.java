package com.timeclock.db;

import com.timeclock.model.AttendanceRow;
import com.timeclock.model.Privilege;
import com.timeclock.model.UserRecord;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Те же DAO поверх настоящего PostgreSQL. Без Docker тест пропускается.
 */
@Testcontainers(disabledWithoutDocker = true)
class PostgresStoreIntegrationTest {

  @Container
  private static final PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>("postgres:15")
          .withDatabaseName("timeclock_db")
          .withUsername("timeclock_user")
          .withPassword("timeclock_pass");

  private static DatabaseConnection database;

  @BeforeAll
  static void setUp() {
    database = new DatabaseConnection(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    database.initializeDatabase();
    // повторная инициализация не должна падать
    database.initializeDatabase();
  }

  @Test
  @DisplayName("Диалект определяется по URL")
  void shouldDetectPostgresDialect() {
    assertThat(database.getDialect()).isEqualTo(SqlDialect.POSTGRESQL);
  }

  @Test
  @DisplayName("PostgreSQL: повторная загрузка журнала идемпотентна")
  void shouldAppendAttendanceIdempotently() {
    AttendanceDao dao = new AttendanceDao(database, 100);
    List<AttendanceRow> rows = AttendanceDaoTest.rows("10.1.0.1", 250);

    SaveSummary first = dao.appendAttendance(rows);
    SaveSummary second = dao.appendAttendance(rows);

    assertThat(first.getInserted()).isEqualTo(250);
    assertThat(second.getDuplicates()).isEqualTo(250);
    assertThat(dao.countByDevice("10.1.0.1")).isEqualTo(250);
  }

  @Test
  @DisplayName("PostgreSQL: ошибка пачки изолирована")
  void shouldContainFailedChunk() {
    AttendanceDao dao = new AttendanceDao(database, 10);
    List<AttendanceRow> rows = AttendanceDaoTest.rows("10.1.0.2", 30);
    rows.set(3, new AttendanceRow("10.1.0.2", 3, "E0003", "", null, 0, 0));

    SaveSummary summary = dao.appendAttendance(rows);

    assertThat(summary.getErrors()).isEqualTo(10);
    assertThat(dao.countByDevice("10.1.0.2")).isEqualTo(20);
  }

  @Test
  @DisplayName("PostgreSQL со склейкой пачек: дубликаты не засчитываются как вставки")
  void shouldCountDuplicatesWithRewrittenBatches() {
    String url = postgres.getJdbcUrl() + (postgres.getJdbcUrl().contains("?") ? "&" : "?")
        + "reWriteBatchedInserts=true";
    DatabaseConnection rewriting = new DatabaseConnection(url, postgres.getUsername(), postgres.getPassword());
    AttendanceDao dao = new AttendanceDao(rewriting, 100);
    List<AttendanceRow> rows = AttendanceDaoTest.rows("10.1.0.4", 150);

    SaveSummary first = dao.appendAttendance(rows.subList(0, 100));
    SaveSummary second = dao.appendAttendance(rows);

    assertThat(rewriting.reportsBatchRowCounts()).isFalse();
    assertThat(first.getInserted()).isEqualTo(100);
    assertThat(second.getInserted()).isEqualTo(50);
    assertThat(second.getDuplicates()).isEqualTo(100);
  }

  @Test
  @DisplayName("PostgreSQL: пользователь перезаписывается по (device_ip, uid)")
  void shouldUpsertUsers() {
    UserDao dao = new UserDao(database);
    UserRecord user = new UserRecord(1, "0001", "Старое имя", Privilege.DEFAULT, "", "", 0);

    dao.upsertUsers("10.1.0.3", List.of(user));
    dao.upsertUsers("10.1.0.3", List.of(user.withName("Новое имя")));

    assertThat(dao.findByDevice("10.1.0.3")).extracting(UserRecord::getName).containsExactly("Новое имя");
  }
}
