package com.timeclock.db;

import com.timeclock.model.AttendanceRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Тесты таблицы attendance на файловой SQLite.
 * <p>
 * Проверяют идемпотентность повторной загрузки и изоляцию ошибок по пачкам.
 */
class AttendanceDaoTest {

  private static final String IP = "10.0.0.5";

  @TempDir
  Path tempDir;

  private DatabaseConnection database;

  @BeforeEach
  void setUp() {
    database = new DatabaseConnection("jdbc:sqlite:" + tempDir.resolve("attendance.db"), null, null);
    database.initializeDatabase();
  }

  @Test
  @DisplayName("Повторная загрузка того же журнала не добавляет строк")
  void shouldBeIdempotentOnResync() {
    AttendanceDao dao = new AttendanceDao(database, 1000);
    List<AttendanceRow> rows = rows(IP, 250);

    SaveSummary first = dao.appendAttendance(rows);
    SaveSummary second = dao.appendAttendance(rows);

    assertThat(first.getInserted()).isEqualTo(250);
    assertThat(second.getInserted()).isZero();
    assertThat(second.getDuplicates()).isEqualTo(250);
    assertThat(second.getErrors()).isZero();
    assertThat(dao.countByDevice(IP)).isEqualTo(250);
  }

  @Test
  @DisplayName("1000 записей с одним точным дубликатом ключа → 999 строк, дубликат не ошибка и не пропуск")
  void shouldIgnoreDuplicateKeyInsideBatch() {
    AttendanceDao dao = new AttendanceDao(database, 1000);
    List<AttendanceRow> rows = rows(IP, 999);
    AttendanceRow original = rows.get(500);
    rows.add(new AttendanceRow(IP, original.getUid(), original.getUserId(), "Другое имя",
        original.getTimestamp(), 1, 15));

    SaveSummary summary = dao.appendAttendance(rows);

    assertThat(summary.getInserted()).isEqualTo(999);
    assertThat(summary.getDuplicates()).isEqualTo(1);
    assertThat(summary.getSkipped()).isZero();
    assertThat(summary.getErrors()).isZero();
    assertThat(dao.countByDevice(IP)).isEqualTo(999);
  }

  @Test
  @DisplayName("Ошибка в одной пачке не откатывает предыдущие и не мешает следующим")
  void shouldContainFailureToSingleChunk() {
    AttendanceDao dao = new AttendanceDao(database, 10);
    List<AttendanceRow> rows = rows(IP, 30);
    // user_id NOT NULL: вторая пачка [10..20) целиком отвергается
    rows.set(15, new AttendanceRow(IP, 15, null, "", "2024-01-01 08:15:00", 0, 0));

    SaveSummary summary = dao.appendAttendance(rows);

    assertThat(summary.getErrors()).isEqualTo(10);
    assertThat(summary.getInserted()).isEqualTo(20);
    assertThat(dao.countByDevice(IP)).isEqualTo(20);
    assertThat(dao.findByUser(IP, "E0005")).hasSize(1);
    assertThat(dao.findByUser(IP, "E0012")).isEmpty();
    assertThat(dao.findByUser(IP, "E0025")).hasSize(1);
  }

  @Test
  @DisplayName("Одинаковая отметка с разных терминалов — это разные строки")
  void shouldKeyRowsByDevice() {
    AttendanceDao dao = new AttendanceDao(database, 1000);

    dao.appendAttendance(rows(IP, 5));
    dao.appendAttendance(rows("10.0.0.6", 5));

    assertThat(dao.countByDevice(IP)).isEqualTo(5);
    assertThat(dao.countByDevice("10.0.0.6")).isEqualTo(5);
  }

  @Test
  @DisplayName("Повторная инициализация схемы не удаляет данные")
  void shouldKeepDataWhenSchemaInitializedAgain() {
    AttendanceDao dao = new AttendanceDao(database, 1000);
    dao.appendAttendance(rows(IP, 3));

    database.initializeDatabase();

    assertThat(dao.countByDevice(IP)).isEqualTo(3);
  }

  @Test
  @DisplayName("Имя и коды сохраняются как есть")
  void shouldPersistEnrichedRow() {
    AttendanceDao dao = new AttendanceDao(database, 1000);
    dao.appendAttendance(List.of(new AttendanceRow(IP, 7, "01337", "Nguyen Huy Vinh", "2024-03-05 07:59:01", 1, 4)));

    List<AttendanceRow> stored = dao.findByUser(IP, "01337");

    assertThat(stored).hasSize(1);
    AttendanceRow row = stored.get(0);
    assertThat(row.getUid()).isEqualTo(7);
    assertThat(row.getName()).isEqualTo("Nguyen Huy Vinh");
    assertThat(row.getTimestamp()).isEqualTo("2024-03-05 07:59:01");
    assertThat(row.getStatus()).isEqualTo(1);
    assertThat(row.getPunch()).isEqualTo(4);
  }

  @Test
  @DisplayName("Пустой список — пустой итог без обращения к БД")
  void shouldReturnEmptySummaryForEmptyInput() {
    SaveSummary summary = new AttendanceDao(database, 1000).appendAttendance(List.of());

    assertThat(summary.getInserted()).isZero();
    assertThat(summary.getErrors()).isZero();
  }

  @Test
  @DisplayName("Строгая запись ослабляется один раз до первой пачки и возвращается после последней")
  void shouldRelaxDurabilityAroundWholeLoad() throws Exception {
    DatabaseConnection spied = spy(database);
    AtomicInteger rowsAtRelax = new AtomicInteger(-1);
    AtomicInteger rowsAtRestore = new AtomicInteger(-1);
    trackDurability(spied, rowsAtRelax, rowsAtRestore);

    SaveSummary summary = new AttendanceDao(spied, 10).appendAttendance(rows(IP, 30));

    assertThat(summary.getInserted()).isEqualTo(30);
    verify(spied, times(1)).relaxDurability(any());
    verify(spied, times(1)).restoreDurability(any());
    assertThat(rowsAtRelax.get()).isZero();
    assertThat(rowsAtRestore.get()).isEqualTo(30);
  }

  @Test
  @DisplayName("Строгая запись возвращается и тогда, когда одна из пачек не записалась")
  void shouldRestoreDurabilityAfterFailedChunk() throws Exception {
    DatabaseConnection spied = spy(database);
    AtomicInteger rowsAtRelax = new AtomicInteger(-1);
    AtomicInteger rowsAtRestore = new AtomicInteger(-1);
    trackDurability(spied, rowsAtRelax, rowsAtRestore);
    List<AttendanceRow> rows = rows(IP, 30);
    rows.set(25, new AttendanceRow(IP, 25, null, "", "2024-01-01 08:25:00", 0, 0));

    SaveSummary summary = new AttendanceDao(spied, 10).appendAttendance(rows);

    assertThat(summary.getErrors()).isEqualTo(10);
    verify(spied, times(1)).relaxDurability(any());
    verify(spied, times(1)).restoreDurability(any());
    assertThat(rowsAtRelax.get()).isZero();
    assertThat(rowsAtRestore.get()).isEqualTo(20);
  }

  @Test
  @DisplayName("Склейка пачек в PostgreSQL: драйвер не сообщает число строк")
  void shouldDetectDriversWithoutBatchRowCounts() {
    assertThat(database.reportsBatchRowCounts()).isTrue();
    assertThat(new DatabaseConnection("jdbc:postgresql://db:5432/timeclock", "u", "p").reportsBatchRowCounts())
        .isTrue();
    assertThat(new DatabaseConnection("jdbc:postgresql://db:5432/timeclock?reWriteBatchedInserts=true", "u", "p")
        .reportsBatchRowCounts()).isFalse();
  }

  /**
   * Запоминает число строк в таблице в момент ослабления и возврата строгой записи.
   */
  private void trackDurability(DatabaseConnection spied, AtomicInteger rowsAtRelax, AtomicInteger rowsAtRestore)
      throws Exception {
    AttendanceDao reader = new AttendanceDao(database, 1000);
    doAnswer(invocation -> {
      rowsAtRelax.set(reader.countByDevice(IP));
      return invocation.callRealMethod();
    }).when(spied).relaxDurability(any());
    doAnswer(invocation -> {
      rowsAtRestore.set(reader.countByDevice(IP));
      return invocation.callRealMethod();
    }).when(spied).restoreDurability(any());
  }

  static List<AttendanceRow> rows(String ip, int count) {
    List<AttendanceRow> rows = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      String userId = String.format("E%04d", i);
      String timestamp = String.format("2024-01-01 %02d:%02d:%02d", 8 + i / 3600, (i / 60) % 60, i % 60);
      rows.add(new AttendanceRow(ip, i, userId, "User " + i, timestamp, 0, 0));
    }
    return rows;
  }
}
