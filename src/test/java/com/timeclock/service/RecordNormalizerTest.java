package com.timeclock.service;

import com.timeclock.device.RawAttendanceRecord;
import com.timeclock.device.RawUserRecord;
import com.timeclock.model.AttendanceEvent;
import com.timeclock.model.AttendanceStatus;
import com.timeclock.model.Privilege;
import com.timeclock.model.UserRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecordNormalizerTest {

  private final RecordNormalizer normalizer = new RecordNormalizer();

  @Test
  @DisplayName("Корректная отметка приводится к типам, строки обрезаются")
  void shouldNormalizeValidAttendance() {
    RawAttendanceRecord raw = RawAttendanceRecord.builder()
        .uid(" 42 ")
        .userId("  01337 ")
        .timestamp(LocalDateTime.of(2024, 3, 5, 7, 59, 1))
        .status(1)
        .punch(4)
        .build();

    NormalizedAttendance result = normalizer.normalizeAttendance(raw);

    assertThat(result.getOutcome()).isEqualTo(NormalizedAttendance.Outcome.ACCEPTED);
    AttendanceEvent event = result.getEvent();
    assertThat(event.getUid()).isEqualTo(42);
    assertThat(event.getUserId()).isEqualTo("01337");
    assertThat(event.getTimestamp()).isEqualTo("2024-03-05 07:59:01");
    assertThat(event.getStatus()).isEqualTo(AttendanceStatus.CHECK_OUT);
    assertThat(event.getPunch()).isEqualTo(4);
  }

  @Test
  @DisplayName("Нечисловые uid/status/punch → 0, запись не считается ни пропуском, ни ошибкой")
  void shouldDefaultMalformedNumbersToZero() {
    RawAttendanceRecord raw = RawAttendanceRecord.builder()
        .uid("abc")
        .userId("0007")
        .timestamp("2024-01-01 09:00:00")
        .status("x")
        .build();

    NormalizedAttendance result = normalizer.normalizeAttendance(raw);

    assertThat(result.isAccepted()).isTrue();
    assertThat(result.getEvent().getUid()).isZero();
    assertThat(result.getEvent().getStatusCode()).isZero();
    assertThat(result.getEvent().getPunch()).isZero();
  }

  @Test
  @DisplayName("Пустой или отсутствующий user_id → SKIPPED")
  void shouldSkipRecordWithoutUserId() {
    RawAttendanceRecord blank = RawAttendanceRecord.builder().uid(1).userId("   ").timestamp("2024-01-01 09:00:00").build();
    RawAttendanceRecord missing = RawAttendanceRecord.builder().uid(1).timestamp("2024-01-01 09:00:00").build();

    assertThat(normalizer.normalizeAttendance(blank).getOutcome()).isEqualTo(NormalizedAttendance.Outcome.SKIPPED);
    assertThat(normalizer.normalizeAttendance(missing).getOutcome()).isEqualTo(NormalizedAttendance.Outcome.SKIPPED);
  }

  @Test
  @DisplayName("Отметка без времени → SKIPPED")
  void shouldSkipRecordWithoutTimestamp() {
    RawAttendanceRecord raw = RawAttendanceRecord.builder().uid(1).userId("0001").build();

    assertThat(normalizer.normalizeAttendance(raw).getOutcome()).isEqualTo(NormalizedAttendance.Outcome.SKIPPED);
  }

  @Test
  @DisplayName("Пустой элемент журнала → ERRORED")
  void shouldReportUnexpectedFailureAsError() {
    NormalizedAttendance result = normalizer.normalizeAttendance(null);

    assertThat(result.getOutcome()).isEqualTo(NormalizedAttendance.Outcome.ERRORED);
    assertThat(result.getReason()).startsWith("NullPointerException");
  }

  @Test
  @DisplayName("Пачка: принятые, пропущенные и ошибочные записи считаются раздельно")
  void shouldTallyBatchOutcomes() {
    List<RawAttendanceRecord> raws = new ArrayList<>(Arrays.asList(
        RawAttendanceRecord.builder().uid(1).userId("0001").timestamp("2024-01-01 08:00:00").build(),
        RawAttendanceRecord.builder().uid("bad").userId("0002").timestamp("2024-01-01 08:01:00").build(),
        RawAttendanceRecord.builder().uid(3).userId("").timestamp("2024-01-01 08:02:00").build()));
    for (int i = 0; i < 5; i++) {
      raws.add(null);
    }

    AttendanceBatch batch = normalizer.normalizeAttendanceBatch(raws);

    assertThat(batch.getEvents()).hasSize(2);
    assertThat(batch.getSkipped()).isEqualTo(1);
    assertThat(batch.getErrors()).isEqualTo(5);
  }

  @Test
  @DisplayName("Пользователь: отсутствующие поля → пустые строки и ноль, сбоев нет")
  void shouldDefaultMissingUserFields() {
    UserRecord user = normalizer.normalizeUser(RawUserRecord.builder().uid("abc").userId("0009").build());

    assertThat(user.getUid()).isZero();
    assertThat(user.getUserId()).isEqualTo("0009");
    assertThat(user.getName()).isEmpty();
    assertThat(user.getPassword()).isEmpty();
    assertThat(user.getGroupId()).isEmpty();
    assertThat(user.getCard()).isZero();
    assertThat(user.getPrivilege()).isEqualTo(Privilege.DEFAULT);
  }

  @Test
  @DisplayName("Привилегия: код администратора и выше → Admin, ниже → обычный пользователь")
  void shouldMapPrivilegeByThreshold() {
    assertThat(normalizer.normalizeUser(RawUserRecord.builder().uid(1).userId("1").privilege(14).build()).getPrivilege())
        .isEqualTo(Privilege.ADMIN);
    assertThat(normalizer.normalizeUser(RawUserRecord.builder().uid(2).userId("2").privilege(3).build()).getPrivilege())
        .isEqualTo(Privilege.DEFAULT);
    assertThat(normalizer.normalizeUser(RawUserRecord.builder().uid(3).userId("3").build()).getPrivilege())
        .isEqualTo(Privilege.DEFAULT);
  }

  @Test
  @DisplayName("Номер карты разбирается, мусор → 0")
  void shouldParseCard() {
    assertThat(normalizer.normalizeUser(RawUserRecord.builder().uid(1).userId("1").card("12345678").build()).getCard())
        .isEqualTo(12345678L);
    assertThat(normalizer.normalizeUser(RawUserRecord.builder().uid(1).userId("1").card("n/a").build()).getCard())
        .isZero();
  }
}
