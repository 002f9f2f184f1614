package com.timeclock.service;

import com.timeclock.device.RawAttendanceRecord;
import com.timeclock.device.RawUserRecord;
import com.timeclock.model.AttendanceEvent;
import com.timeclock.model.Privilege;
import com.timeclock.model.UserRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Приводит сырые записи терминала к типизированному виду.
 * <p>
 * Некорректные числовые поля (uid, status, punch) молча заменяются на 0 и не считаются ни
 * ошибкой, ни пропуском. Отметка без user_id или без времени отбрасывается (skip).
 * Любой другой сбой разбора — ошибка записи (error).
 */
public class RecordNormalizer {

  private static final Logger logger = LoggerFactory.getLogger(RecordNormalizer.class);

  /** Сколько ошибок записей выводить подробно, чтобы не засорять лог. */
  static final int VERBOSE_ERROR_LIMIT = 3;

  public NormalizedAttendance normalizeAttendance(RawAttendanceRecord raw) {
    try {
      String userId = raw.userId().map(String::trim).orElse("");
      if (userId.isEmpty()) {
        return NormalizedAttendance.skipped("нет user_id");
      }
      String timestamp = raw.timestamp().map(String::trim).orElse("");
      if (timestamp.isEmpty()) {
        return NormalizedAttendance.skipped("нет времени отметки");
      }
      int uid = toIntOrZero(raw.uid().orElse(null));
      int status = toIntOrZero(raw.status().orElse(null));
      int punch = toIntOrZero(raw.punch().orElse(null));
      return NormalizedAttendance.accepted(new AttendanceEvent(uid, userId, timestamp, status, punch));
    } catch (RuntimeException e) {
      return NormalizedAttendance.errored(e.getClass().getSimpleName() + ": " + e.getMessage());
    }
  }

  /**
   * Приводит событие live capture к типизированному виду без правила пропуска:
   * на экран оператора попадает любое событие, даже без user_id или времени.
   * Отсутствующие строки становятся пустыми, числа по умолчанию равны 0.
   */
  public AttendanceEvent normalizeLiveEvent(RawAttendanceRecord raw) {
    return new AttendanceEvent(
        toIntOrZero(raw.uid().orElse(null)),
        raw.userId().map(String::trim).orElse(""),
        raw.timestamp().map(String::trim).orElse(""),
        toIntOrZero(raw.status().orElse(null)),
        toIntOrZero(raw.punch().orElse(null))
    );
  }

  /**
   * Нормализует весь журнал терминала до того, как что-либо попадёт в хранилище.
   */
  public AttendanceBatch normalizeAttendanceBatch(List<RawAttendanceRecord> raws) {
    List<AttendanceEvent> events = new ArrayList<>(raws.size());
    int skipped = 0;
    int errors = 0;
    for (int idx = 0; idx < raws.size(); idx++) {
      NormalizedAttendance result = normalizeAttendance(raws.get(idx));
      switch (result.getOutcome()) {
        case ACCEPTED:
          events.add(result.getEvent());
          break;
        case SKIPPED:
          skipped++;
          break;
        default:
          errors++;
          if (errors <= VERBOSE_ERROR_LIMIT) {
            logger.warn("⚠️ Ошибка записи #{}: {}", idx, abbreviate(result.getReason()));
          }
      }
    }
    if (errors > VERBOSE_ERROR_LIMIT) {
      logger.warn("⚠️ Ещё {} ошибочных записей не показано", errors - VERBOSE_ERROR_LIMIT);
    }
    return new AttendanceBatch(events, skipped, errors);
  }

  /**
   * Никогда не падает: отсутствующие поля заменяются пустой строкой или нулём.
   * Права администратора — при коде привилегии не ниже {@link Privilege#ADMIN}.
   */
  public UserRecord normalizeUser(RawUserRecord raw) {
    return new UserRecord(
        toIntOrZero(raw.uid().orElse(null)),
        raw.userId().map(String::trim).orElse(""),
        raw.name().orElse(""),
        Privilege.fromCode(raw.privilege().orElse(Privilege.DEFAULT.code())),
        raw.password().orElse(""),
        raw.groupId().map(String::trim).orElse(""),
        toLongOrZero(raw.card().orElse(null))
    );
  }

  public List<UserRecord> normalizeUsers(List<RawUserRecord> raws) {
    List<UserRecord> users = new ArrayList<>(raws.size());
    for (RawUserRecord raw : raws) {
      users.add(normalizeUser(raw));
    }
    return users;
  }

  static int toIntOrZero(String value) {
    if (value == null) {
      return 0;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  static long toLongOrZero(String value) {
    if (value == null) {
      return 0;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  private static String abbreviate(String text) {
    if (text == null) {
      return "";
    }
    return text.length() > 100 ? text.substring(0, 100) : text;
  }
}
