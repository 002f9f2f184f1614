package com.timeclock.service;

import com.timeclock.model.AttendanceEvent;

/**
 * Результат нормализации одной сырой отметки.
 */
public final class NormalizedAttendance {

  public enum Outcome {
    /** Запись пригодна для сохранения. */
    ACCEPTED,
    /** Нет обязательного поля (user_id или время): запись отброшена. */
    SKIPPED,
    /** Непредвиденный сбой при разборе записи. */
    ERRORED
  }

  private final Outcome outcome;
  private final AttendanceEvent event;
  private final String reason;

  private NormalizedAttendance(Outcome outcome, AttendanceEvent event, String reason) {
    this.outcome = outcome;
    this.event = event;
    this.reason = reason;
  }

  static NormalizedAttendance accepted(AttendanceEvent event) {
    return new NormalizedAttendance(Outcome.ACCEPTED, event, null);
  }

  static NormalizedAttendance skipped(String reason) {
    return new NormalizedAttendance(Outcome.SKIPPED, null, reason);
  }

  static NormalizedAttendance errored(String reason) {
    return new NormalizedAttendance(Outcome.ERRORED, null, reason);
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public boolean isAccepted() {
    return outcome == Outcome.ACCEPTED;
  }

  /**
   * @throws IllegalStateException если запись не принята.
   */
  public AttendanceEvent getEvent() {
    if (event == null) {
      throw new IllegalStateException("Запись не принята: " + outcome + " (" + reason + ")");
    }
    return event;
  }

  public String getReason() {
    return reason;
  }
}
