package com.timeclock.service;

import com.timeclock.model.AttendanceEvent;

import java.util.Collections;
import java.util.List;

/**
 * Полностью нормализованный журнал одного терминала: принятые отметки и счётчики отброшенных.
 */
public final class AttendanceBatch {

  private final List<AttendanceEvent> events;
  private final int skipped;
  private final int errors;

  AttendanceBatch(List<AttendanceEvent> events, int skipped, int errors) {
    this.events = Collections.unmodifiableList(events);
    this.skipped = skipped;
    this.errors = errors;
  }

  public List<AttendanceEvent> getEvents() {
    return events;
  }

  public int getSkipped() {
    return skipped;
  }

  public int getErrors() {
    return errors;
  }
}
