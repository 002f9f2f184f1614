package com.timeclock.device;

import java.util.Objects;

/**
 * Один шаг потока live capture: событие, таймаут чтения или конец потока.
 */
public final class CaptureSignal {

  public enum Kind {
    EVENT,
    TIMEOUT,
    CLOSED
  }

  private static final CaptureSignal TIMEOUT = new CaptureSignal(Kind.TIMEOUT, null);
  private static final CaptureSignal CLOSED = new CaptureSignal(Kind.CLOSED, null);

  private final Kind kind;
  private final RawAttendanceRecord record;

  private CaptureSignal(Kind kind, RawAttendanceRecord record) {
    this.kind = kind;
    this.record = record;
  }

  public static CaptureSignal event(RawAttendanceRecord record) {
    return new CaptureSignal(Kind.EVENT, Objects.requireNonNull(record, "record"));
  }

  public static CaptureSignal timeout() {
    return TIMEOUT;
  }

  public static CaptureSignal closed() {
    return CLOSED;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * @throws IllegalStateException если сигнал не является событием.
   */
  public RawAttendanceRecord getRecord() {
    if (kind != Kind.EVENT) {
      throw new IllegalStateException("Сигнал " + kind + " не содержит события");
    }
    return record;
  }

  @Override
  public String toString() {
    return kind == Kind.EVENT ? "EVENT(" + record + ")" : kind.name();
  }
}
