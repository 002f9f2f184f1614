package com.timeclock.service;

/**
 * Итог сеанса live capture.
 */
public final class CaptureSummary {

  public enum StopReason {
    /** Оператор запросил остановку — штатное завершение. */
    CANCELLED,
    /** Терминал закрыл поток. */
    STREAM_CLOSED,
    /** Связь с терминалом потеряна или поток не удалось открыть. */
    DEVICE_ERROR
  }

  private final int events;
  private final int timeouts;
  private final StopReason stopReason;
  private final String failure;

  CaptureSummary(int events, int timeouts, StopReason stopReason, String failure) {
    this.events = events;
    this.timeouts = timeouts;
    this.stopReason = stopReason;
    this.failure = failure;
  }

  /**
   * Сколько событий передано получателю.
   */
  public int getEvents() {
    return events;
  }

  public int getTimeouts() {
    return timeouts;
  }

  public StopReason getStopReason() {
    return stopReason;
  }

  /**
   * Причина при {@link StopReason#DEVICE_ERROR}, иначе {@code null}.
   */
  public String getFailure() {
    return failure;
  }

  @Override
  public String toString() {
    return "CaptureSummary{events=" + events + ", timeouts=" + timeouts
        + ", stop=" + stopReason + (failure != null ? ", failure=" + failure : "") + "}";
  }
}
