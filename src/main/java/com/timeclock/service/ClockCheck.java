package com.timeclock.service;

import com.timeclock.model.DeviceDescriptor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Итог сверки часов терминала с локальным временем.
 */
public final class ClockCheck {

  /** Расхождение, начиная с которого часы считаются несинхронизированными. */
  public static final Duration MAX_DRIFT = Duration.ofSeconds(120);

  private final DeviceDescriptor device;
  private final LocalDateTime deviceTime;
  private final LocalDateTime localTime;
  private final boolean updated;
  private final String failure;

  private ClockCheck(DeviceDescriptor device, LocalDateTime deviceTime, LocalDateTime localTime,
                     boolean updated, String failure) {
    this.device = device;
    this.deviceTime = deviceTime;
    this.localTime = localTime;
    this.updated = updated;
    this.failure = failure;
  }

  static ClockCheck checked(DeviceDescriptor device, LocalDateTime deviceTime, LocalDateTime localTime,
                            boolean updated) {
    return new ClockCheck(device, deviceTime, localTime, updated, null);
  }

  static ClockCheck failure(DeviceDescriptor device, LocalDateTime localTime, String reason) {
    return new ClockCheck(device, null, localTime, false, reason);
  }

  public DeviceDescriptor getDevice() {
    return device;
  }

  /**
   * Время терминала после сверки (после установки, если она выполнялась).
   */
  public LocalDateTime getDeviceTime() {
    return deviceTime;
  }

  public LocalDateTime getLocalTime() {
    return localTime;
  }

  public boolean isUpdated() {
    return updated;
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public String getFailure() {
    return failure;
  }

  /**
   * Абсолютное расхождение часов; {@link Duration#ZERO} при отказе.
   */
  public Duration getDrift() {
    return deviceTime == null ? Duration.ZERO : Duration.between(deviceTime, localTime).abs();
  }

  public boolean isOutOfSync() {
    return isSuccess() && getDrift().compareTo(MAX_DRIFT) > 0;
  }
}
