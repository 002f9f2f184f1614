package com.timeclock.service;

import com.timeclock.device.DeviceInfo;
import com.timeclock.model.DeviceDescriptor;

import java.util.Objects;

/**
 * Снимок сведений об одном терминале парка. При отказе сведения пусты, а причина
 * записана в {@link #getError()}.
 */
public final class DeviceSnapshot {

  private final DeviceDescriptor device;
  private final DeviceInfo info;
  private final String error;

  private DeviceSnapshot(DeviceDescriptor device, DeviceInfo info, String error) {
    this.device = Objects.requireNonNull(device, "device");
    this.info = info;
    this.error = error;
  }

  public static DeviceSnapshot success(DeviceDescriptor device, DeviceInfo info) {
    return new DeviceSnapshot(device, info, "");
  }

  public static DeviceSnapshot failure(DeviceDescriptor device, String error) {
    return new DeviceSnapshot(device, DeviceInfo.empty(), error);
  }

  public DeviceDescriptor getDevice() {
    return device;
  }

  public DeviceInfo getInfo() {
    return info;
  }

  /**
   * Причина отказа; пустая строка при успехе.
   */
  public String getError() {
    return error;
  }

  public boolean isSuccess() {
    return error.isEmpty();
  }

  @Override
  public String toString() {
    return isSuccess() ? device + ": " + info.get("Serial Number") : device + ": ошибка — " + error;
  }
}
