package com.timeclock.service;

import com.timeclock.db.SaveSummary;
import com.timeclock.model.DeviceDescriptor;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Итог синхронизации одного терминала: либо полученные записи и итог сохранения,
 * либо причина отказа устройства.
 *
 * @param <T> Тип записей (пользователи или отметки).
 */
public final class DeviceSyncResult<T> {

  private final DeviceDescriptor device;
  private final List<T> records;
  private final SaveSummary summary;
  private final String failure;

  private DeviceSyncResult(DeviceDescriptor device, List<T> records, SaveSummary summary, String failure) {
    this.device = Objects.requireNonNull(device, "device");
    this.records = records;
    this.summary = summary;
    this.failure = failure;
  }

  public static <T> DeviceSyncResult<T> success(DeviceDescriptor device, List<T> records, SaveSummary summary) {
    return new DeviceSyncResult<>(device, Collections.unmodifiableList(records), summary, null);
  }

  public static <T> DeviceSyncResult<T> failure(DeviceDescriptor device, String reason) {
    return new DeviceSyncResult<>(device, Collections.emptyList(), SaveSummary.empty(),
        reason == null ? "неизвестная ошибка" : reason);
  }

  public DeviceDescriptor getDevice() {
    return device;
  }

  public boolean isSuccess() {
    return failure == null;
  }

  /**
   * Записи, полученные с терминала (пусто при отказе).
   */
  public List<T> getRecords() {
    return records;
  }

  public SaveSummary getSummary() {
    return summary;
  }

  /**
   * Причина отказа; {@code null} при успехе.
   */
  public String getFailure() {
    return failure;
  }

  @Override
  public String toString() {
    return isSuccess()
        ? device + ": " + records.size() + " записей, " + summary
        : device + ": ошибка — " + failure;
  }
}
