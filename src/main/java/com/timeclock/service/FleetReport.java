package com.timeclock.service;

import com.timeclock.db.SaveSummary;
import com.timeclock.model.DeviceDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Отчёт об обходе парка терминалов.
 * <p>
 * Содержит результат по каждому устройству в порядке обхода; отказавшие устройства
 * перечислены с именем, IP и причиной.
 */
public final class FleetReport {

  /**
   * Отказавшее устройство.
   */
  public static final class FailedDevice {
    private final String name;
    private final String ip;
    private final String reason;

    FailedDevice(String name, String ip, String reason) {
      this.name = name;
      this.ip = ip;
      this.reason = reason;
    }

    public String getName() {
      return name;
    }

    public String getIp() {
      return ip;
    }

    public String getReason() {
      return reason;
    }

    @Override
    public String toString() {
      return name + " (" + ip + ")";
    }
  }

  private final SyncKind kind;
  private final List<DeviceSyncResult<?>> results;

  FleetReport(SyncKind kind, List<DeviceSyncResult<?>> results) {
    this.kind = kind;
    this.results = Collections.unmodifiableList(new ArrayList<>(results));
  }

  public SyncKind getKind() {
    return kind;
  }

  public int getAttempted() {
    return results.size();
  }

  public int getSucceeded() {
    int count = 0;
    for (DeviceSyncResult<?> result : results) {
      if (result.isSuccess()) {
        count++;
      }
    }
    return count;
  }

  public List<FailedDevice> getFailedDevices() {
    List<FailedDevice> failed = new ArrayList<>();
    for (DeviceSyncResult<?> result : results) {
      if (!result.isSuccess()) {
        DeviceDescriptor device = result.getDevice();
        failed.add(new FailedDevice(device.displayName(), device.getIp(), result.getFailure()));
      }
    }
    return failed;
  }

  /**
   * Сколько пользователей или отметок получено со всех успешных устройств.
   */
  public int getTotalRecords() {
    int total = 0;
    for (DeviceSyncResult<?> result : results) {
      total += result.getRecords().size();
    }
    return total;
  }

  /**
   * Суммарный итог сохранения по всем устройствам.
   */
  public SaveSummary getStoreSummary() {
    SaveSummary total = SaveSummary.empty();
    for (DeviceSyncResult<?> result : results) {
      total = total.plus(result.getSummary());
    }
    return total;
  }

  public List<DeviceSyncResult<?>> getResults() {
    return results;
  }

  @Override
  public String toString() {
    return "FleetReport{" + kind + ", успешно " + getSucceeded() + "/" + getAttempted()
        + ", записей " + getTotalRecords() + ", отказов " + getFailedDevices().size() + "}";
  }
}
