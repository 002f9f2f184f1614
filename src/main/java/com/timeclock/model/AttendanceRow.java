package com.timeclock.model;

/**
 * Строка таблицы attendance: отметка, привязанная к терминалу и дополненная именем.
 * Ключ уникальности — (deviceIp, userId, timestamp).
 */
public final class AttendanceRow {

  private final String deviceIp;
  private final int uid;
  private final String userId;
  private final String name;
  private final String timestamp;
  private final int status;
  private final int punch;

  public AttendanceRow(String deviceIp, int uid, String userId, String name,
                       String timestamp, int status, int punch) {
    this.deviceIp = deviceIp;
    this.uid = uid;
    this.userId = userId;
    this.name = name;
    this.timestamp = timestamp;
    this.status = status;
    this.punch = punch;
  }

  public static AttendanceRow of(String deviceIp, AttendanceEvent event, String name) {
    return new AttendanceRow(deviceIp, event.getUid(), event.getUserId(), name,
        event.getTimestamp(), event.getStatusCode(), event.getPunch());
  }

  public String getDeviceIp() {
    return deviceIp;
  }

  public int getUid() {
    return uid;
  }

  public String getUserId() {
    return userId;
  }

  public String getName() {
    return name;
  }

  public String getTimestamp() {
    return timestamp;
  }

  public int getStatus() {
    return status;
  }

  public int getPunch() {
    return punch;
  }

  @Override
  public String toString() {
    return "AttendanceRow{" + deviceIp + ", " + userId + ", " + timestamp + "}";
  }
}
