package com.timeclock.model;

import java.util.Objects;

/**
 * Нормализованная отметка прихода/ухода.
 * <p>
 * Время — локальное время терминала в виде строки "yyyy-MM-dd HH:mm:ss",
 * часовой пояс не гарантируется и не домысливается.
 */
public final class AttendanceEvent {

  private final int uid;
  private final String userId;
  private final String timestamp;
  private final int statusCode;
  private final int punch;

  public AttendanceEvent(int uid, String userId, String timestamp, int statusCode, int punch) {
    this.uid = uid;
    this.userId = Objects.requireNonNull(userId, "userId");
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    this.statusCode = statusCode;
    this.punch = punch;
  }

  public int getUid() {
    return uid;
  }

  public String getUserId() {
    return userId;
  }

  public String getTimestamp() {
    return timestamp;
  }

  /**
   * Код статуса в том виде, в каком его прислал терминал (хранится в БД без изменений).
   */
  public int getStatusCode() {
    return statusCode;
  }

  public AttendanceStatus getStatus() {
    return AttendanceStatus.fromCode(statusCode);
  }

  public int getPunch() {
    return punch;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof AttendanceEvent)) return false;
    AttendanceEvent that = (AttendanceEvent) o;
    return uid == that.uid
        && statusCode == that.statusCode
        && punch == that.punch
        && userId.equals(that.userId)
        && timestamp.equals(that.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uid, userId, timestamp, statusCode, punch);
  }

  @Override
  public String toString() {
    return "AttendanceEvent{uid=" + uid + ", userId='" + userId + "', timestamp='" + timestamp
        + "', status=" + getStatus() + ", punch=" + punch + "}";
  }
}
