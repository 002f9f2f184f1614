package com.timeclock.device;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Отметка в том виде, в каком её вернул терминал (журнал или live capture).
 * <p>
 * Поля необязательны; числовые поля приходят строками и могут быть некорректными.
 */
public final class RawAttendanceRecord {

  /**
   * Формат, в котором клиент протокола отдаёт время отметки.
   */
  public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final String uid;
  private final String userId;
  private final String timestamp;
  private final String status;
  private final String punch;

  private RawAttendanceRecord(Builder builder) {
    this.uid = builder.uid;
    this.userId = builder.userId;
    this.timestamp = builder.timestamp;
    this.status = builder.status;
    this.punch = builder.punch;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<String> uid() {
    return Optional.ofNullable(uid);
  }

  public Optional<String> userId() {
    return Optional.ofNullable(userId);
  }

  public Optional<String> timestamp() {
    return Optional.ofNullable(timestamp);
  }

  public Optional<String> status() {
    return Optional.ofNullable(status);
  }

  public Optional<String> punch() {
    return Optional.ofNullable(punch);
  }

  @Override
  public String toString() {
    return "RawAttendanceRecord{uid=" + uid + ", userId=" + userId + ", timestamp=" + timestamp
        + ", status=" + status + ", punch=" + punch + "}";
  }

  public static final class Builder {
    private String uid;
    private String userId;
    private String timestamp;
    private String status;
    private String punch;

    public Builder uid(String uid) {
      this.uid = uid;
      return this;
    }

    public Builder uid(int uid) {
      this.uid = Integer.toString(uid);
      return this;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder timestamp(String timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder timestamp(LocalDateTime timestamp) {
      this.timestamp = timestamp == null ? null : timestamp.format(TIMESTAMP_FORMAT);
      return this;
    }

    public Builder status(String status) {
      this.status = status;
      return this;
    }

    public Builder status(int status) {
      this.status = Integer.toString(status);
      return this;
    }

    public Builder punch(String punch) {
      this.punch = punch;
      return this;
    }

    public Builder punch(int punch) {
      this.punch = Integer.toString(punch);
      return this;
    }

    public RawAttendanceRecord build() {
      return new RawAttendanceRecord(this);
    }
  }
}
