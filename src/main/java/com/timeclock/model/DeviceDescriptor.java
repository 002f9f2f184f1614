package com.timeclock.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Статическое описание одного терминала из файла реестра (devices.json).
 * Используется для десериализации JSON; после загрузки не изменяется.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceDescriptor {

  static final String NOT_AVAILABLE = "N/A";

  private String ip;
  private String name;
  private String location;
  private String status;

  @JsonProperty("date_installed")
  private String dateInstalled;

  @JsonProperty("date_expired")
  private String dateExpired;

  private String notes;

  /**
   * Конструктор по умолчанию. Обязателен для работы с Jackson.
   */
  public DeviceDescriptor() {}

  public DeviceDescriptor(String ip, String name) {
    this.ip = ip;
    this.name = name;
  }

  /**
   * IP-адрес терминала — уникальный ключ устройства в парке.
   */
  public String getIp() {
    return ip;
  }

  public void setIp(String ip) {
    this.ip = ip;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getLocation() {
    return location;
  }

  public void setLocation(String location) {
    this.location = location;
  }

  public String getStatus() {
    return status;
  }

  public void setStatus(String status) {
    this.status = status;
  }

  public String getDateInstalled() {
    return dateInstalled;
  }

  public void setDateInstalled(String dateInstalled) {
    this.dateInstalled = dateInstalled;
  }

  public String getDateExpired() {
    return dateExpired;
  }

  public void setDateExpired(String dateExpired) {
    this.dateExpired = dateExpired;
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }

  /**
   * Имя для отчётов и логов: "N/A", если в реестре имя не указано.
   */
  public String displayName() {
    return orNotAvailable(name);
  }

  public static String orNotAvailable(String value) {
    return value == null || value.isBlank() ? NOT_AVAILABLE : value;
  }

  @Override
  public String toString() {
    return displayName() + " (" + ip + ")";
  }
}
