package com.timeclock.device;

import com.timeclock.model.UserRecord;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Открытая сессия с одним терминалом.
 * <p>
 * Все операции блокирующие; время ожидания ограничивает сама реализация
 * (таймаут из {@link com.timeclock.config.DeviceSettings}).
 */
public interface DeviceSession {

  String getDeviceIp();

  /**
   * Переводит терминал в режим обслуживания (блокирует ввод на устройстве).
   */
  void disable() throws DeviceException;

  /**
   * Возвращает терминал в обычный режим.
   */
  void enable() throws DeviceException;

  /**
   * Сведения о терминале (прошивка, сеть, серийный номер, время).
   */
  DeviceInfo getDeviceInfo() throws DeviceException;

  /**
   * Текущее время часов терминала.
   */
  LocalDateTime getTime() throws DeviceException;

  void setTime(LocalDateTime time) throws DeviceException;

  List<RawUserRecord> getUsers() throws DeviceException;

  List<RawAttendanceRecord> getAttendance() throws DeviceException;

  /**
   * Запускает поток событий в реальном времени. Поток бесконечный и одноразовый.
   */
  LiveCaptureStream liveCapture() throws DeviceException;

  /**
   * Создаёт пользователя или перезаписывает существующего с тем же uid.
   */
  void setUser(UserRecord user) throws DeviceException;

  void deleteUser(int uid) throws DeviceException;

  void disconnect() throws DeviceException;
}
