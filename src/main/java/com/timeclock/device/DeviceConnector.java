package com.timeclock.device;

import com.timeclock.config.DeviceSettings;

/**
 * Точка входа во внешний клиент протокола терминала.
 * <p>
 * Реализация подключается через {@link java.util.ServiceLoader}
 * (META-INF/services/com.timeclock.device.DeviceConnector).
 */
public interface DeviceConnector {

  /**
   * Открывает сессию с терминалом.
   *
   * @param ip       IP-адрес терминала.
   * @param settings Порт, таймаут и общий секрет устройства.
   * @return Открытая сессия; закрывается вызовом {@link DeviceSession#disconnect()}.
   * @throws DeviceException если терминал недоступен или отверг подключение.
   */
  DeviceSession connect(String ip, DeviceSettings settings) throws DeviceException;
}
