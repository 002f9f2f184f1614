package com.timeclock.config;

import java.time.Duration;

/**
 * Параметры подключения к терминалу, общие для всего парка.
 * <p>
 * Пароль устройства — единственный общий секрет, который передаётся коннектору как есть.
 */
public final class DeviceSettings {

  public static final int DEFAULT_PORT = 4370;
  public static final int DEFAULT_TIMEOUT_SECONDS = 30;

  private final int port;
  private final Duration timeout;
  private final int password;
  private final boolean forceUdp;

  public DeviceSettings(int port, Duration timeout, int password, boolean forceUdp) {
    if (port <= 0 || port > 65535) {
      throw new IllegalArgumentException("Некорректный порт устройства: " + port);
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("Таймаут устройства должен быть положительным");
    }
    this.port = port;
    this.timeout = timeout;
    this.password = password;
    this.forceUdp = forceUdp;
  }

  /**
   * Собирает настройки из ключей {@code device.*} конфигурации.
   */
  public static DeviceSettings fromConfig() {
    return new DeviceSettings(
        Config.getIntProperty("device.port", DEFAULT_PORT),
        Duration.ofSeconds(Config.getIntProperty("device.timeout.seconds", DEFAULT_TIMEOUT_SECONDS)),
        Config.getIntProperty("device.password", 0),
        Config.getBooleanProperty("device.force-udp", true)
    );
  }

  public int getPort() {
    return port;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public int getPassword() {
    return password;
  }

  public boolean isForceUdp() {
    return forceUdp;
  }

  @Override
  public String toString() {
    // пароль в лог не пишем
    return "DeviceSettings{port=" + port + ", timeout=" + timeout + ", forceUdp=" + forceUdp + "}";
  }
}
