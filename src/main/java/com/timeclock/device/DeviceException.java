package com.timeclock.device;

/**
 * Ошибка взаимодействия с терминалом: недоступен, отказ в авторизации, таймаут чтения.
 * <p>
 * Касается только одного устройства; синхронизация парка после неё продолжается.
 */
public class DeviceException extends Exception {

  private final String deviceIp;

  public DeviceException(String deviceIp, String message) {
    super(message);
    this.deviceIp = deviceIp;
  }

  public DeviceException(String deviceIp, String message, Throwable cause) {
    super(message, cause);
    this.deviceIp = deviceIp;
  }

  public String getDeviceIp() {
    return deviceIp;
  }

  public static DeviceException unreachable(String deviceIp, Throwable cause) {
    return new DeviceException(deviceIp, "Терминал " + deviceIp + " недоступен", cause);
  }

  public static DeviceException timeout(String deviceIp) {
    return new DeviceException(deviceIp, "Превышено время ожидания ответа от терминала " + deviceIp);
  }
}
