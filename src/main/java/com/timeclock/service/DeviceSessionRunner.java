package com.timeclock.service;

import com.timeclock.config.DeviceSettings;
import com.timeclock.device.DeviceConnector;
import com.timeclock.device.DeviceException;
import com.timeclock.device.DeviceSession;
import com.timeclock.model.DeviceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Жизненный цикл сессии с одним терминалом: подключение → режим обслуживания →
 * работа → возврат в обычный режим → отключение.
 * <p>
 * Освобождение выполняется на любом пути выхода, включая ошибку работы. Его собственные
 * сбои только логируются и не подменяют ни результат, ни исходную ошибку.
 */
public class DeviceSessionRunner {

  private static final Logger logger = LoggerFactory.getLogger(DeviceSessionRunner.class);

  private final DeviceConnector connector;
  private final DeviceSettings settings;

  public DeviceSessionRunner(DeviceConnector connector, DeviceSettings settings) {
    this.connector = connector;
    this.settings = settings;
  }

  /**
   * Выполняет работу в сессии с терминалом.
   *
   * @throws DeviceException если не удалось подключиться или работа завершилась ошибкой устройства.
   */
  public <T> T run(DeviceDescriptor device, SessionWork<T> work) throws DeviceException {
    DeviceSession session = connector.connect(device.getIp(), settings);
    try {
      session.disable();
      return work.run(session);
    } finally {
      release(device, session);
    }
  }

  private void release(DeviceDescriptor device, DeviceSession session) {
    try {
      session.enable();
    } catch (DeviceException | RuntimeException e) {
      logger.warn("Не удалось вернуть {} в обычный режим: {}", device, e.getMessage());
    }
    try {
      session.disconnect();
    } catch (DeviceException | RuntimeException e) {
      logger.warn("Не удалось корректно отключиться от {}: {}", device, e.getMessage());
    }
  }
}
