package com.timeclock.service;

import com.timeclock.config.DeviceSettings;
import com.timeclock.device.DeviceConnector;
import com.timeclock.device.DeviceException;
import com.timeclock.device.DeviceInfo;
import com.timeclock.model.DeviceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Сведения о терминалах и их часах.
 * <p>
 * Как и синхронизация, обходит парк последовательно: отказ терминала записывается
 * в его снимок и не прерывает обход.
 */
public class DeviceInspectionService {

  private static final Logger logger = LoggerFactory.getLogger(DeviceInspectionService.class);

  private final DeviceSessionRunner sessions;

  public DeviceInspectionService(DeviceConnector connector, DeviceSettings settings) {
    this.sessions = new DeviceSessionRunner(connector, settings);
  }

  public DeviceSnapshot snapshot(DeviceDescriptor device) {
    try {
      DeviceInfo info = sessions.run(device, session -> session.getDeviceInfo());
      return DeviceSnapshot.success(device, info);
    } catch (DeviceException | RuntimeException e) {
      logger.error("  ✗ Не удалось получить сведения о {}: {}", device, e.getMessage());
      return DeviceSnapshot.failure(device, describe(e));
    }
  }

  public List<DeviceSnapshot> snapshotFleet(List<DeviceDescriptor> devices) {
    logger.info("==== Сбор сведений о терминалах ({} шт.) ====", devices.size());
    List<DeviceSnapshot> snapshots = new ArrayList<>(devices.size());
    int failed = 0;
    for (int idx = 0; idx < devices.size(); idx++) {
      DeviceDescriptor device = devices.get(idx);
      logger.info("[{}/{}] Подключение к {}...", idx + 1, devices.size(), device);
      DeviceSnapshot snapshot = snapshot(device);
      if (!snapshot.isSuccess()) {
        failed++;
      }
      snapshots.add(snapshot);
    }
    logger.info("Сведения получены: {}/{} устройств", devices.size() - failed, devices.size());
    return snapshots;
  }

  /**
   * Сверяет часы терминала с локальным временем и при необходимости выставляет их.
   *
   * @param now    Локальное время без долей секунды.
   * @param update Выставить часы терминала в {@code now} перед сверкой.
   */
  public ClockCheck checkClock(DeviceDescriptor device, LocalDateTime now, boolean update) {
    try {
      LocalDateTime deviceTime = sessions.run(device, session -> {
        if (update) {
          session.setTime(now);
          logger.info("✅ Время {} установлено: {}", device, now);
        }
        return session.getTime();
      });
      ClockCheck check = ClockCheck.checked(device, deviceTime, now, update);
      if (check.isOutOfSync()) {
        logger.warn("⚠️ Часы {} расходятся с локальными на {} с (терминал: {}, локально: {})",
            device, check.getDrift().getSeconds(), deviceTime, now);
      }
      return check;
    } catch (DeviceException | RuntimeException e) {
      logger.error("  ✗ Не удалось сверить часы {}: {}", device, e.getMessage());
      return ClockCheck.failure(device, now, describe(e));
    }
  }

  private static String describe(Exception e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }
}
