package com.timeclock.service;

import com.timeclock.config.DeviceSettings;
import com.timeclock.db.AttendanceDao;
import com.timeclock.db.SaveSummary;
import com.timeclock.db.UserDao;
import com.timeclock.device.DeviceConnector;
import com.timeclock.device.DeviceException;
import com.timeclock.device.DeviceSession;
import com.timeclock.device.RawAttendanceRecord;
import com.timeclock.model.AttendanceEvent;
import com.timeclock.model.AttendanceRow;
import com.timeclock.model.DeviceDescriptor;
import com.timeclock.model.UserRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Реализация сервиса синхронизации.
 * <p>
 * Сессиями с терминалами управляет {@link DeviceSessionRunner}: освобождение выполняется
 * на любом пути выхода и не подменяет результат выборки. Повторных попыток в пределах одного запуска нет.
 */
public class SyncServiceImpl implements SyncService {

  private static final Logger logger = LoggerFactory.getLogger(SyncServiceImpl.class);

  private final DeviceSessionRunner sessions;
  private final RecordNormalizer normalizer;
  private final UserDao userDao;
  private final AttendanceDao attendanceDao;

  /**
   * Конструктор сервиса.
   *
   * @param connector     Клиент протокола терминалов.
   * @param settings      Параметры подключения, общие для парка.
   * @param normalizer    Нормализатор сырых записей.
   * @param userDao       DAO таблицы users.
   * @param attendanceDao DAO таблицы attendance.
   */
  public SyncServiceImpl(DeviceConnector connector, DeviceSettings settings, RecordNormalizer normalizer,
                         UserDao userDao, AttendanceDao attendanceDao) {
    this.sessions = new DeviceSessionRunner(connector, settings);
    this.normalizer = normalizer;
    this.userDao = userDao;
    this.attendanceDao = attendanceDao;
  }

  @Override
  public DeviceSyncResult<UserRecord> syncUsers(DeviceDescriptor device) {
    return withSession(device, session -> fetchAndStoreUsers(device, session));
  }

  @Override
  public DeviceSyncResult<AttendanceEvent> syncAttendance(DeviceDescriptor device, NameResolver resolver) {
    return withSession(device, session -> fetchAndStoreAttendance(device, session, resolver));
  }

  @Override
  public FleetReport runFleet(SyncKind kind, List<DeviceDescriptor> devices) {
    logger.info("==== Синхронизация {} со всех терминалов ({} шт.) ====", kind.noun(), devices.size());
    List<DeviceSyncResult<?>> results = new ArrayList<>(devices.size());

    for (int idx = 0; idx < devices.size(); idx++) {
      DeviceDescriptor device = devices.get(idx);
      logger.info("[{}/{}] Подключение к {}...", idx + 1, devices.size(), device);
      DeviceSyncResult<?> result;
      if (kind == SyncKind.USERS) {
        result = syncUsers(device);
      } else {
        result = syncAttendance(device);
      }
      if (result.isSuccess()) {
        logger.info("  ✓ Готово: {}", device);
      }
      results.add(result);
    }

    FleetReport report = new FleetReport(kind, results);
    logReport(report);
    return report;
  }

  @Override
  public DeviceSyncResult<AttendanceEvent> syncAttendance(DeviceDescriptor device) {
    return withSession(device, session -> {
      // имена берём из списка пользователей этого же терминала
      logger.info("  → Получаем пользователей для сопоставления имён...");
      List<UserRecord> users = normalizer.normalizeUsers(session.getUsers());
      return fetchAndStoreAttendance(device, session, NameResolver.build(users));
    });
  }

  private DeviceSyncResult<UserRecord> fetchAndStoreUsers(DeviceDescriptor device, DeviceSession session)
      throws DeviceException {
    logger.info("  → Получаем пользователей...");
    List<UserRecord> users = normalizer.normalizeUsers(session.getUsers());
    logger.info("  → Найдено пользователей: {}", users.size());
    SaveSummary summary = userDao.upsertUsers(device.getIp(), users);
    return DeviceSyncResult.success(device, users, summary);
  }

  private DeviceSyncResult<AttendanceEvent> fetchAndStoreAttendance(DeviceDescriptor device, DeviceSession session,
                                                                    NameResolver resolver) throws DeviceException {
    logger.info("  → Получаем журнал отметок...");
    List<RawAttendanceRecord> raws = session.getAttendance();
    logger.info("  → Найдено записей: {}", raws.size());

    // весь журнал нормализуется до того, как хоть одна запись попадёт в хранилище
    AttendanceBatch batch = normalizer.normalizeAttendanceBatch(raws);
    List<AttendanceRow> rows = new ArrayList<>(batch.getEvents().size());
    for (AttendanceEvent event : batch.getEvents()) {
      rows.add(AttendanceRow.of(device.getIp(), event, resolver.resolve(event.getUid(), event.getUserId())));
    }

    SaveSummary stored = attendanceDao.appendAttendance(rows);
    SaveSummary summary = new SaveSummary(stored.getInserted(), stored.getDuplicates(),
        batch.getSkipped(), stored.getErrors() + batch.getErrors());
    logger.info("  → Итог сохранения: {}", summary);
    return DeviceSyncResult.success(device, batch.getEvents(), summary);
  }

  private <T> DeviceSyncResult<T> withSession(DeviceDescriptor device, SessionWork<DeviceSyncResult<T>> work) {
    try {
      return sessions.run(device, work);
    } catch (DeviceException | RuntimeException e) {
      logger.error("  ✗ Ошибка обмена с {}: {}", device, e.getMessage());
      logger.debug("Подробности ошибки {}", device, e);
      return DeviceSyncResult.failure(device, describe(e));
    }
  }

  private static String describe(Exception e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }

  private static void logReport(FleetReport report) {
    logger.info("==== Итоги синхронизации {} ====", report.getKind().noun());
    logger.info("Успешно: {}/{} устройств", report.getSucceeded(), report.getAttempted());
    logger.info("Всего записей: {}", report.getTotalRecords());
    List<FleetReport.FailedDevice> failed = report.getFailedDevices();
    if (!failed.isEmpty()) {
      logger.warn("Не удалось синхронизировать:");
      for (FleetReport.FailedDevice device : failed) {
        logger.warn("  - {}: {}", device, device.getReason());
      }
    }
  }
}
