package com.timeclock.service;

import com.timeclock.model.AttendanceEvent;
import com.timeclock.model.DeviceDescriptor;
import com.timeclock.model.UserRecord;

import java.util.List;

/**
 * Сервис синхронизации парка терминалов с локальным хранилищем.
 * <p>
 * Ни один метод не выбрасывает ошибки устройства наружу: они возвращаются
 * в {@link DeviceSyncResult} и {@link FleetReport}.
 */
public interface SyncService {

  /**
   * Забирает список пользователей терминала и сохраняет его (последняя версия побеждает).
   *
   * @param device Терминал из реестра.
   * @return Нормализованные пользователи или причина отказа.
   */
  DeviceSyncResult<UserRecord> syncUsers(DeviceDescriptor device);

  /**
   * Забирает журнал отметок терминала и дописывает новые отметки в хранилище.
   *
   * @param device   Терминал из реестра.
   * @param resolver Источник имён для отметок.
   * @return Принятые отметки или причина отказа.
   */
  DeviceSyncResult<AttendanceEvent> syncAttendance(DeviceDescriptor device, NameResolver resolver);

  /**
   * Забирает журнал отметок терминала, подписывая отметки именами из списка пользователей
   * того же терминала, полученного в той же сессии.
   */
  DeviceSyncResult<AttendanceEvent> syncAttendance(DeviceDescriptor device);

  /**
   * Последовательно обходит все терминалы. Отказ одного устройства не мешает остальным.
   * При синхронизации отметок имена берутся из списка пользователей того же терминала,
   * полученного в той же сессии.
   */
  FleetReport runFleet(SyncKind kind, List<DeviceDescriptor> devices);
}
