package com.timeclock.service;

import com.timeclock.device.DeviceException;
import com.timeclock.device.DeviceSession;
import com.timeclock.model.UserRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Управление пользователями на самом терминале через открытую сессию.
 * <p>
 * После каждого изменения список пользователей перечитывается с устройства,
 * поэтому вызывающий всегда получает фактическое состояние терминала.
 */
public class UserAdminService {

  private static final Logger logger = LoggerFactory.getLogger(UserAdminService.class);

  /** Диапазон uid, который принимает терминал. */
  static final int MAX_UID = 65535;

  private final RecordNormalizer normalizer;

  public UserAdminService(RecordNormalizer normalizer) {
    this.normalizer = normalizer;
  }

  /**
   * Создаёт пользователя на терминале.
   *
   * @return Обновлённый список пользователей терминала.
   * @throws IllegalArgumentException если uid вне диапазона или пуст user_id.
   */
  public List<UserRecord> createUser(DeviceSession session, UserRecord user) throws DeviceException {
    validate(user);
    session.setUser(user);
    logger.info("✅ Пользователь создан на {}: uid={}, имя={}, user_id={}",
        session.getDeviceIp(), user.getUid(), user.getName(), user.getUserId());
    return fetchUsers(session);
  }

  /**
   * Перезаписывает пользователя с тем же uid.
   *
   * @throws IllegalArgumentException если пользователя с таким uid на терминале нет.
   */
  public List<UserRecord> updateUser(DeviceSession session, UserRecord user) throws DeviceException {
    validate(user);
    requireExisting(session, user.getUid());
    session.setUser(user);
    logger.info("✅ Пользователь обновлён на {}: uid={}, имя={}", session.getDeviceIp(), user.getUid(), user.getName());
    return fetchUsers(session);
  }

  /**
   * Удаляет пользователя с терминала.
   *
   * @throws IllegalArgumentException если пользователя с таким uid на терминале нет.
   */
  public List<UserRecord> deleteUser(DeviceSession session, int uid) throws DeviceException {
    UserRecord existing = requireExisting(session, uid);
    session.deleteUser(uid);
    logger.info("✅ Пользователь удалён с {}: uid={}, имя={}", session.getDeviceIp(), uid, existing.getName());
    return fetchUsers(session);
  }

  public List<UserRecord> fetchUsers(DeviceSession session) throws DeviceException {
    return normalizer.normalizeUsers(session.getUsers());
  }

  private UserRecord requireExisting(DeviceSession session, int uid) throws DeviceException {
    return new UserDirectory(fetchUsers(session)).findByUid(uid)
        .orElseThrow(() -> new IllegalArgumentException(
            "Пользователь с uid=" + uid + " не найден на терминале " + session.getDeviceIp()));
  }

  private static void validate(UserRecord user) {
    if (user.getUid() < 0 || user.getUid() > MAX_UID) {
      throw new IllegalArgumentException("uid должен быть в диапазоне 0-" + MAX_UID + ": " + user.getUid());
    }
    if (user.getUserId().isBlank()) {
      throw new IllegalArgumentException("user_id обязателен");
    }
  }
}
