package com.timeclock.model;

import java.util.Objects;

/**
 * Нормализованная запись пользователя терминала.
 * <p>
 * Живёт только в пределах одной синхронизации: после сохранения в БД отбрасывается.
 */
public final class UserRecord {

  private final int uid;
  private final String userId;
  private final String name;
  private final Privilege privilege;
  private final String password;
  private final String groupId;
  private final long card;

  public UserRecord(int uid, String userId, String name, Privilege privilege,
                    String password, String groupId, long card) {
    this.uid = uid;
    this.userId = Objects.requireNonNull(userId, "userId");
    this.name = name == null ? "" : name;
    this.privilege = privilege == null ? Privilege.DEFAULT : privilege;
    this.password = password == null ? "" : password;
    this.groupId = groupId == null ? "" : groupId;
    this.card = card;
  }

  /**
   * Внутренний числовой идентификатор пользователя на терминале.
   */
  public int getUid() {
    return uid;
  }

  /**
   * Табельный номер сотрудника (внешний код).
   */
  public String getUserId() {
    return userId;
  }

  public String getName() {
    return name;
  }

  public Privilege getPrivilege() {
    return privilege;
  }

  public boolean isAdmin() {
    return privilege == Privilege.ADMIN;
  }

  public String getPassword() {
    return password;
  }

  public String getGroupId() {
    return groupId;
  }

  public long getCard() {
    return card;
  }

  /**
   * Номер карты для вывода: пустая строка, если карта не привязана.
   */
  public String cardText() {
    return card == 0 ? "" : Long.toString(card);
  }

  public UserRecord withName(String newName) {
    return new UserRecord(uid, userId, newName, privilege, password, groupId, card);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof UserRecord)) return false;
    UserRecord that = (UserRecord) o;
    return uid == that.uid
        && card == that.card
        && userId.equals(that.userId)
        && name.equals(that.name)
        && privilege == that.privilege
        && password.equals(that.password)
        && groupId.equals(that.groupId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uid, userId, name, privilege, password, groupId, card);
  }

  @Override
  public String toString() {
    return "UserRecord{uid=" + uid + ", userId='" + userId + "', name='" + name + "', privilege=" + privilege + "}";
  }
}
