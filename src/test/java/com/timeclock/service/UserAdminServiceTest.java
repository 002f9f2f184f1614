package com.timeclock.service;

import com.timeclock.device.FakeDeviceConnector;
import com.timeclock.device.FakeDeviceSession;
import com.timeclock.device.RawUserRecord;
import com.timeclock.model.Privilege;
import com.timeclock.model.UserRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserAdminServiceTest {

  private final UserAdminService service = new UserAdminService(new RecordNormalizer());
  private FakeDeviceSession session;

  @BeforeEach
  void setUp() {
    session = new FakeDeviceConnector().device("10.0.0.5")
        .withUsers(RawUserRecord.builder().uid(1).userId("0001").name("Анна").build());
  }

  @Test
  @DisplayName("Создание возвращает перечитанный с терминала список")
  void shouldCreateUserAndReturnFreshList() throws Exception {
    List<UserRecord> users = service.createUser(session,
        new UserRecord(2, "0002", "Борис", Privilege.ADMIN, "1234", "", 555L));

    assertThat(users).extracting(UserRecord::getUid).containsExactlyInAnyOrder(1, 2);
    UserRecord created = new UserDirectory(users).findByUid(2).orElseThrow();
    assertThat(created.isAdmin()).isTrue();
    assertThat(created.getCard()).isEqualTo(555L);
  }

  @Test
  @DisplayName("Обновление существующего пользователя меняет имя")
  void shouldUpdateExistingUser() throws Exception {
    List<UserRecord> users = service.updateUser(session,
        new UserRecord(1, "0001", "Анна Смирнова", Privilege.DEFAULT, "", "", 0));

    assertThat(users).hasSize(1);
    assertThat(users.get(0).getName()).isEqualTo("Анна Смирнова");
  }

  @Test
  @DisplayName("Удаление и попытки изменить отсутствующего пользователя")
  void shouldDeleteAndRejectMissingUser() throws Exception {
    assertThat(service.deleteUser(session, 1)).isEmpty();

    assertThatThrownBy(() -> service.deleteUser(session, 1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.updateUser(session,
        new UserRecord(9, "0009", "Нет", Privilege.DEFAULT, "", "", 0)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("uid вне диапазона или пустой user_id отклоняются до обращения к терминалу")
  void shouldValidateBeforeWriting() {
    assertThatThrownBy(() -> service.createUser(session,
        new UserRecord(UserAdminService.MAX_UID + 1, "0002", "X", Privilege.DEFAULT, "", "", 0)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.createUser(session,
        new UserRecord(2, " ", "X", Privilege.DEFAULT, "", "", 0)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(session.getUsers()).hasSize(1);
  }
}
