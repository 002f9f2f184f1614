package com.timeclock.service;

import com.timeclock.model.Privilege;
import com.timeclock.model.UserRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UserDirectoryTest {

  private final UserDirectory directory = new UserDirectory(List.of(
      new UserRecord(1, "0001", "Иван Петров", Privilege.DEFAULT, "", "", 0),
      new UserRecord(2, "0002", "Пётр Иванов", Privilege.ADMIN, "", "", 0),
      new UserRecord(3, "0003", "Мария", Privilege.DEFAULT, "", "", 0)));

  @Test
  @DisplayName("Поиск по user_id — точное совпадение")
  void shouldFindByExactUserId() {
    assertThat(directory.findByUserId(" 0002 ")).extracting(UserRecord::getUid).containsExactly(2);
    assertThat(directory.findByUserId("000")).isEmpty();
    assertThat(directory.findByUserId("")).isEmpty();
  }

  @Test
  @DisplayName("Поиск по имени — подстрока без учёта регистра")
  void shouldFindByNameIgnoringCase() {
    assertThat(directory.findByName("иван")).extracting(UserRecord::getUid).containsExactly(1, 2);
    assertThat(directory.findByName("  ")).isEmpty();
  }

  @Test
  @DisplayName("Список администраторов и поиск по uid")
  void shouldListAdminsAndFindByUid() {
    assertThat(directory.admins()).extracting(UserRecord::getUserId).containsExactly("0002");
    assertThat(directory.findByUid(3)).map(UserRecord::getName).contains("Мария");
    assertThat(directory.findByUid(42)).isEmpty();
  }
}
