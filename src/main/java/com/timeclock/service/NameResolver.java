package com.timeclock.service;

import com.timeclock.model.UserRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Поиск имени сотрудника по uid или user_id.
 * <p>
 * Отметка может нести любой из двух идентификаторов, поэтому каждый пользователь
 * регистрируется под обоими ключами. При совпадении ключей побеждает последняя запись.
 */
public final class NameResolver {

  private static final NameResolver EMPTY = new NameResolver(Collections.emptyMap());

  private final Map<String, String> names;

  private NameResolver(Map<String, String> names) {
    this.names = names;
  }

  public static NameResolver build(List<UserRecord> users) {
    Map<String, String> names = new HashMap<>();
    for (UserRecord user : users) {
      names.put(String.valueOf(user.getUid()), user.getName());
      names.put(user.getUserId(), user.getName());
    }
    return new NameResolver(names);
  }

  public static NameResolver empty() {
    return EMPTY;
  }

  /**
   * Сначала ищет по uid, затем по user_id. Никогда не падает.
   *
   * @return Имя или пустая строка, если ни один ключ не найден.
   */
  public String resolve(int uid, String userId) {
    String byUid = names.get(String.valueOf(uid));
    if (byUid != null && !byUid.isEmpty()) {
      return byUid;
    }
    if (userId == null) {
      return "";
    }
    return names.getOrDefault(userId, "");
  }

  public int size() {
    return names.size();
  }
}
