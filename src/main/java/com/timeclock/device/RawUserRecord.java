package com.timeclock.device;

import java.util.Optional;

/**
 * Запись пользователя в том виде, в каком её вернул терминал.
 * <p>
 * Все поля необязательны и приходят как есть, без проверки типов:
 * uid, например, может оказаться нечисловой строкой.
 * Значения по умолчанию подставляет {@link com.timeclock.service.RecordNormalizer}.
 */
public final class RawUserRecord {

  private final String uid;
  private final String userId;
  private final String name;
  private final Integer privilege;
  private final String password;
  private final String groupId;
  private final String card;

  private RawUserRecord(Builder builder) {
    this.uid = builder.uid;
    this.userId = builder.userId;
    this.name = builder.name;
    this.privilege = builder.privilege;
    this.password = builder.password;
    this.groupId = builder.groupId;
    this.card = builder.card;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<String> uid() {
    return Optional.ofNullable(uid);
  }

  public Optional<String> userId() {
    return Optional.ofNullable(userId);
  }

  public Optional<String> name() {
    return Optional.ofNullable(name);
  }

  public Optional<Integer> privilege() {
    return Optional.ofNullable(privilege);
  }

  public Optional<String> password() {
    return Optional.ofNullable(password);
  }

  public Optional<String> groupId() {
    return Optional.ofNullable(groupId);
  }

  public Optional<String> card() {
    return Optional.ofNullable(card);
  }

  @Override
  public String toString() {
    return "RawUserRecord{uid=" + uid + ", userId=" + userId + ", name=" + name + "}";
  }

  public static final class Builder {
    private String uid;
    private String userId;
    private String name;
    private Integer privilege;
    private String password;
    private String groupId;
    private String card;

    public Builder uid(String uid) {
      this.uid = uid;
      return this;
    }

    public Builder uid(int uid) {
      this.uid = Integer.toString(uid);
      return this;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder privilege(Integer privilege) {
      this.privilege = privilege;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder groupId(String groupId) {
      this.groupId = groupId;
      return this;
    }

    public Builder card(String card) {
      this.card = card;
      return this;
    }

    public RawUserRecord build() {
      return new RawUserRecord(this);
    }
  }
}
