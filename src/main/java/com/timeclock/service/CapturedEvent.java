package com.timeclock.service;

import com.timeclock.model.AttendanceEvent;

/**
 * Отметка, полученная в реальном времени и дополненная именем сотрудника.
 */
public final class CapturedEvent {

  private final int sequence;
  private final AttendanceEvent event;
  private final String name;

  CapturedEvent(int sequence, AttendanceEvent event, String name) {
    this.sequence = sequence;
    this.event = event;
    this.name = name;
  }

  /**
   * Порядковый номер события в текущем сеансе захвата, начиная с 1.
   */
  public int getSequence() {
    return sequence;
  }

  public AttendanceEvent getEvent() {
    return event;
  }

  /**
   * Имя из справочника; пустая строка, если сотрудник не найден.
   */
  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return "#" + sequence + " " + event.getUid() + " " + event.getUserId() + " " + name
        + " " + event.getTimestamp() + " " + event.getStatus().label();
  }
}
