package com.timeclock.service;

import com.timeclock.device.DeviceException;
import com.timeclock.device.DeviceSession;

/**
 * Работа, выполняемая внутри открытой сессии с терминалом.
 *
 * @param <T> Тип результата.
 */
@FunctionalInterface
public interface SessionWork<T> {

  T run(DeviceSession session) throws DeviceException;
}
