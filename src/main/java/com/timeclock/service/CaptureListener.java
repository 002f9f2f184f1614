package com.timeclock.service;

/**
 * Получатель событий live capture (например, вывод на консоль).
 * Вызывается в потоке захвата; может выставить {@link CancellationToken}.
 */
@FunctionalInterface
public interface CaptureListener {

  void onEvent(CapturedEvent event);
}
