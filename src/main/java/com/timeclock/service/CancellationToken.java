package com.timeclock.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Флаг кооперативной отмены. Выставляется из любого потока, проверяется без блокировки.
 */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
