package com.timeclock.device;

/**
 * Ленивый поток событий терминала в реальном времени.
 * <p>
 * Повторно не запускается: после {@link CaptureSignal.Kind#CLOSED} или {@link #close()}
 * нужно открыть новый поток через {@link DeviceSession#liveCapture()}.
 */
public interface LiveCaptureStream extends AutoCloseable {

  /**
   * Блокируется не дольше таймаута чтения устройства.
   *
   * @return Событие, маркер таймаута или маркер закрытия потока.
   * @throws DeviceException при обрыве связи с терминалом.
   */
  CaptureSignal next() throws DeviceException;

  @Override
  void close();
}
