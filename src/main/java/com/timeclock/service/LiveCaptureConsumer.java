package com.timeclock.service;

import com.timeclock.device.CaptureSignal;
import com.timeclock.device.DeviceException;
import com.timeclock.device.DeviceSession;
import com.timeclock.device.LiveCaptureStream;
import com.timeclock.model.AttendanceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Потребитель потока отметок в реальном времени.
 * <p>
 * Отмена кооперативная: флаг проверяется перед каждым чтением из потока, а уже начатое
 * чтение не прерывается — задержку остановки ограничивает таймаут чтения устройства.
 * Имена берутся из заранее построенного {@link NameResolver}, к терминалу за ними не обращаемся.
 * Получатель видит каждое событие: правило пропуска неполных отметок относится только к хранилищу.
 */
public class LiveCaptureConsumer {

  private static final Logger logger = LoggerFactory.getLogger(LiveCaptureConsumer.class);

  private final RecordNormalizer normalizer;

  public LiveCaptureConsumer(RecordNormalizer normalizer) {
    this.normalizer = normalizer;
  }

  /**
   * Читает события до отмены, закрытия потока или ошибки связи.
   * Поток одноразовый: для нового сеанса нужен новый вызов.
   *
   * @param session  Открытая сессия с терминалом.
   * @param resolver Справочник имён.
   * @param token    Флаг остановки.
   * @param listener Получатель обогащённых событий.
   * @return Итог сеанса; ошибки устройства не выбрасываются, а отражаются в причине остановки.
   */
  public CaptureSummary capture(DeviceSession session, NameResolver resolver,
                                CancellationToken token, CaptureListener listener) {
    int events = 0;
    int timeouts = 0;

    CaptureSummary.StopReason reason = null;
    String failure = null;
    try (LiveCaptureStream stream = session.liveCapture()) {
      logger.info("Ожидаем события от терминала {}...", session.getDeviceIp());
      while (reason == null) {
        if (token.isCancelled()) {
          reason = CaptureSummary.StopReason.CANCELLED;
          break;
        }
        CaptureSignal signal = stream.next();
        switch (signal.getKind()) {
          case TIMEOUT:
            timeouts++;
            break;
          case CLOSED:
            reason = CaptureSummary.StopReason.STREAM_CLOSED;
            break;
          default:
            events++;
            AttendanceEvent event = normalizer.normalizeLiveEvent(signal.getRecord());
            String name = resolver.resolve(event.getUid(), event.getUserId());
            listener.onEvent(new CapturedEvent(events, event, name));
        }
      }
    } catch (DeviceException e) {
      logger.error("❌ Live capture на {} прерван: {}", session.getDeviceIp(), e.getMessage());
      reason = CaptureSummary.StopReason.DEVICE_ERROR;
      failure = e.getMessage();
    }

    CaptureSummary summary = new CaptureSummary(events, timeouts, reason, failure);
    logger.info("Live capture завершён: получено событий {}", events);
    return summary;
  }
}
