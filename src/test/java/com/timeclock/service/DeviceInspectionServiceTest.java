package com.timeclock.service;

import com.timeclock.config.DeviceSettings;
import com.timeclock.device.DeviceException;
import com.timeclock.device.DeviceInfo;
import com.timeclock.device.FakeDeviceConnector;
import com.timeclock.device.FakeDeviceSession;
import com.timeclock.model.DeviceDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceInspectionServiceTest {

  private static final DeviceSettings SETTINGS = new DeviceSettings(4370, Duration.ofSeconds(5), 0, true);

  private static final DeviceDescriptor GATE_A = new DeviceDescriptor("10.0.0.5", "Gate-A");
  private static final DeviceDescriptor GATE_B = new DeviceDescriptor("10.0.0.6", "Gate-B");
  private static final DeviceDescriptor GATE_C = new DeviceDescriptor("10.0.0.7", "Gate-C");

  private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 5, 12, 0, 0);

  private FakeDeviceConnector connector;
  private DeviceInspectionService service;

  @BeforeEach
  void setUp() {
    connector = new FakeDeviceConnector();
    service = new DeviceInspectionService(connector, SETTINGS);
  }

  @Test
  @DisplayName("Сведения о терминале: известные поля сохраняются, остальные пустые, сессия освобождена")
  void shouldSnapshotDevice() {
    FakeDeviceSession gate = connector.device(GATE_A.getIp()).withDeviceInfo(Map.of(
        "Serial Number", " ABC123 ",
        "Firmware Version", "Ver 6.60",
        "Unknown Field", "x"));

    DeviceSnapshot snapshot = service.snapshot(GATE_A);

    assertThat(snapshot.isSuccess()).isTrue();
    assertThat(snapshot.getError()).isEmpty();
    assertThat(snapshot.getInfo().get("Serial Number")).isEqualTo("ABC123");
    assertThat(snapshot.getInfo().get("MAC")).isEmpty();
    assertThat(snapshot.getInfo().asMap()).containsOnlyKeys(DeviceInfo.FIELDS);
    assertThat(gate.getEnableCalls()).isEqualTo(1);
    assertThat(gate.getDisconnectCalls()).isEqualTo(1);
  }

  @Test
  @DisplayName("Обход парка: недоступный терминал и ошибка чтения попадают в error, обход продолжается")
  void shouldRecordFailuresInFleetSnapshot() {
    connector.device(GATE_A.getIp()).withDeviceInfo(Map.of("Serial Number", "A1"));
    connector.unreachable(GATE_B.getIp());
    FakeDeviceSession gateC = connector.device(GATE_C.getIp())
        .failDeviceInfoWith(new DeviceException(GATE_C.getIp(), "Ответ не разобран"));

    List<DeviceSnapshot> snapshots = service.snapshotFleet(List.of(GATE_A, GATE_B, GATE_C));

    assertThat(connector.getConnectAttempts()).containsExactly("10.0.0.5", "10.0.0.6", "10.0.0.7");
    assertThat(snapshots).extracting(DeviceSnapshot::isSuccess).containsExactly(true, false, false);
    assertThat(snapshots.get(1).getError()).contains("10.0.0.6");
    assertThat(snapshots.get(2).getError()).isEqualTo("Ответ не разобран");
    assertThat(snapshots.get(2).getInfo().get("Serial Number")).isEmpty();
    assertThat(gateC.getEnableCalls()).isEqualTo(1);
    assertThat(gateC.getDisconnectCalls()).isEqualTo(1);
  }

  @Test
  @DisplayName("Сверка часов без установки: расхождение больше двух минут отмечается")
  void shouldDetectClockDrift() {
    FakeDeviceSession gate = connector.device(GATE_A.getIp()).withClock(NOW.minusMinutes(5));

    ClockCheck check = service.checkClock(GATE_A, NOW, false);

    assertThat(check.isSuccess()).isTrue();
    assertThat(check.isUpdated()).isFalse();
    assertThat(check.getDrift()).isEqualTo(Duration.ofMinutes(5));
    assertThat(check.isOutOfSync()).isTrue();
    assertThat(gate.getSetTimeCalls()).isZero();
  }

  @Test
  @DisplayName("Сверка часов с установкой: время терминала выставляется в локальное")
  void shouldUpdateDeviceClock() {
    FakeDeviceSession gate = connector.device(GATE_A.getIp()).withClock(NOW.minusHours(3));

    ClockCheck check = service.checkClock(GATE_A, NOW, true);

    assertThat(check.isUpdated()).isTrue();
    assertThat(check.getDeviceTime()).isEqualTo(NOW);
    assertThat(check.isOutOfSync()).isFalse();
    assertThat(gate.getClock()).isEqualTo(NOW);
    assertThat(gate.getSetTimeCalls()).isEqualTo(1);
    assertThat(gate.getDisconnectCalls()).isEqualTo(1);
  }

  @Test
  @DisplayName("Недоступный терминал при сверке часов → отказ с причиной, расхождение нулевое")
  void shouldReportClockFailure() {
    connector.unreachable(GATE_B.getIp());

    ClockCheck check = service.checkClock(GATE_B, NOW, true);

    assertThat(check.isSuccess()).isFalse();
    assertThat(check.getFailure()).contains("10.0.0.6");
    assertThat(check.getDrift()).isZero();
    assertThat(check.isOutOfSync()).isFalse();
  }
}
