package com.timeclock.device;

import com.timeclock.config.DeviceSettings;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Коннектор для тестов: терминалы живут в памяти, недоступные IP отвечают DeviceException.
 */
public class FakeDeviceConnector implements DeviceConnector {

  private final Map<String, FakeDeviceSession> sessions = new HashMap<>();
  private final Set<String> unreachable = new HashSet<>();
  private final List<String> connectAttempts = new ArrayList<>();

  public FakeDeviceSession device(String ip) {
    return sessions.computeIfAbsent(ip, FakeDeviceSession::new);
  }

  public FakeDeviceConnector unreachable(String ip) {
    unreachable.add(ip);
    return this;
  }

  public List<String> getConnectAttempts() {
    return connectAttempts;
  }

  @Override
  public DeviceSession connect(String ip, DeviceSettings settings) throws DeviceException {
    connectAttempts.add(ip);
    if (unreachable.contains(ip)) {
      throw DeviceException.timeout(ip);
    }
    FakeDeviceSession session = device(ip);
    session.connected = true;
    return session;
  }
}
