package com.timeclock.device;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Сведения о терминале: прошивка, сеть, серийный номер, текущее время и т.п.
 * <p>
 * Набор полей фиксирован ({@link #FIELDS}); значения хранятся строками в том виде,
 * в каком их вернул терминал. Неизвестные поля не сохраняются.
 */
public final class DeviceInfo {

  public static final String DEVICE_TIME = "Device Time";

  public static final List<String> FIELDS = List.of(
      "SDK build=1",
      "ExtendFmt",
      "UsrExtFmt",
      "Face FunOn",
      "Face Version",
      "Finger Version",
      "Old FW Compat",
      "IP Address",
      "Subnet Mask",
      "Gateway",
      DEVICE_TIME,
      "Firmware Version",
      "Platform",
      "Device Name",
      "Pin Width",
      "Serial Number",
      "MAC"
  );

  private static final DeviceInfo EMPTY = new DeviceInfo(Collections.emptyMap());

  private final Map<String, String> values;

  public DeviceInfo(Map<String, String> values) {
    Map<String, String> ordered = new LinkedHashMap<>();
    for (String field : FIELDS) {
      String value = values.get(field);
      ordered.put(field, value == null ? "" : value.trim());
    }
    this.values = Collections.unmodifiableMap(ordered);
  }

  public static DeviceInfo empty() {
    return EMPTY;
  }

  /**
   * @return Значение поля или пустая строка.
   */
  public String get(String field) {
    return values.getOrDefault(field, "");
  }

  /**
   * Все поля в порядке {@link #FIELDS}.
   */
  public Map<String, String> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return "DeviceInfo" + values;
  }
}
