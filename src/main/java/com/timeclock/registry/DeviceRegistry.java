package com.timeclock.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timeclock.model.DeviceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Реестр терминалов, загружаемый один раз за запуск из devices.json.
 * <p>
 * Формат файла: {@code {"devices": [{"ip": "...", "name": "...", ...}, ...]}}.
 * Порядок устройств в файле сохраняется — в этом порядке их обходит синхронизация.
 */
public final class DeviceRegistry {

  private static final Logger logger = LoggerFactory.getLogger(DeviceRegistry.class);

  private final List<DeviceDescriptor> devices;

  public DeviceRegistry(List<DeviceDescriptor> devices) {
    this.devices = Collections.unmodifiableList(new ArrayList<>(devices));
  }

  /**
   * Читает и проверяет файл реестра.
   *
   * @param file Путь к devices.json.
   * @return Реестр в порядке следования устройств в файле.
   * @throws RegistryException если файл не найден, не является JSON нужной структуры,
   *                           у записи нет ip или ip повторяется.
   */
  public static DeviceRegistry load(Path file) {
    String content;
    try {
      content = Files.readString(file);
    } catch (NoSuchFileException e) {
      throw new RegistryException("Файл реестра не найден: " + file, e);
    } catch (IOException e) {
      throw new RegistryException("Не удалось прочитать файл реестра: " + file, e);
    }
    DeviceRegistry registry = parse(content, file.toString());
    logger.info("✅ Загружено устройств из {}: {}", file, registry.size());
    return registry;
  }

  static DeviceRegistry parse(String json, String source) {
    ObjectMapper mapper = new ObjectMapper();
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new RegistryException("Файл реестра " + source + " не является корректным JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new RegistryException("Файл реестра " + source + " должен содержать JSON-объект");
    }
    JsonNode list = root.get("devices");
    if (list == null || !list.isArray()) {
      throw new RegistryException("В файле реестра " + source + " нет списка 'devices'");
    }

    List<DeviceDescriptor> devices = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    int position = 0;
    for (JsonNode entry : list) {
      position++;
      DeviceDescriptor device;
      try {
        device = mapper.treeToValue(entry, DeviceDescriptor.class);
      } catch (JsonProcessingException e) {
        throw new RegistryException("Запись #" + position + " реестра " + source + " имеет неверный формат", e);
      }
      if (device == null || device.getIp() == null || device.getIp().isBlank()) {
        throw new RegistryException("У записи #" + position + " реестра " + source + " не указан ip");
      }
      device.setIp(device.getIp().trim());
      if (!seen.add(device.getIp())) {
        throw new RegistryException("IP " + device.getIp() + " повторяется в реестре " + source);
      }
      devices.add(device);
    }
    return new DeviceRegistry(devices);
  }

  public List<DeviceDescriptor> devices() {
    return devices;
  }

  public int size() {
    return devices.size();
  }

  public boolean isEmpty() {
    return devices.isEmpty();
  }

  public Optional<DeviceDescriptor> findByIp(String ip) {
    if (ip == null) {
      return Optional.empty();
    }
    String key = ip.trim();
    return devices.stream().filter(d -> d.getIp().equals(key)).findFirst();
  }

  /**
   * Карточка устройства "поле → значение" для вывода оператору.
   * Отсутствующие значения заменяются на "N/A".
   */
  public Map<String, String> describe(String ip) {
    DeviceDescriptor device = findByIp(ip)
        .orElseThrow(() -> new IllegalArgumentException("Устройство " + ip + " отсутствует в реестре"));
    Map<String, String> card = new LinkedHashMap<>();
    card.put("IP", device.getIp());
    card.put("Device Name", DeviceDescriptor.orNotAvailable(device.getName()));
    card.put("Location", DeviceDescriptor.orNotAvailable(device.getLocation()));
    card.put("Status", DeviceDescriptor.orNotAvailable(device.getStatus()));
    card.put("Install Date", DeviceDescriptor.orNotAvailable(device.getDateInstalled()));
    card.put("Expiry Date", DeviceDescriptor.orNotAvailable(device.getDateExpired()));
    card.put("Notes", DeviceDescriptor.orNotAvailable(device.getNotes()));
    return card;
  }
}
