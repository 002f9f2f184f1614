package com.timeclock.export;

import com.timeclock.config.Config;
import com.timeclock.device.DeviceInfo;
import com.timeclock.model.DeviceDescriptor;
import com.timeclock.service.DeviceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Выгрузка сведений о терминалах парка в CSV: поля реестра, колонка error и поля
 * {@link DeviceInfo#FIELDS}. Терминал, к которому не удалось подключиться, попадает
 * в файл с пустыми сведениями и причиной в колонке error.
 */
public class DevicesCsvExporter {

  private static final Logger logger = LoggerFactory.getLogger(DevicesCsvExporter.class);

  static final String DEFAULT_FILE_NAME = "devices_export.csv";
  static final List<String> REGISTRY_COLUMNS = List.of(
      "ip", "name", "location", "status", "date_installed", "date_expired", "notes");

  private final Path exportDir;

  public DevicesCsvExporter() {
    this(Paths.get(Config.getProperty("export.dir", "Output")));
  }

  public DevicesCsvExporter(Path exportDir) {
    this.exportDir = exportDir;
  }

  public Path export(List<DeviceSnapshot> snapshots) throws IOException {
    return export(snapshots, exportDir.resolve(DEFAULT_FILE_NAME));
  }

  public Path export(List<DeviceSnapshot> snapshots, Path file) throws IOException {
    if (file.getParent() != null && !Files.exists(file.getParent())) {
      Files.createDirectories(file.getParent());
    }
    try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      writer.write(header());
      writer.newLine();
      for (DeviceSnapshot snapshot : snapshots) {
        writer.write(formatRow(snapshot));
        writer.newLine();
      }
    }
    logger.info("CSV выгружен: {} ({} устройств)", file, snapshots.size());
    return file;
  }

  static String header() {
    List<String> columns = new ArrayList<>(REGISTRY_COLUMNS);
    columns.add("error");
    columns.addAll(DeviceInfo.FIELDS);
    List<String> escaped = new ArrayList<>(columns.size());
    for (String column : columns) {
      escaped.add(UsersCsvExporter.escape(column));
    }
    return String.join(",", escaped);
  }

  static String formatRow(DeviceSnapshot snapshot) {
    DeviceDescriptor device = snapshot.getDevice();
    List<String> cells = new ArrayList<>();
    cells.add(device.getIp());
    cells.add(device.getName());
    cells.add(device.getLocation());
    cells.add(device.getStatus());
    cells.add(device.getDateInstalled());
    cells.add(device.getDateExpired());
    cells.add(device.getNotes());
    cells.add(snapshot.getError());
    for (String field : DeviceInfo.FIELDS) {
      cells.add(snapshot.getInfo().get(field));
    }
    List<String> escaped = new ArrayList<>(cells.size());
    for (String cell : cells) {
      escaped.add(UsersCsvExporter.escape(cell));
    }
    return String.join(",", escaped);
  }
}
