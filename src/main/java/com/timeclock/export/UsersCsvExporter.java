package com.timeclock.export;

import com.timeclock.config.Config;
import com.timeclock.model.UserRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Выгрузка списка пользователей терминала в CSV.
 * <p>
 * Имя файла по умолчанию: users_export_&lt;ip через подчёркивания&gt;_&lt;yyyyMMdd_HHmmss&gt;.csv
 * в каталоге export.dir.
 */
public class UsersCsvExporter {

  private static final Logger logger = LoggerFactory.getLogger(UsersCsvExporter.class);

  static final String CSV_HEADER = "UID,Name,Privilege,Password,Group ID,User ID,Card";
  private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final Path exportDir;

  public UsersCsvExporter() {
    this(Paths.get(Config.getProperty("export.dir", "Output")));
  }

  public UsersCsvExporter(Path exportDir) {
    this.exportDir = exportDir;
  }

  /**
   * Пишет файл с именем по умолчанию.
   *
   * @return Путь к созданному файлу.
   */
  public Path export(List<UserRecord> users, String deviceIp, LocalDateTime now) throws IOException {
    return export(users, exportDir.resolve(defaultFileName(deviceIp, now)));
  }

  public Path export(List<UserRecord> users, Path file) throws IOException {
    if (file.getParent() != null && !Files.exists(file.getParent())) {
      Files.createDirectories(file.getParent());
    }
    try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      writer.write(CSV_HEADER);
      writer.newLine();
      for (UserRecord user : users) {
        writer.write(formatRow(user));
        writer.newLine();
      }
    }
    logger.info("CSV выгружен: {} ({} пользователей)", file, users.size());
    return file;
  }

  static String defaultFileName(String deviceIp, LocalDateTime now) {
    String ipSafe = (deviceIp == null || deviceIp.isBlank() ? "unknown" : deviceIp).replace('.', '_');
    return "users_export_" + ipSafe + "_" + now.format(FILE_TIMESTAMP) + ".csv";
  }

  static String formatRow(UserRecord user) {
    return String.join(",",
        Integer.toString(user.getUid()),
        escape(user.getName()),
        user.getPrivilege().label(),
        escape(user.getPassword()),
        escape(user.getGroupId()),
        escape(user.getUserId()),
        user.cardText());
  }

  /**
   * Кавычки по RFC 4180: только если в значении есть запятая, кавычка или перевод строки.
   */
  static String escape(String value) {
    if (value == null) {
      return "";
    }
    if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
