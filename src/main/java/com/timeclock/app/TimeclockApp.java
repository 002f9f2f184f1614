package com.timeclock.app;

import com.timeclock.config.Config;
import com.timeclock.config.DeviceSettings;
import com.timeclock.db.AttendanceDao;
import com.timeclock.db.DatabaseConnection;
import com.timeclock.db.StorageException;
import com.timeclock.db.UserDao;
import com.timeclock.device.DeviceConnector;
import com.timeclock.device.DeviceException;
import com.timeclock.device.DeviceSession;
import com.timeclock.export.DevicesCsvExporter;
import com.timeclock.export.UsersCsvExporter;
import com.timeclock.model.AttendanceEvent;
import com.timeclock.model.AttendanceRow;
import com.timeclock.model.DeviceDescriptor;
import com.timeclock.model.Privilege;
import com.timeclock.model.UserRecord;
import com.timeclock.registry.DeviceRegistry;
import com.timeclock.registry.RegistryException;
import com.timeclock.service.CancellationToken;
import com.timeclock.service.CaptureSummary;
import com.timeclock.service.ClockCheck;
import com.timeclock.service.DeviceInspectionService;
import com.timeclock.service.DeviceSessionRunner;
import com.timeclock.service.DeviceSnapshot;
import com.timeclock.service.DeviceSyncResult;
import com.timeclock.service.FleetReport;
import com.timeclock.service.LiveCaptureConsumer;
import com.timeclock.service.NameResolver;
import com.timeclock.service.RecordNormalizer;
import com.timeclock.service.SessionWork;
import com.timeclock.service.SyncKind;
import com.timeclock.service.SyncService;
import com.timeclock.service.SyncServiceImpl;
import com.timeclock.service.UserAdminService;
import com.timeclock.service.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Главный класс приложения: синхронизация парка терминалов из командной строки.
 * <p>
 * Команды парка: devices, sync-users, sync-attendance, export-devices [файл].
 * Команды одного терминала: export-users, live, clock, users, add-user, edit-user,
 * delete-user, attendance (первый аргумент — IP).
 */
public class TimeclockApp {

  private static final Logger logger = LoggerFactory.getLogger(TimeclockApp.class);

  static final int EXIT_OK = 0;
  static final int EXIT_PARTIAL = 1;
  static final int EXIT_FATAL = 2;

  /** Команды, которым нужен клиент протокола терминалов. */
  private static final Set<String> DEVICE_COMMANDS = Set.of(
      "sync-users", "sync-attendance", "export-users", "export-devices", "live", "clock",
      "users", "add-user", "edit-user", "delete-user", "attendance");

  private static final Set<String> FLAGS = Set.of("--admins", "--admin", "--user", "--update");

  private final DeviceRegistry registry;
  private final DeviceConnector connector;
  private final DeviceSettings settings;
  private final SyncService syncService;
  private final UsersCsvExporter exporter;
  private final DevicesCsvExporter devicesExporter;
  private final RecordNormalizer normalizer;
  private final AttendanceDao attendanceDao;
  private final DeviceSessionRunner sessions;
  private final UserAdminService userAdmin;
  private final DeviceInspectionService inspection;
  private final InputStream console;

  /**
   * @param registry  Реестр терминалов.
   * @param connector Клиент протокола терминалов.
   * @param settings  Параметры подключения.
   * @param database  Локальное хранилище (схема уже создана).
   * @param exporter  Выгрузка пользователей в CSV.
   * @param devicesExporter Выгрузка сведений о парке в CSV.
   * @param console   Откуда читать команду остановки live capture.
   */
  public TimeclockApp(DeviceRegistry registry, DeviceConnector connector, DeviceSettings settings,
                      DatabaseConnection database, UsersCsvExporter exporter,
                      DevicesCsvExporter devicesExporter, InputStream console) {
    this.registry = registry;
    this.connector = connector;
    this.settings = settings;
    this.normalizer = new RecordNormalizer();
    this.attendanceDao = new AttendanceDao(database);
    this.syncService = new SyncServiceImpl(connector, settings, normalizer, new UserDao(database), attendanceDao);
    this.sessions = new DeviceSessionRunner(connector, settings);
    this.userAdmin = new UserAdminService(normalizer);
    this.inspection = new DeviceInspectionService(connector, settings);
    this.exporter = exporter;
    this.devicesExporter = devicesExporter;
    this.console = console;
  }

  /**
   * Выполняет одну команду.
   *
   * @return Код завершения: 0 — успех, 1 — часть устройств не обработана, терминал
   *     отверг операцию или команда неверна.
   */
  public int run(String[] args) {
    if (args.length == 0) {
      printUsage();
      return EXIT_PARTIAL;
    }
    CommandArguments arguments;
    try {
      arguments = CommandArguments.parse(args, FLAGS);
    } catch (IllegalArgumentException e) {
      logger.error("❌ {}", e.getMessage());
      return usage();
    }
    switch (args[0]) {
      case "devices":
        return listDevices();
      case "sync-users":
        return fleet(SyncKind.USERS);
      case "sync-attendance":
        return fleet(SyncKind.ATTENDANCE);
      case "export-devices":
        return exportDevices(arguments);
      case "export-users":
        return arguments.positionalCount() > 0 ? exportUsers(arguments.positional(0)) : usage();
      case "live":
        return arguments.positionalCount() > 0 ? live(arguments.positional(0)) : usage();
      case "clock":
        return arguments.positionalCount() > 0 ? clock(arguments) : usage();
      case "users":
        return arguments.positionalCount() > 0 ? users(arguments) : usage();
      case "add-user":
        return arguments.positionalCount() > 3 ? addUser(arguments) : usage();
      case "edit-user":
        return arguments.positionalCount() > 1 ? editUser(arguments) : usage();
      case "delete-user":
        return arguments.positionalCount() > 1 ? deleteUser(arguments) : usage();
      case "attendance":
        return arguments.positionalCount() > 0 ? attendance(arguments) : usage();
      default:
        return usage();
    }
  }

  /**
   * Нужен ли команде клиент протокола терминалов. Команды, работающие только
   * с реестром, запускаются и без него.
   */
  static boolean requiresDevice(String[] args) {
    return args.length > 0 && DEVICE_COMMANDS.contains(args[0]);
  }

  private int listDevices() {
    if (registry.isEmpty()) {
      logger.info("Реестр терминалов пуст");
      return EXIT_OK;
    }
    int idx = 0;
    for (DeviceDescriptor device : registry.devices()) {
      idx++;
      logger.info("{}. {}", idx, device);
      for (Map.Entry<String, String> field : registry.describe(device.getIp()).entrySet()) {
        logger.info("     {}: {}", field.getKey(), field.getValue());
      }
    }
    return EXIT_OK;
  }

  private int fleet(SyncKind kind) {
    FleetReport report = syncService.runFleet(kind, registry.devices());
    return report.getFailedDevices().isEmpty() ? EXIT_OK : EXIT_PARTIAL;
  }

  private int exportUsers(String ip) {
    DeviceDescriptor device = resolveDevice(ip);
    DeviceSyncResult<UserRecord> result = syncService.syncUsers(device);
    if (!result.isSuccess()) {
      logger.error("❌ Не удалось получить пользователей {}: {}", device, result.getFailure());
      return EXIT_PARTIAL;
    }
    try {
      exporter.export(result.getRecords(), device.getIp(), LocalDateTime.now());
      return EXIT_OK;
    } catch (IOException e) {
      logger.error("❌ Не удалось записать CSV для {}", device, e);
      return EXIT_PARTIAL;
    }
  }

  private int exportDevices(CommandArguments arguments) {
    List<DeviceSnapshot> snapshots = inspection.snapshotFleet(registry.devices());
    try {
      if (arguments.positionalCount() > 0) {
        devicesExporter.export(snapshots, Paths.get(arguments.positional(0)));
      } else {
        devicesExporter.export(snapshots);
      }
    } catch (IOException e) {
      logger.error("❌ Не удалось записать CSV со сведениями о терминалах", e);
      return EXIT_PARTIAL;
    }
    return snapshots.stream().allMatch(DeviceSnapshot::isSuccess) ? EXIT_OK : EXIT_PARTIAL;
  }

  private int clock(CommandArguments arguments) {
    DeviceDescriptor device = resolveDevice(arguments.positional(0));
    LocalDateTime now = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
    ClockCheck check = inspection.checkClock(device, now, arguments.flag("--update"));
    if (!check.isSuccess()) {
      return EXIT_PARTIAL;
    }
    logger.info("Время {}: {} (локальное: {}, расхождение {} с)",
        device, check.getDeviceTime(), check.getLocalTime(), check.getDrift().getSeconds());
    if (check.isOutOfSync()) {
      logger.warn("⚠️ Часы не синхронизированы, выставить их: clock {} --update", device.getIp());
    }
    return EXIT_OK;
  }

  private int users(CommandArguments arguments) {
    DeviceDescriptor device = resolveDevice(arguments.positional(0));
    List<UserRecord> roster;
    try {
      roster = sessions.run(device, userAdmin::fetchUsers);
    } catch (DeviceException | RuntimeException e) {
      logger.error("❌ Не удалось получить пользователей {}: {}", device, e.getMessage());
      return EXIT_PARTIAL;
    }
    UserDirectory directory = new UserDirectory(roster);
    List<UserRecord> selected;
    if (arguments.flag("--admins")) {
      selected = directory.admins();
    } else if (arguments.option("--user-id").isPresent()) {
      selected = directory.findByUserId(arguments.option("--user-id").get());
    } else if (arguments.option("--name").isPresent()) {
      selected = directory.findByName(arguments.option("--name").get());
    } else {
      selected = directory.all();
    }
    printUsers(device, selected);
    return EXIT_OK;
  }

  private int addUser(CommandArguments arguments) {
    DeviceDescriptor device = resolveDevice(arguments.positional(0));
    return administer(device, "создать пользователя", session -> {
      UserRecord user = new UserRecord(
          CommandArguments.parseInt("uid", arguments.positional(1)),
          arguments.positional(2),
          arguments.positional(3),
          arguments.flag("--admin") ? Privilege.ADMIN : Privilege.DEFAULT,
          arguments.option("--password").orElse(""),
          arguments.option("--group").orElse(""),
          CommandArguments.parseLong("card", arguments.option("--card").orElse("0")));
      return userAdmin.createUser(session, user);
    });
  }

  /**
   * Не указанные в команде поля берутся из текущей записи на терминале.
   */
  private int editUser(CommandArguments arguments) {
    DeviceDescriptor device = resolveDevice(arguments.positional(0));
    return administer(device, "изменить пользователя", session -> {
      int uid = CommandArguments.parseInt("uid", arguments.positional(1));
      UserRecord existing = new UserDirectory(userAdmin.fetchUsers(session)).findByUid(uid)
          .orElseThrow(() -> new IllegalArgumentException(
              "Пользователь с uid=" + uid + " не найден на терминале " + device.getIp()));
      Privilege privilege = existing.getPrivilege();
      if (arguments.flag("--admin")) {
        privilege = Privilege.ADMIN;
      } else if (arguments.flag("--user")) {
        privilege = Privilege.DEFAULT;
      }
      UserRecord edited = new UserRecord(uid,
          arguments.option("--user-id").orElse(existing.getUserId()),
          arguments.option("--name").orElse(existing.getName()),
          privilege,
          arguments.option("--password").orElse(existing.getPassword()),
          arguments.option("--group").orElse(existing.getGroupId()),
          arguments.option("--card").map(card -> CommandArguments.parseLong("card", card))
              .orElse(existing.getCard()));
      return userAdmin.updateUser(session, edited);
    });
  }

  private int deleteUser(CommandArguments arguments) {
    DeviceDescriptor device = resolveDevice(arguments.positional(0));
    return administer(device, "удалить пользователя",
        session -> userAdmin.deleteUser(session, CommandArguments.parseInt("uid", arguments.positional(1))));
  }

  /**
   * Изменение списка пользователей на терминале. Неверный ввод оператора и отказ
   * терминала дают код 1.
   */
  private int administer(DeviceDescriptor device, String action,
                         SessionWork<List<UserRecord>> work) {
    try {
      printUsers(device, sessions.run(device, work));
      return EXIT_OK;
    } catch (DeviceException | RuntimeException e) {
      logger.error("❌ Не удалось {} на {}: {}", action, device, e.getMessage());
      logger.debug("Подробности ошибки {}", device, e);
      return EXIT_PARTIAL;
    }
  }

  private int attendance(CommandArguments arguments) {
    DeviceDescriptor device = resolveDevice(arguments.positional(0));
    DeviceSyncResult<AttendanceEvent> result = syncService.syncAttendance(device);
    if (!result.isSuccess()) {
      logger.error("❌ Не удалось получить журнал {}: {}", device, result.getFailure());
      return EXIT_PARTIAL;
    }
    if (arguments.positionalCount() > 1) {
      String userId = arguments.positional(1).trim();
      List<AttendanceRow> rows = attendanceDao.findByUser(device.getIp(), userId);
      logger.info("Отметки user_id={} на {}: {}", userId, device, rows.size());
      for (AttendanceRow row : rows) {
        logger.info("  {}", row);
      }
    } else {
      logger.info("Отметки на {}: {}", device, result.getRecords().size());
      for (AttendanceEvent event : result.getRecords()) {
        logger.info("  {}", event);
      }
    }
    return EXIT_OK;
  }

  private static void printUsers(DeviceDescriptor device, List<UserRecord> users) {
    logger.info("Пользователи {}: {}", device, users.size());
    for (UserRecord user : users) {
      logger.info("  uid={} | {} | {} | user_id={} | группа={} | карта={}", user.getUid(), user.getName(),
          user.getPrivilege().label(), user.getUserId(), user.getGroupId(), user.cardText());
    }
  }

  private int live(String ip) {
    DeviceDescriptor device = resolveDevice(ip);
    DeviceSession session;
    try {
      session = connector.connect(device.getIp(), settings);
    } catch (DeviceException e) {
      logger.error("❌ Не удалось подключиться к {}: {}", device, e.getMessage());
      return EXIT_PARTIAL;
    }
    try {
      NameResolver resolver = NameResolver.build(normalizer.normalizeUsers(session.getUsers()));
      CancellationToken token = new CancellationToken();
      startQuitWatcher(token);
      logger.info("LIVE CAPTURE с {} (введите 'q' и Enter для выхода)", device);
      CaptureSummary summary = new LiveCaptureConsumer(normalizer).capture(session, resolver, token,
          event -> logger.info("{}", event));
      logger.info("Всего получено событий: {}", summary.getEvents());
      return summary.getStopReason() == CaptureSummary.StopReason.DEVICE_ERROR ? EXIT_PARTIAL : EXIT_OK;
    } catch (DeviceException e) {
      logger.error("❌ Ошибка обмена с {}: {}", device, e.getMessage());
      return EXIT_PARTIAL;
    } finally {
      try {
        session.disconnect();
      } catch (DeviceException e) {
        logger.warn("Не удалось корректно отключиться от {}: {}", device, e.getMessage());
      }
    }
  }

  /**
   * Ввод с консоли читается в отдельном потоке и только выставляет флаг отмены;
   * цикл захвата сам консоль не опрашивает.
   */
  private void startQuitWatcher(CancellationToken token) {
    Thread watcher = new Thread(() -> {
      try {
        BufferedReader reader = new BufferedReader(new InputStreamReader(console, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
          if ("q".equalsIgnoreCase(line.trim())) {
            token.cancel();
            return;
          }
        }
      } catch (IOException e) {
        logger.warn("Консоль недоступна, остановка live capture по 'q' не работает: {}", e.getMessage());
      }
    }, "live-capture-quit-watcher");
    watcher.setDaemon(true);
    watcher.start();
  }

  private DeviceDescriptor resolveDevice(String ip) {
    // IP не из реестра тоже допустим — как ручной ввод адреса
    return registry.findByIp(ip).orElseGet(() -> new DeviceDescriptor(ip.trim(), null));
  }

  private int usage() {
    printUsage();
    return EXIT_PARTIAL;
  }

  private static void printUsage() {
    logger.info("Использование: timeclock-sync <команда>");
    logger.info("  devices | sync-users | sync-attendance | export-devices [файл]");
    logger.info("  export-users <ip> | live <ip> | clock <ip> [--update]");
    logger.info("  users <ip> [--admins | --user-id X | --name Y]");
    logger.info("  add-user <ip> <uid> <user_id> <имя> [--admin] [--password P] [--card N] [--group G]");
    logger.info("  edit-user <ip> <uid> [--user-id X] [--name Y] [--admin | --user] [--password P] [--card N] [--group G]");
    logger.info("  delete-user <ip> <uid> | attendance <ip> [user_id]");
  }

  /**
   * Точка входа в приложение.
   * Инициализирует БД, загружает реестр и выполняет команду.
   * @param args Команда и её аргументы.
   */
  public static void main(String[] args) {
    System.exit(launch(args));
  }

  /**
   * Собирает приложение из конфигурации и выполняет команду.
   *
   * @return Код завершения; 2 — если запуск невозможен (хранилище, реестр, конфигурация,
   *     отсутствующий клиент протокола для команды, которой он нужен).
   */
  static int launch(String[] args) {
    try {
      DatabaseConnection database = DatabaseConnection.fromConfig();
      database.initializeDatabase();
      DeviceRegistry registry = DeviceRegistry.load(Paths.get(Config.getProperty("registry.file", "devices.json")));
      DeviceConnector connector = requiresDevice(args) ? loadConnector() : (ip, deviceSettings) -> {
        throw new IllegalStateException("Команда не использует подключение к терминалам");
      };
      return new TimeclockApp(registry, connector, DeviceSettings.fromConfig(), database,
          new UsersCsvExporter(), new DevicesCsvExporter(), System.in).run(args);
    } catch (RegistryException | StorageException | IllegalStateException | IllegalArgumentException e) {
      logger.error("❌ Запуск невозможен: {}", e.getMessage(), e);
      return EXIT_FATAL;
    }
  }

  private static DeviceConnector loadConnector() {
    return ServiceLoader.load(DeviceConnector.class).findFirst()
        .orElseThrow(() -> new IllegalStateException(
            "Не найден клиент протокола терминалов (META-INF/services/" + DeviceConnector.class.getName() + ")"));
  }
}
