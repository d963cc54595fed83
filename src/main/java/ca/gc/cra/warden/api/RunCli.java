package ca.gc.cra.warden.api;

import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.config.CompositionRoot;
import ca.gc.cra.warden.config.ConfigMerger;
import ca.gc.cra.warden.config.DefaultsForMode;
import ca.gc.cra.warden.config.ModerationConfig;
import ca.gc.cra.warden.config.ModerationRuntime;
import ca.gc.cra.warden.config.YamlConfigLoader;
import ca.gc.cra.warden.infrastructure.discord.JdaConnector;
import ca.gc.cra.warden.infrastructure.discord.JdaEventBridge;
import ca.gc.cra.warden.infrastructure.discord.JdaPlatformGateway;
import ca.gc.cra.warden.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.warden.logging.LoggingConfigurator;
import ca.gc.cra.warden.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the moderation agent from CLI key-value arguments.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String MODE = "run";
  private static final String SUMMARY_USAGE =
      "usage: warden run [config=PATH] [trustedAccounts=ID,...] [tokenEnv=NAME] [invite.threshold=N] "
          + "[timeoutMinutes=N] [webhook.threshold=N] [events.workers=N] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      WARDEN moderation agent

      Usage:
        warden run [options]

      The bot token is read from the environment variable named by tokenEnv (default DISCORD_TOKEN).

      Options (defaults in parentheses):
        config=PATH                    YAML file with common/run sections (WARDEN_CONFIG, ./warden.yaml)
        trustedAccounts=ID,...         Accounts exempt from enforcement; repeatable
        tokenEnv=NAME                  Environment variable holding the token (DISCORD_TOKEN)
        invite.windowSeconds=1-3600    Invite detection window (15)
        invite.threshold=1-1000        Invite posts within the window that trigger a timeout (5)
        invite.capacity=N              Per-account window capacity (50)
        invite.deleteTrusted=BOOL      Also delete invites posted by trusted accounts (false)
        timeoutMinutes=1-40320         Invite-spam timeout (60)
        webhook.threshold=1-100        Unauthorized webhooks before a kick (3)
        webhook.freshnessSeconds=N     Webhook audit record age limit (30)
        webhook.pageSize=1-100         Webhook audit records per event (6)
        webhook.searchChannelLimit=N   Channels searched for a webhook (50)
        audit.freshnessSeconds=N       Attribution audit record age limit (20)
        audit.pageSize=1-100           Audit records per attribution query (8)
        audit.retries=0-5              Extra attribution attempts (1)
        audit.propagationDelayMillis=N Wait before attribution (1000)
        audit.throttleMillis=N         Spacing between identical audit lookups (1000)
        events.workers=1-256           Event worker threads (8)
        events.queueCapacity=N         Pending event bound (1024)
        sweep.intervalSeconds=N        Idle state sweep period (60)
        metricsExporter=otlp|none      Metrics exporter (none)
        otelEndpoint=URL               OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V     Comma-separated OTel resource attributes
        --dry-run                      Validate configuration and print the plan without connecting
        --verbose                      Enable DEBUG logging
        --help                         Show this message
      """;

  private RunCli() {}

  /**
   * Executes the run command using the process environment.
   *
   * @param args raw CLI arguments
   * @return exit code signalling success or failure
   */
  static ExitCode run(String[] args) {
    return run(args, System::getenv);
  }

  /**
   * Executes the run command.
   *
   * @param args raw CLI arguments
   * @param env environment lookup
   * @return exit code signalling success or failure
   */
  static ExitCode run(String[] args, Function<String, String> env) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    for (String flag : input.unknownFlags()) {
      log.warn("Ignoring unknown flag {}", flag);
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path configPath = ConfigCliUtils.extractConfigPath(kv, env);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      if (!Files.exists(configPath)) {
        log.error("Configuration file does not exist: {}", configPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(configPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", configPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    String exporter;
    ModerationConfig config;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
      Map<String, String> configInputs = new LinkedHashMap<>(effective);
      exporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = ModerationConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    boolean dryRun = input.dryRun() || ConfigCliUtils.parseBoolean(effective, "dryRun");
    String token = env.apply(config.tokenEnv());
    boolean tokenPresent = token != null && !token.isBlank();
    if (dryRun) {
      printDryRunPlan(config, configPath, exporter, tokenPresent);
      return ExitCode.SUCCESS;
    }
    if (!tokenPresent) {
      log.error("Environment variable {} is not set; it must hold the bot token", config.tokenEnv());
      return ExitCode.CONFIG_ERROR;
    }
    log.debug("Using token from {} ({})", config.tokenEnv(), Logs.redact(token));
    return runAgent(config, token.trim(), exporter);
  }

  private static ExitCode runAgent(ModerationConfig config, String token, String exporter) {
    MetricsPort metrics = CompositionRoot.metricsFor(exporter);
    JdaConnector connector = null;
    try {
      connector = JdaConnector.connect(token);
      JdaPlatformGateway gateway = connector.gateway();
      CompositionRoot root = new CompositionRoot(config, new SystemClockAdapter(), metrics);
      ModerationRuntime runtime = root.start(gateway, gateway);
      connector.register(new JdaEventBridge(runtime.router()));

      CountDownLatch stopped = new CountDownLatch(1);
      JdaConnector session = connector;
      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
        log.info("Shutdown requested; stopping gateway session");
        try {
          session.close();
          runtime.close();
          closeMetrics(metrics);
        } finally {
          stopped.countDown();
        }
      }, "warden-shutdown"));
      log.info("Moderation agent running; press Ctrl+C to stop");
      stopped.await();
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Startup rejected: {}", ex.getMessage());
      closeQuietly(connector, metrics);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Interrupted while running the moderation agent");
      closeQuietly(connector, metrics);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in moderation agent", ex);
      closeQuietly(connector, metrics);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void closeQuietly(JdaConnector connector, MetricsPort metrics) {
    if (connector != null) {
      connector.close();
    }
    closeMetrics(metrics);
  }

  private static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }

  private static void printDryRunPlan(
      ModerationConfig config, Path configPath, String exporter, boolean tokenPresent) {
    Map<String, String> rows = new LinkedHashMap<>();
    rows.put("Config file", configPath == null ? "" : configPath.toString());
    rows.put("Token variable", config.tokenEnv() + (tokenPresent ? " (set)" : " (NOT SET)"));
    rows.put("Trusted accounts", Integer.toString(config.trustedAccounts().size()));
    rows.put("Invite limit", config.inviteThreshold() + " in " + config.inviteWindow().toSeconds() + "s");
    rows.put("Invite timeout", config.timeout().toMinutes() + " min");
    rows.put("Delete trusted invites", Boolean.toString(config.deleteTrustedInvites()));
    rows.put("Webhook kick after", config.webhookThreshold() + " violations");
    rows.put("Audit freshness", config.auditFreshness().toSeconds() + "s (webhooks "
        + config.webhookFreshness().toSeconds() + "s)");
    rows.put("Audit retries", Integer.toString(config.auditRetries()));
    rows.put("Event workers", config.eventWorkers() + " (queue " + config.eventQueueCapacity() + ")");
    rows.put("Metrics exporter", exporter);
    CliPrinter.printTable("Run dry-run: the agent will not connect.", rows);
    CliPrinter.println(" Re-run without --dry-run to start moderating.");
  }
}
