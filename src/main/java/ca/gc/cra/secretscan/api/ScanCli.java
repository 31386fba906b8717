package ca.gc.cra.secretscan.api;

import ca.gc.cra.secretscan.application.collect.BackoffSleeper;
import ca.gc.cra.secretscan.application.collect.CancellationSignal;
import ca.gc.cra.secretscan.application.collect.CollectorSettings;
import ca.gc.cra.secretscan.application.collect.ConcurrentCollector;
import ca.gc.cra.secretscan.application.collect.RetryPolicy;
import ca.gc.cra.secretscan.application.pattern.PatternConfigException;
import ca.gc.cra.secretscan.application.pattern.PatternMatcher;
import ca.gc.cra.secretscan.application.pattern.PatternRegistry;
import ca.gc.cra.secretscan.application.pipeline.FindingExtractor;
import ca.gc.cra.secretscan.application.pipeline.ScanSummary;
import ca.gc.cra.secretscan.application.pipeline.ScanUseCase;
import ca.gc.cra.secretscan.config.DefaultsForMode;
import ca.gc.cra.secretscan.config.ScanConfig;
import ca.gc.cra.secretscan.domain.pattern.PatternSet;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import ca.gc.cra.secretscan.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.secretscan.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@code scan} command: enumerates the selected AWS resources, matches their
 * configuration text against the pattern set and prints redacted findings.
 * <p><strong>Why:</strong> Finds credentials pasted into user data, templates, environment variables and scripts.</p>
 * <p><strong>Role:</strong> Driving adapter; wires configuration, AWS clients, metrics and the scan use case.</p>
 * <p><strong>Observability:</strong> Logs configuration and per-type totals; metrics go to OpenTelemetry when
 * {@code metricsExporter=otlp}.</p>
 *
 * @since 0.1.0
 */
public final class ScanCli {
  private static final Logger log = LoggerFactory.getLogger(ScanCli.class);
  private static final String SUMMARY_USAGE =
      "usage: scan [region=REGION] [profile=NAME] [services=ec2,lambda,...|all] [patterns=FILE] "
          + "[threads=1-256] [matchMode=line|all] [config=FILE] [--show] [--dry-run]";
  private static final String HELP_TEXT = """
      secretscan scan

      Usage:
        scan [options]

      AWS options:
        region=REGION               AWS region (default us-east-1)
        profile=NAME                Credentials profile (default: default provider chain)
        services=LIST|all           ec2, lambda, cloudformation (cf), codebuild, sagemaker, glue, emr
                                    (default ec2,cloudformation,sagemaker,emr,codebuild,glue)

      Matching options:
        patterns=FILE               JSON object of pattern name to regular expression (default bundled set)
        matchMode=line|all          line: report whole matching lines; all: report every match (default line)
        exclusions.NAME=a,b         Extra substrings that disqualify matches of pattern NAME
        show=true|false             Print matched values unredacted (default false)

      Collection options:
        threads=1-256               Concurrent detail fetches per resource type (default 4)
        retry.maxAttempts=1-10      Attempts per throttled call (default 5)
        retry.baseDelayMillis=MS    First backoff delay; doubles per attempt (default 1000)

      Global options:
        config=FILE                 YAML file with 'common' and 'scan' sections
        metricsExporter=otlp|none   OpenTelemetry metrics exporter (default none)
        otelEndpoint=URL            OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V  Extra OpenTelemetry resource attributes
        --show                      Same as show=true
        --dry-run                   Print the plan without contacting AWS
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Exit status:
        0 scan complete, 2 bad arguments, 3 file error, 4 bad configuration or patterns,
        5 a resource type could not be listed, 130 interrupted
      """;

  private ScanCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, ScanEnvironment::aws);
  }

  static ExitCode run(String[] args, Function<ScanConfig, ScanEnvironment> environments) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for scan CLI");
    }
    boolean dryRun = input.hasFlag("--dry-run");

    Map<String, String> cliKv;
    try {
      cliKv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.hasFlag("--show")) {
      cliKv.put("show", "true");
    }
    String configPath = ConfigCliUtils.extractConfigPath(cliKv);

    ScanConfig config;
    try {
      Map<String, String> effective = new LinkedHashMap<>(
          ConfigCliUtils.effectiveConfig(DefaultsForMode.SCAN, configPath, cliKv, log));
      TelemetryConfigurator.configureMetrics(effective);
      config = ScanConfig.fromMap(effective);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid scan configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    PatternSet patterns;
    try {
      PatternRegistry registry = new PatternRegistry(config.exclusions());
      patterns = config.patternsFile().isPresent()
          ? registry.load(config.patternsFile().get())
          : registry.loadDefault();
    } catch (PatternConfigException ex) {
      log.error("Invalid pattern configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    if (patterns.isEmpty()) {
      log.warn("No usable patterns; scan will report no findings");
    }

    if (dryRun) {
      printDryRunPlan(config, patterns);
      return ExitCode.SUCCESS;
    }
    logConfiguredScan(config, patterns);
    return execute(config, patterns, environments);
  }

  private static ExitCode execute(
      ScanConfig config, PatternSet patterns, Function<ScanConfig, ScanEnvironment> environments) {
    CancellationSignal cancellation = CancellationSignal.create();
    Thread shutdownHook = new Thread(() -> cancellation.cancel("shutdown requested"), "secretscan-shutdown");
    Runtime.getRuntime().addShutdownHook(shutdownHook);
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
        ScanEnvironment environment = environments.apply(config)) {
      RetryPolicy retry = new RetryPolicy(
          config.retryMaxAttempts(),
          config.retryBaseDelay(),
          environment.throttling(),
          BackoffSleeper.CANCELLABLE,
          metrics);
      ConcurrentCollector collector =
          new ConcurrentCollector(CollectorSettings.ofConcurrency(config.threads()), retry, metrics);
      ScanUseCase useCase = new ScanUseCase(
          collector,
          new FindingExtractor(new PatternMatcher(patterns), config.matchMode()),
          new ConsoleFindingReporter(config.show()),
          metrics);

      ScanSummary summary = useCase.run(environment.scanners(), cancellation);
      if (summary.hasEnumerationFailures()) {
        log.error("Scan finished with resource types that could not be listed");
        return ExitCode.RUNTIME_FAILURE;
      }
      log.info("Scan finished with {} findings", summary.totalFindings());
      return ExitCode.SUCCESS;
    } catch (CancellationException ex) {
      log.error("Scan cancelled: {}", ex.getMessage());
      return ExitCode.INTERRUPTED;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Scan interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (UncheckedIOException ex) {
      log.error("Scan I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Scan configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in scan", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      removeShutdownHook(shutdownHook);
    }
  }

  private static void removeShutdownHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook left in place");
    }
  }

  private static void logConfiguredScan(ScanConfig config, PatternSet patterns) {
    log.info(
        "Configured scan: region={}, services={}, threads={}, matchMode={}, patterns={}",
        config.region(),
        describeTypes(config),
        config.threads(),
        config.matchMode(),
        patterns.size());
  }

  private static void printDryRunPlan(ScanConfig config, PatternSet patterns) {
    CliPrinter.printLines(
        "Scan dry-run: AWS will not be contacted.",
        " Region           : " + config.region(),
        " Profile          : " + (config.profile().isEmpty() ? "<default chain>" : config.profile()),
        " Resource types   : " + describeTypes(config),
        " Threads          : " + config.threads(),
        " Match mode       : " + config.matchMode(),
        " Show values      : " + config.show(),
        " Patterns         : " + patterns.size() + " (" + config.patternsFile()
            .map(Object::toString).orElse("bundled") + ")",
        " Retry            : " + config.retryMaxAttempts() + " attempts, base delay "
            + config.retryBaseDelay().toMillis() + " ms",
        " Re-run without --dry-run to scan.");
  }

  private static String describeTypes(ScanConfig config) {
    return config.resourceTypes().stream().map(ResourceType::id).collect(Collectors.joining(","));
  }
}
