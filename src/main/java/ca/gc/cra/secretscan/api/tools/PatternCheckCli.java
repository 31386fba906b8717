package ca.gc.cra.secretscan.api.tools;

import ca.gc.cra.secretscan.api.CliArgsParser;
import ca.gc.cra.secretscan.api.CliInput;
import ca.gc.cra.secretscan.api.CliPrinter;
import ca.gc.cra.secretscan.api.ConfigCliUtils;
import ca.gc.cra.secretscan.api.ExitCode;
import ca.gc.cra.secretscan.application.pattern.PatternConfigException;
import ca.gc.cra.secretscan.application.pattern.PatternMatcher;
import ca.gc.cra.secretscan.application.pattern.PatternRegistry;
import ca.gc.cra.secretscan.application.pattern.Redactor;
import ca.gc.cra.secretscan.config.DefaultsForMode;
import ca.gc.cra.secretscan.config.PatternCheckConfig;
import ca.gc.cra.secretscan.domain.pattern.MatchSet;
import ca.gc.cra.secretscan.domain.pattern.PatternEntry;
import ca.gc.cra.secretscan.domain.pattern.PatternSet;
import ca.gc.cra.secretscan.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline utility that compiles a pattern file, lists the usable patterns and optionally scans a local file.
 * Needs no AWS credentials.
 */
public final class PatternCheckCli {
  private static final Logger log = LoggerFactory.getLogger(PatternCheckCli.class);
  private static final String SUMMARY_USAGE =
      "usage: patterns [patterns=FILE] [file=PATH] [matchMode=line|all] [--show]";
  private static final String HELP_TEXT = """
      secretscan pattern check

      Usage:
        patterns [patterns=FILE] [file=PATH] [options]

      Options:
        patterns=FILE               Pattern JSON to compile (default bundled set)
        file=PATH                   Local file to scan with the compiled patterns
        matchMode=line|all          Matching strategy (default line)
        exclusions.NAME=a,b         Extra substrings that disqualify matches of pattern NAME
        config=FILE                 YAML file with 'common' and 'patterns' sections
        --show                      Print matched values unredacted
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Example:
        patterns patterns=./my-patterns.json file=./user-data.sh
      """;

  private PatternCheckCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the utility.
   *
   * @param args command-line arguments
   * @return exit code
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for patterns CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.hasFlag("--show")) {
      kv.put("show", "true");
    }
    String configPath = ConfigCliUtils.extractConfigPath(kv);

    PatternCheckConfig config;
    try {
      config = PatternCheckConfig.fromMap(
          ConfigCliUtils.effectiveConfig(DefaultsForMode.PATTERNS, configPath, kv, log));
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
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
    printPatterns(config, patterns);

    if (config.sampleFile().isEmpty()) {
      return ExitCode.SUCCESS;
    }
    Path sample = config.sampleFile().get();
    String text;
    try {
      text = Files.readString(sample, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      log.error("Unable to read {}", sample, ex);
      return ExitCode.IO_ERROR;
    }
    printMatches(sample, new PatternMatcher(patterns).match(text, config.matchMode()), config.show());
    return ExitCode.SUCCESS;
  }

  private static void printPatterns(PatternCheckConfig config, PatternSet patterns) {
    CliPrinter.println("Compiled " + patterns.size() + " patterns from "
        + config.patternsFile().map(Path::toString).orElse("bundled set") + ":");
    for (PatternEntry entry : patterns.entries()) {
      StringBuilder line = new StringBuilder("  ").append(entry.name());
      if (entry.passwordPolicy()) {
        line.append(" [password policy]");
      }
      if (entry.fallback()) {
        line.append(" [fallback expression]");
      }
      if (!entry.exclusions().isEmpty()) {
        line.append(" excludes: ").append(String.join(", ", entry.exclusions()));
      }
      CliPrinter.println(line.toString());
    }
  }

  private static void printMatches(Path sample, MatchSet matches, boolean show) {
    if (matches.isEmpty()) {
      CliPrinter.println("No matches in " + sample);
      return;
    }
    CliPrinter.println(matches.totalMatches() + " matches in " + sample + ":");
    for (Map.Entry<String, List<String>> entry : matches.asMap().entrySet()) {
      CliPrinter.println("  Pattern: " + entry.getKey());
      for (String value : entry.getValue()) {
        CliPrinter.println("    " + Redactor.display(value, show));
      }
    }
  }
}
