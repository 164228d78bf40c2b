package ca.gc.cra.subhunt.api;

import ca.gc.cra.subhunt.application.pipeline.DiscoveryReport;
import ca.gc.cra.subhunt.application.port.HostSink;
import ca.gc.cra.subhunt.application.port.TransportException;
import ca.gc.cra.subhunt.config.CompositionRoot;
import ca.gc.cra.subhunt.config.ConfigMerger;
import ca.gc.cra.subhunt.config.DiscoveryConfig;
import ca.gc.cra.subhunt.config.DiscoveryDefaults;
import ca.gc.cra.subhunt.config.YamlConfigLoader;
import ca.gc.cra.subhunt.domain.Hostnames;
import ca.gc.cra.subhunt.logging.LoggingConfigurator;
import ca.gc.cra.subhunt.validation.Net;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SubHunt command-line entry point: discovers, validates and prints subdomains of one domain.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final Set<String> KNOWN_FLAGS = Set.of("--help", "--verbose", ConfigCliUtils.ALL_SOURCES_FLAG);
  private static final String SUMMARY_USAGE =
      "usage: subhunt <domain> [out=PATH] [--all] [config=PATH] [key=value ...] [--verbose] [--help]";
  private static final String HELP_TEXT = """
      SubHunt passive subdomain discovery

      Usage:
        subhunt <domain> [options]

      Required:
        domain                    Target domain, e.g. example.com

      Options:
        out=PATH                  Write a Markdown table of live hosts and their addresses
        --all                     Also query the Wayback Machine and crt.sh (best effort)
        config=PATH               YAML file with 'common' and 'discover' sections
        workers=1-1024            Concurrent DNS lookups (default 60)
        maxInFlight=N             Outstanding lookups before intake blocks (>= workers; default 2500)
        maxAttempts=1-20          Attempts per primary lookup request (default 6)
        pageLimit=1-10000         Results requested per lookup page (default 500)
        pageDelayMs=0-60000       Pause between lookup pages (default 150)
        httpTimeoutMs=1000-300000 Connect and request timeout (default 30000)
        userAgent=TEXT            User-Agent header (default thc-subd-cli/1.0)
        metricsExporter=otlp|none Configure metrics exporter (default none)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --verbose                 Enable DEBUG logging on stderr
        --help                    Show this message

      Live hostnames are printed to stdout, one per line, as they are validated.
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs discovery and returns the exit code without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::new);
  }

  /**
   * Runs discovery with a custom composition root factory.
   *
   * @param args raw CLI arguments
   * @param roots builds the composition root from the effective configuration and the result sink
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args, BiFunction<DiscoveryConfig, HostSink, CompositionRoot> roots) {
    Objects.requireNonNull(roots, "roots");
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.printLines(HELP_TEXT.stripTrailing().split("\n"));
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }

    for (String flag : input.flags()) {
      if (!KNOWN_FLAGS.contains(flag)) {
        return usageError("Unknown flag: " + flag);
      }
    }

    List<String> positionals = input.positionals();
    if (positionals.size() != 1) {
      return usageError(positionals.isEmpty()
          ? "Missing target domain"
          : "Expected exactly one target domain but got " + positionals.size());
    }
    String domain;
    try {
      domain = Net.validateDomain(Hostnames.normalize(positionals.get(0)));
    } catch (IllegalArgumentException ex) {
      return usageError("Invalid domain: " + ex.getMessage());
    }

    Map<String, String> cli;
    Optional<Path> configPath;
    try {
      cli = CliArgsParser.toMap(input.keyValueArgs());
      configPath = ConfigCliUtils.extractConfigPath(cli);
      ConfigCliUtils.applyFlags(input, cli);
      Map<String, String> known = DiscoveryDefaults.asFlatMap();
      for (String key : cli.keySet()) {
        if (!known.containsKey(key)) {
          throw new IllegalArgumentException("unknown option: " + key);
        }
      }
    } catch (IllegalArgumentException ex) {
      return usageError("Invalid argument: " + ex.getMessage());
    }

    DiscoveryConfig config;
    try {
      config = loadConfig(configPath, cli);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}: {}", configPath.orElse(null), ex.toString());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    try (CompositionRoot root = roots.apply(config, new ConsoleHostSink())) {
      DiscoveryReport report = root.discoveryUseCase().run(domain);
      log.info("Discovery for {} completed: {} live hosts from {} unique candidates",
          domain, report.liveHosts().size(), report.submitted());
      return ExitCode.SUCCESS;
    } catch (TransportException ex) {
      log.error("Upstream failure: {}", ex.getMessage());
      log.debug("Upstream failure detail", ex);
      return ExitCode.UPSTREAM_FAILURE;
    } catch (IllegalArgumentException ex) {
      log.error("Discovery configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Discovery interrupted for {}", domain);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during discovery", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static DiscoveryConfig loadConfig(Optional<Path> configPath, Map<String, String> cli)
      throws IOException {
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath.isPresent()) {
      yaml = Optional.of(YamlConfigLoader.load(configPath.get(), YamlConfigLoader.DISCOVER_SECTION));
      log.debug("Loaded {} settings from {}", yaml.get().size(), configPath.get());
    }
    Map<String, String> effective = new LinkedHashMap<>(
        ConfigMerger.buildEffectiveConfig(yaml, cli, DiscoveryDefaults.asFlatMap(), log::warn));
    TelemetryConfigurator.configureMetrics(effective);
    return DiscoveryConfig.fromMap(effective);
  }

  private static ExitCode usageError(String message) {
    log.error(message);
    CliPrinter.println(SUMMARY_USAGE);
    return ExitCode.INVALID_ARGS;
  }
}
