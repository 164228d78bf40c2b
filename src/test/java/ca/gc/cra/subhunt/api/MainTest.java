package ca.gc.cra.subhunt.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subhunt.application.port.HostSink;
import ca.gc.cra.subhunt.config.CompositionRoot;
import ca.gc.cra.subhunt.config.DiscoveryConfig;
import ca.gc.cra.subhunt.testutil.RecordingMetrics;
import ca.gc.cra.subhunt.testutil.RecordingSleeper;
import ca.gc.cra.subhunt.testutil.ScriptedHttp;
import ca.gc.cra.subhunt.testutil.StaticResolver;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class MainTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter stdout;

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final StaticResolver resolver = new StaticResolver()
      .answer("www.example.com", "192.0.2.10")
      .answer("api.example.com", "192.0.2.11");

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(Main.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    stdout = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(stdout, true));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsUsageAndSucceeds() {
    ExitCode code = Main.run(new String[] {"--help"}, failingRoots());

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(stdout.toString().contains("SubHunt passive subdomain discovery"));
    assertTrue(stdout.toString().contains("--all"));
  }

  @Test
  void missingDomainIsInvalidArgs() {
    ExitCode code = Main.run(new String[] {"workers=4"}, failingRoots());

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(stdout.toString().contains("usage: subhunt"));
    assertTrue(hasLogContaining("Missing target domain"));
  }

  @Test
  void twoDomainsAreInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"a.com", "b.com"}, failingRoots()));
  }

  @Test
  void urlOrAddressIsNotADomain() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"https://example.com/"}, failingRoots()));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"192.0.2.1"}, failingRoots()));
  }

  @Test
  void unknownFlagIsInvalidArgs() {
    ExitCode code = Main.run(new String[] {"example.com", "--fast"}, failingRoots());

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("Unknown flag: --fast"));
  }

  @Test
  void unknownOptionIsInvalidArgs() {
    ExitCode code = Main.run(new String[] {"example.com", "threads=4"}, failingRoots());

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("unknown option: threads"));
  }

  @Test
  void allFlagConflictingWithExplicitFalseIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS,
        Main.run(new String[] {"example.com", "--all", "allSources=false"}, failingRoots()));
  }

  @Test
  void outOfRangeValueIsConfigError() {
    ExitCode code = Main.run(new String[] {"example.com", "workers=0"}, failingRoots());

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(hasLogContaining("workers"));
  }

  @Test
  void workersAboveMaxInFlightIsConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR,
        Main.run(new String[] {"example.com", "workers=10", "maxInFlight=5"}, failingRoots()));
  }

  @Test
  void missingConfigFileIsConfigError() {
    Path missing = tempDir.resolve("absent.yaml");

    ExitCode code = Main.run(new String[] {"example.com", "config=" + missing}, failingRoots());

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(hasLogContaining("Unable to read configuration file"));
  }

  @Test
  void discoveryPrintsLiveHostsAndWritesReport() throws Exception {
    ScriptedHttp http = new ScriptedHttp().then(ScriptedHttp.json(
        "{\"subdomains\":[\"www.example.com\",\"API.example.com.\",\"gone.example.com\",\"www.example.org\"]}"));
    Path report = tempDir.resolve("hosts.md");

    ExitCode code = Main.run(
        new String[] {"Example.COM", "out=" + report, "workers=2", "maxInFlight=4"}, roots(http));

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = stdout.toString().lines().sorted().collect(Collectors.toList());
    assertEquals(List.of("api.example.com", "www.example.com"), lines);
    String markdown = Files.readString(report);
    assertTrue(markdown.contains("| www.example.com | 192.0.2.10 |"));
    assertFalse(markdown.contains("gone.example.com"));
  }

  @Test
  void yamlSettingsAreOverriddenByCli() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("subhunt.yaml"), """
        discover:
          workers: 2
          maxInFlight: 8
        """);
    ScriptedHttp http = new ScriptedHttp().then(ScriptedHttp.json("{\"subdomains\":[\"www.example.com\"]}"));

    ExitCode code = Main.run(new String[] {"example.com", "config=" + yaml, "workers=4"}, roots(http));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(hasLogContaining("CLI overrides YAML for key: workers"));
    assertEquals("www.example.com", stdout.toString().trim());
  }

  @Test
  void exhaustedPrimaryRetriesIsUpstreamFailure() {
    ScriptedHttp http = new ScriptedHttp().otherwise(request -> ScriptedHttp.status(503));

    ExitCode code = Main.run(new String[] {"example.com", "maxAttempts=2"}, roots(http));

    assertEquals(ExitCode.UPSTREAM_FAILURE, code);
    assertEquals(2, http.requestCount());
    assertTrue(hasLogContaining("Upstream failure"));
    assertEquals("", stdout.toString());
  }

  @Test
  void permanentHttpErrorIsUpstreamFailure() {
    ScriptedHttp http = new ScriptedHttp().then(ScriptedHttp.status(403));

    assertEquals(ExitCode.UPSTREAM_FAILURE, Main.run(new String[] {"example.com"}, roots(http)));
    assertEquals(1, http.requestCount());
  }

  private BiFunction<DiscoveryConfig, HostSink, CompositionRoot> roots(ScriptedHttp http) {
    return (config, sink) -> new CompositionRoot(config, sink, metrics, http, resolver, sleeper);
  }

  private static BiFunction<DiscoveryConfig, HostSink, CompositionRoot> failingRoots() {
    return (config, sink) -> {
      throw new AssertionError("discovery should not start");
    };
  }

  private boolean hasLogContaining(String text) {
    return appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains(text));
  }
}
