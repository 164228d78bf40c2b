package ca.gc.cra.subhunt.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bootstraps the OpenTelemetry meter provider for SubHunt.
 *
 * <p>The CLI is short-lived, so the exporter defaults to {@code none}; {@code otlp} pushes to a
 * collector every 10 seconds and once more on close.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.subhunt";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;
  private static final String POM_PROPERTIES = "/META-INF/maven/ca.gc.cra/subhunt/pom.properties";
  private static final String FALLBACK_VERSION = "0.0.0-dev";
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize() {
    try {
      BootstrapConfig config = BootstrapConfig.fromEnvironment();
      if (config.exporter() == ExporterMode.NONE) {
        log.debug("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      return buildActive(config);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    Objects.requireNonNull(reader, "reader");
    String version = detectServiceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(buildResource(version, Attributes.empty()))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return BootstrapResult.active(provider, meter);
  }

  private static BootstrapResult buildActive(BootstrapConfig config) {
    OtlpGrpcMetricExporter exporter =
        OtlpGrpcMetricExporter.builder().setEndpoint(config.endpoint()).build();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(config.resource())
        .registerMetricReader(PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build())
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(config.instrumentationVersion())
        .build();
    log.info("OpenTelemetry metrics exporting via OTLP to {}", config.endpoint());
    return BootstrapResult.active(provider, meter);
  }

  private static Resource buildResource(String version, Attributes additional) {
    Attributes base = Attributes.builder()
        .put(SERVICE_NAME, "subhunt")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version)
        .build();
    Resource extra = additional.isEmpty() ? Resource.empty() : Resource.create(additional);
    return Resource.getDefault().merge(Resource.create(base)).merge(extra);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int idx = trimmed.indexOf('=');
      if (idx <= 0 || idx == trimmed.length() - 1) {
        log.warn("Ignoring malformed resource attribute entry: {}", trimmed);
        continue;
      }
      builder.put(AttributeKey.stringKey(trimmed.substring(0, idx).trim()), trimmed.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String fromManifest = pkg == null ? null : pkg.getImplementationVersion();
    return firstNonBlank(fromManifest, readPomVersion(), FALLBACK_VERSION);
  }

  private static String readPomVersion() {
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(POM_PROPERTIES)) {
      if (in == null) {
        return null;
      }
      Properties props = new Properties();
      props.load(in);
      return props.getProperty("version");
    } catch (IOException ex) {
      log.debug("Unable to read {} for version detection", POM_PROPERTIES, ex);
      return null;
    }
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }

  record BootstrapConfig(ExporterMode exporter, String endpoint, Resource resource, String instrumentationVersion) {
    static BootstrapConfig fromEnvironment() {
      Properties props = System.getProperties();
      ExporterMode exporter = ExporterMode.from(firstNonBlank(
          props.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), "none"));
      String endpoint = firstNonBlank(
          props.getProperty("otel.exporter.otlp.endpoint"),
          System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      String resourceAttrs = firstNonBlank(
          props.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"), "");
      String version = detectServiceVersion();
      return new BootstrapConfig(
          exporter, endpoint, buildResource(version, parseResourceAttributes(resourceAttrs)), version);
    }
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> {
          log.warn("Unknown metrics exporter '{}'; metrics disabled", raw);
          yield NONE;
        }
      };
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      MeterProvider provider = MeterProvider.noop();
      return new BootstrapResult(provider.get(INSTRUMENTATION_SCOPE), null);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        await(provider.shutdown(), "shutdown");
      } catch (RuntimeException ex) {
        log.warn("OpenTelemetry meter provider shutdown failed", ex);
      }
    }

    private static void await(CompletableResultCode result, String operation) {
      if (!result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("OpenTelemetry metrics {} did not complete within {} s", operation, SHUTDOWN_TIMEOUT_SECONDS);
      }
    }
  }
}
