package ca.gc.cra.subhunt.infrastructure.metrics;

import ca.gc.cra.subhunt.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards SubHunt counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily per key. Closing the adapter flushes and shuts down the meter
 * provider, which is what pushes the final numbers of a CLI run.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("subhunt.metric.key");
  private static final String FALLBACK_METRIC_NAME = "subhunt.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final boolean noop;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter selected by system properties or environment.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    this.noop = bootstrap.isNoop();
    if (noop) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    if (noop) {
      return;
    }
    CounterInstrument instrument =
        counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    if (noop) {
      return;
    }
    HistogramInstrument instrument =
        histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private CounterInstrument createCounter(String key) {
    String sanitized = sanitizeName(key);
    LongCounter counter = meter
        .counterBuilder(sanitized)
        .setUnit("1")
        .setDescription("SubHunt counter for " + key)
        .build();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, sanitized);
    }
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private HistogramInstrument createHistogram(String key) {
    String sanitized = sanitizeName(key);
    LongHistogram histogram = meter
        .histogramBuilder(sanitized)
        .ofLongs()
        .setDescription("SubHunt observation for " + key)
        .build();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized histogram name '{}' -> '{}'", key, sanitized);
    }
    return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.') {
        result.append(c);
      } else {
        result.append('_');
      }
    }
    return result.toString();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
