package ca.gc.cra.subhunt.api;

import ca.gc.cra.subhunt.validation.Net;
import ca.gc.cra.subhunt.validation.Strings;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry-related settings to the active JVM for OpenTelemetry bootstrapping.
 *
 * <p>Telemetry keys are removed from the map so that only discovery settings remain. Blank values leave
 * the corresponding {@code OTEL_*} environment variables in effect.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static void configureMetrics(Map<String, String> settings) {
    if (settings == null || settings.isEmpty()) {
      return;
    }
    String exporter = settings.remove("metricsExporter");
    if (exporter != null) {
      String normalized = exporter.trim().toLowerCase(Locale.ROOT);
      if (!normalized.isEmpty()) {
        if (!normalized.equals("otlp") && !normalized.equals("none")) {
          throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
        }
        log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
        System.setProperty("otel.metrics.exporter", normalized);
      }
    }

    String endpoint = settings.remove("otelEndpoint");
    if (endpoint != null) {
      String trimmed = endpoint.trim();
      if (!trimmed.isEmpty()) {
        Net.validateHttpUrl("otelEndpoint", trimmed);
        log.debug("Configuring OTLP endpoint: {}", trimmed);
        System.setProperty("otel.exporter.otlp.endpoint", trimmed);
      }
    }

    String resourceAttributes = settings.remove("otelResourceAttributes");
    if (resourceAttributes != null) {
      String trimmed = resourceAttributes.trim();
      if (!trimmed.isEmpty()) {
        Strings.requirePrintableAscii("otelResourceAttributes", trimmed, MAX_RESOURCE_ATTRIBUTES_LENGTH);
        log.debug("Configuring OTEL_RESOURCE_ATTRIBUTES override");
        System.setProperty("otel.resource.attributes", trimmed);
      }
    }
  }
}
