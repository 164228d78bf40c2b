package ca.gc.cra.subhunt.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private static final String[] PROPERTIES = {
      "otel.metrics.exporter", "otel.exporter.otlp.endpoint", "otel.resource.attributes"};

  @AfterEach
  void clearProperties() {
    for (String property : PROPERTIES) {
      System.clearProperty(property);
    }
  }

  @Test
  void setsPropertiesAndRemovesTelemetryKeys() {
    Map<String, String> settings = new HashMap<>(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "env=test",
        "workers", "4"));

    TelemetryConfigurator.configureMetrics(settings);

    assertEquals(Map.of("workers", "4"), settings);
    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("env=test", System.getProperty("otel.resource.attributes"));
  }

  @Test
  void blankValuesLeaveEnvironmentInCharge() {
    Map<String, String> settings = new HashMap<>(Map.of("metricsExporter", "", "otelEndpoint", " "));

    TelemetryConfigurator.configureMetrics(settings);

    assertEquals(Map.of(), settings);
    assertNull(System.getProperty("otel.metrics.exporter"));
    assertNull(System.getProperty("otel.exporter.otlp.endpoint"));
  }

  @Test
  void rejectsUnknownExporter() {
    Map<String, String> settings = new HashMap<>(Map.of("metricsExporter", "prometheus"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(settings));
  }

  @Test
  void rejectsNonHttpEndpoint() {
    Map<String, String> settings = new HashMap<>(Map.of("otelEndpoint", "ftp://collector"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(settings));
  }
}
