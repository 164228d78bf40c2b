package ca.gc.cra.subhunt.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  private final Map<String, String> defaults = DiscoveryDefaults.asFlatMap();

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> yaml = Map.of("workers", "20", "maxInFlight", "400");
    Map<String, String> cli = Map.of("workers", "30");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig(Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("30", merged.get("workers"));
    assertEquals("400", merged.get("maxInFlight"));
    assertEquals("500", merged.get("pageLimit"));
    assertEquals(List.of("CLI overrides YAML for key: workers"), warnings);
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("pageDelayMs", "0")), Map.of(), defaults, warnings::add);

    assertEquals("0", merged.get("pageDelayMs"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void unknownKeysAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("wokers", "4")), Map.of(), defaults, msg -> {}));
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of("iface", "eth0"), defaults, msg -> {}));
  }

  @Test
  void workersMustNotExceedInFlightCap() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            Optional.of(Map.of("maxInFlight", "10")), Map.of("workers", "11"), defaults, msg -> {}));
    assertTrue(ex.getMessage().contains("maxInFlight"));
  }

  @Test
  void backoffBaseMustNotExceedCeiling() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of("baseBackoffMs", "30000"), defaults, msg -> {}));
  }

  @Test
  void malformedNumbersAreLeftForFieldValidation() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of("workers", "many"), defaults, msg -> {});
    assertEquals("many", merged.get("workers"));
  }
}
