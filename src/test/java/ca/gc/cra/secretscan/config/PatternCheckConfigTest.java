package ca.gc.cra.secretscan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.secretscan.domain.pattern.MatchMode;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PatternCheckConfigTest {

  @Test
  void defaultsListBundledPatterns() {
    PatternCheckConfig config = PatternCheckConfig.fromMap(DefaultsForMode.asFlatMap(DefaultsForMode.PATTERNS));

    assertTrue(config.patternsFile().isEmpty());
    assertTrue(config.sampleFile().isEmpty());
    assertEquals(MatchMode.LINE, config.matchMode());
    assertFalse(config.show());
    assertTrue(config.exclusions().isEmpty());
  }

  @Test
  void fromMapReadsFilesAndExclusions() {
    PatternCheckConfig config = PatternCheckConfig.fromMap(Map.of(
        "patterns", "custom.json",
        "file", "userdata.sh",
        "matchMode", "ALL-SUBMATCHES",
        "show", "true",
        "exclusions.JWT", "eyJexample"));

    assertEquals(Path.of("custom.json"), config.patternsFile().orElseThrow());
    assertEquals(Path.of("userdata.sh"), config.sampleFile().orElseThrow());
    assertEquals(MatchMode.ALL_SUBMATCHES, config.matchMode());
    assertTrue(config.show());
    assertEquals(List.of("eyJexample"), config.exclusions().get("JWT"));
  }
}
