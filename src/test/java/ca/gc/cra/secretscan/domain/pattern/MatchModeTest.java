package ca.gc.cra.secretscan.domain.pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class MatchModeTest {

  @Test
  void blankSelectsLineMode() {
    assertEquals(MatchMode.LINE, MatchMode.fromString(null));
    assertEquals(MatchMode.LINE, MatchMode.fromString("  "));
  }

  @Test
  void acceptsLegacySelectors() {
    assertEquals(MatchMode.ALL_SUBMATCHES, MatchMode.fromString("FindAllStringSubmatch"));
    assertEquals(MatchMode.ALL_SUBMATCHES, MatchMode.fromString("all_submatches"));
    assertEquals(MatchMode.LINE, MatchMode.fromString("MatchString"));
  }

  @Test
  void rejectsUnknownMode() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> MatchMode.fromString("fuzzy"));
    assertEquals("matchMode must be 'line' or 'all-submatches' (was 'fuzzy')", ex.getMessage());
  }
}
