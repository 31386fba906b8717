package ca.gc.cra.secretscan.domain.pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class PatternSetTest {

  @Test
  void preservesRegistrationOrder() {
    PatternSet set = PatternSet.of(List.of(
        PatternEntry.of("b", Pattern.compile("b"), null),
        PatternEntry.of("a", Pattern.compile("a"), null)));

    assertEquals(List.of("b", "a"), List.copyOf(set.names()));
    assertEquals(2, set.size());
    assertTrue(set.find("a").isPresent());
    assertFalse(set.find("c").isPresent());
  }

  @Test
  void rejectsDuplicateNames() {
    List<PatternEntry> entries = List.of(
        PatternEntry.of("dup", Pattern.compile("x"), List.of()),
        PatternEntry.of("dup", Pattern.compile("y"), List.of()));

    assertThrows(IllegalArgumentException.class, () -> PatternSet.of(entries));
  }

  @Test
  void exclusionMatchesAnySubstring() {
    PatternEntry entry = PatternEntry.of("AWS_Client", Pattern.compile("aws"), List.of("iam:PassRole", ""));

    assertTrue(entry.isExcluded("Action: iam:PassRole for aws"));
    assertFalse(entry.isExcluded("aws configure"));
  }

  @Test
  void blankNameIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> PatternEntry.of(" ", Pattern.compile("x"), List.of()));
  }
}
