package ca.gc.cra.secretscan.application.pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.secretscan.domain.pattern.PasswordPolicy;
import ca.gc.cra.secretscan.domain.pattern.PatternEntry;
import ca.gc.cra.secretscan.domain.pattern.PatternSet;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PatternRegistryTest {
  @TempDir Path tempDir;

  @Test
  void loadsFlatObjectInFileOrder() throws Exception {
    Path file = tempDir.resolve("patterns.json");
    Files.writeString(file, "{\"Zeta\": \"zeta\\\\d+\", \"Alpha\": \"alpha\"}");

    PatternSet set = new PatternRegistry().load(file);

    assertEquals(List.of("Zeta", "Alpha"), List.copyOf(set.names()));
    assertTrue(set.find("Zeta").orElseThrow().pattern().matcher("zeta42").matches());
  }

  @Test
  void dropsInvalidExpressionsAndKeepsTheRest() throws Exception {
    PatternSet set = new PatternRegistry().load(json("{\"Broken\": \"(unclosed\", \"Good\": \"ok\"}"), "inline");

    assertEquals(List.of("Good"), List.copyOf(set.names()));
  }

  @Test
  void invalidPasswordExpressionFallsBack() throws Exception {
    PatternSet set = new PatternRegistry().load(json("{\"Password Pattern\": \"[bad\"}"), "inline");

    PatternEntry entry = set.find(PasswordPolicy.RESERVED_NAME).orElseThrow();
    assertTrue(entry.passwordPolicy());
    assertTrue(entry.fallback());
    assertEquals(PasswordPolicy.FALLBACK_EXPRESSION, entry.pattern().pattern());
  }

  @Test
  void validPasswordExpressionIsKept() {
    Map<String, String> expressions = new LinkedHashMap<>();
    expressions.put(PasswordPolicy.RESERVED_NAME, "^\\S{8,}$");

    PatternEntry entry = new PatternRegistry().compile(expressions).find(PasswordPolicy.RESERVED_NAME).orElseThrow();

    assertTrue(entry.passwordPolicy());
    assertFalse(entry.fallback());
  }

  @Test
  void awsClientAlwaysCarriesBuiltInExclusions() {
    PatternRegistry registry = new PatternRegistry(Map.of("AWS_Client", List.of("S3Key", " sts:AssumeRole ")));

    PatternEntry entry = registry.compile(Map.of("AWS_Client", "aws")).find("AWS_Client").orElseThrow();

    assertEquals(List.of("iam:PassRole", "S3Key", "sts:AssumeRole"), entry.exclusions());
  }

  @Test
  void configuredExclusionsApplyToOtherPatterns() {
    PatternRegistry registry = new PatternRegistry(Map.of("Token", List.of("example")));

    PatternEntry entry = registry.compile(Map.of("Token", "tok")).find("Token").orElseThrow();

    assertEquals(List.of("example"), entry.exclusions());
  }

  @Test
  void rejectsNonObjectDocument() {
    PatternConfigException ex = assertThrows(PatternConfigException.class,
        () -> new PatternRegistry().load(json("[\"a\"]"), "inline"));
    assertTrue(ex.getMessage().contains("must be a JSON object"));
  }

  @Test
  void rejectsNonStringExpression() {
    assertThrows(PatternConfigException.class,
        () -> new PatternRegistry().load(json("{\"Count\": 3}"), "inline"));
  }

  @Test
  void rejectsDuplicateNames() {
    PatternConfigException ex = assertThrows(PatternConfigException.class,
        () -> new PatternRegistry().load(json("{\"A\": \"a\", \"A\": \"b\"}"), "inline"));
    assertTrue(ex.getMessage().contains("more than once"));
  }

  @Test
  void rejectsMalformedJson() {
    assertThrows(PatternConfigException.class,
        () -> new PatternRegistry().load(json("{\"A\": \"a\""), "inline"));
  }

  @Test
  void missingFileIsReported() {
    PatternConfigException ex = assertThrows(PatternConfigException.class,
        () -> new PatternRegistry().load(tempDir.resolve("absent.json")));
    assertTrue(ex.getMessage().startsWith("Pattern file not found"));
  }

  @Test
  void bundledPatternsCompileCompletely() throws Exception {
    PatternSet set = new PatternRegistry().loadDefault();

    assertTrue(set.size() >= 10);
    assertTrue(set.find("AWS_Client").isPresent());
    PatternEntry password = set.find(PasswordPolicy.RESERVED_NAME).orElseThrow();
    assertTrue(password.passwordPolicy());
    assertFalse(password.fallback());
  }

  private static InputStream json(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }
}
