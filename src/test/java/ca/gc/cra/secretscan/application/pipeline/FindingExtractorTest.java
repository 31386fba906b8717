package ca.gc.cra.secretscan.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.secretscan.application.pattern.PatternMatcher;
import ca.gc.cra.secretscan.application.pattern.PatternRegistry;
import ca.gc.cra.secretscan.domain.pattern.MatchMode;
import ca.gc.cra.secretscan.domain.resource.Finding;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FindingExtractorTest {
  private static final ResourceRef REF = ResourceRef.of(ResourceType.CODEBUILD_PROJECT, "build-app");

  private final FindingExtractor extractor = new FindingExtractor(
      new PatternMatcher(new PatternRegistry().compile(Map.of("Secret_Word", "(?i)secret"))), MatchMode.LINE);

  @Test
  void textFieldsProduceTextFindings() {
    ResourceDetail detail = ResourceDetail.builder(REF)
        .text("Buildspec", "phases:\n  build:\n    - echo $SECRET\n")
        .build();

    List<Finding> findings = extractor.extract(detail);

    assertEquals(1, findings.size());
    Finding finding = findings.get(0);
    assertEquals(Finding.Kind.TEXT, finding.kind());
    assertEquals("Buildspec", finding.heading());
    assertEquals(List.of("    - echo $SECRET"), finding.values());
  }

  @Test
  void matchingKeyReportsTheEntryValue() {
    ResourceDetail detail = ResourceDetail.builder(REF)
        .keyValues("env variable", Map.of("DB_SECRET", "hunter2"))
        .build();

    List<Finding> findings = extractor.extract(detail);

    assertEquals(1, findings.size());
    Finding finding = findings.get(0);
    assertEquals(Finding.Kind.KEY, finding.kind());
    assertEquals("Key Matched in env variable: DB_SECRET (Pattern: Secret_Word)", finding.heading());
    assertEquals(List.of("hunter2"), finding.values());
  }

  @Test
  void matchingValueReportsTheMatch() {
    ResourceDetail detail = ResourceDetail.builder(REF)
        .keyValues("env variable", Map.of("NOTE", "my secret value"))
        .build();

    Finding finding = extractor.extract(detail).get(0);

    assertEquals(Finding.Kind.VALUE, finding.kind());
    assertEquals("Value of env variable key: NOTE (Pattern: Secret_Word)", finding.heading());
    assertEquals(List.of("my secret value"), finding.values());
  }

  @Test
  void keyAndValueMayBothMatch() {
    Map<String, String> env = new LinkedHashMap<>();
    env.put("SECRET_NAME", "secret-store/prod");

    List<Finding> findings = extractor.extract(ResourceDetail.builder(REF).keyValues("env variable", env).build());

    assertEquals(List.of(Finding.Kind.KEY, Finding.Kind.VALUE), findings.stream().map(Finding::kind).toList());
  }

  @Test
  void cleanDetailHasNoFindings() {
    ResourceDetail detail = ResourceDetail.builder(REF)
        .text("Buildspec", "version: 0.2")
        .keyValues("env variable", Map.of("STAGE", "prod"))
        .build();

    assertTrue(extractor.extract(detail).isEmpty());
  }
}
