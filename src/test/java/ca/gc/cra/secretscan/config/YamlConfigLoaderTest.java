package ca.gc.cra.secretscan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("secretscan.yaml");
    Files.writeString(yaml, """
        common:
          matchMode: all-submatches
        scan:
          region: ca-central-1
          threads: 8
        patterns:
          file: /tmp/sample.txt
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "scan").orElseThrow();

    assertEquals("all-submatches", map.get("matchMode"));
    assertEquals("ca-central-1", map.get("region"));
    assertEquals("8", map.get("threads"));
    assertFalse(map.containsKey("file"));
  }

  @Test
  void modeSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("override.yaml");
    Files.writeString(yaml, """
        common:
          show: false
        Scan:
          show: true
        """);

    assertEquals("true", YamlConfigLoader.load(yaml, "scan").orElseThrow().get("show"));
  }

  @Test
  void loadFlattensNestedMapsAndJoinsLists() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        scan:
          services: [ec2, lambda]
          exclusions:
            AWS_Client:
              - sts:AssumeRole
              - iam:PassRole
          retry:
            maxAttempts: 3
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "scan").orElseThrow();

    assertEquals("ec2,lambda", map.get("services"));
    assertEquals("sts:AssumeRole,iam:PassRole", map.get("exclusions.AWS_Client"));
    assertEquals("3", map.get("retry.maxAttempts"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "scan");
    assertTrue(result.isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "scan").orElseThrow());
  }

  @Test
  void listItemsWithCommasAreRejected() throws IOException {
    Path yaml = tempDir.resolve("commas.yaml");
    Files.writeString(yaml, """
        scan:
          exclusions:
            AWS_Client: ["a,b"]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "scan"));
  }

  @Test
  void nonMappingSectionIsRejected() throws IOException {
    Path yaml = tempDir.resolve("bad.yaml");
    Files.writeString(yaml, """
        scan:
          - region
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "scan"));
  }

  @Test
  void malformedYamlIsReportedAsIllegalArgument() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "scan: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "scan"));
  }
}
