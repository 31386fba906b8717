package ca.gc.cra.secretscan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void scanDefaultsIncludeCommonAndScanKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("SCAN");

    assertEquals("line", defaults.get("matchMode"));
    assertEquals("us-east-1", defaults.get("region"));
    assertEquals("ec2,cloudformation,sagemaker,emr,codebuild,glue", defaults.get("services"));
    assertEquals("4", defaults.get("threads"));
    assertEquals("5", defaults.get("retry.maxAttempts"));
    assertEquals("1000", defaults.get("retry.baseDelayMillis"));
    assertFalse(defaults.containsKey("file"));
  }

  @Test
  void patternDefaultsOmitAwsKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(DefaultsForMode.PATTERNS);

    assertEquals("", defaults.get("file"));
    assertFalse(defaults.containsKey("region"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
