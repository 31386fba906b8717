package ca.gc.cra.secretscan.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"region=us-west-2", "--Dry-Run", "--show", " "});

    assertArrayEquals(new String[] {"region=us-west-2"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.hasFlag("--SHOW"));
    assertFalse(input.help());
    assertFalse(input.verbose());
  }

  @Test
  void normalizesHelpAndVerboseSpellings() {
    CliInput input = CliInput.parse(new String[] {"-h", "--debug"});

    assertTrue(input.help());
    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--help"));
    assertTrue(input.hasFlag("--verbose"));
  }

  @Test
  void dashedKeyValueStaysAnArgument() {
    CliInput input = CliInput.parse(new String[] {"--config=scan.yaml"});

    assertArrayEquals(new String[] {"--config=scan.yaml"}, input.keyValueArgs());
    assertFalse(input.hasFlag("--config=scan.yaml"));
  }

  @Test
  void nullArgsAreEmpty() {
    CliInput input = CliInput.parse(null);

    assertArrayEquals(new String[0], input.keyValueArgs());
    assertTrue(input.flags().isEmpty());
  }
}
