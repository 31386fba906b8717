package ca.gc.cra.secretscan.domain.resource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResourceDetailTest {

  @Test
  void builderSkipsEmptyFields() {
    ResourceDetail detail = ResourceDetail.builder(ResourceRef.of(ResourceType.GLUE_JOB, "etl"))
        .label("Script Location", " ")
        .text("Script", "")
        .text("Other", null)
        .keyValues("Default Arguments", Map.of())
        .build();

    assertTrue(detail.labels().isEmpty());
    assertTrue(detail.textFields().isEmpty());
    assertTrue(detail.keyValueFields().isEmpty());
  }

  @Test
  void keyValueFieldDropsNullKeysAndBlanksNullValues() {
    Map<String, String> entries = new LinkedHashMap<>();
    entries.put("A", null);
    entries.put(null, "ignored");
    entries.put("B", "b");

    ResourceDetail.KeyValueField field = new ResourceDetail.KeyValueField("env variable", entries);

    assertEquals(List.of("A", "B"), List.copyOf(field.entries().keySet()));
    assertEquals("", field.entries().get("A"));
  }

  @Test
  void refDefaultsDisplayNameToId() {
    ResourceRef ref = new ResourceRef(ResourceType.EC2_INSTANCE, "i-123", " ");

    assertEquals("i-123", ref.displayName());
  }

  @Test
  void findingRequiresValues() {
    assertThrows(IllegalArgumentException.class,
        () -> new Finding("UserData", "UserData", "p", Finding.Kind.TEXT, List.of()));
  }
}
