package ca.gc.cra.secretscan.domain.resource;

import java.util.Objects;

/**
 * Lightweight identifier emitted by a listing source.
 *
 * @param type resource type
 * @param id identifier passed back to the detail fetch (instance id, function name, stack id, ...)
 * @param displayName human-readable name; defaults to {@code id}
 * @since 0.1.0
 */
public record ResourceRef(ResourceType type, String id, String displayName) {
  public ResourceRef {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(id, "id");
    displayName = displayName == null || displayName.isBlank() ? id : displayName;
  }

  /**
   * Creates a reference whose display name equals its id.
   *
   * @param type resource type
   * @param id identifier
   * @return new reference
   */
  public static ResourceRef of(ResourceType type, String id) {
    return new ResourceRef(type, id, id);
  }
}
