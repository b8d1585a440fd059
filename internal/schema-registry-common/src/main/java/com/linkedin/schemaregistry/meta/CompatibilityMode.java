package com.linkedin.schemaregistry.meta;

import com.linkedin.schemaregistry.exceptions.InvalidCompatibilityModeException;
import com.linkedin.schemaregistry.schema.avro.DirectionalSchemaCompatibilityType;
import java.util.Arrays;


/**
 * Policy deciding which changes are allowed between the versions of a subject. Non-transitive modes compare a
 * candidate against the latest live version only, transitive ones against every live version.
 */
public enum CompatibilityMode {
  NONE(DirectionalSchemaCompatibilityType.NONE, false), BACKWARD(DirectionalSchemaCompatibilityType.BACKWARD, false),
  FORWARD(DirectionalSchemaCompatibilityType.FORWARD, false), FULL(DirectionalSchemaCompatibilityType.FULL, false),
  BACKWARD_TRANSITIVE(DirectionalSchemaCompatibilityType.BACKWARD, true),
  FORWARD_TRANSITIVE(DirectionalSchemaCompatibilityType.FORWARD, true),
  FULL_TRANSITIVE(DirectionalSchemaCompatibilityType.FULL, true);

  private final DirectionalSchemaCompatibilityType direction;
  private final boolean transitive;

  CompatibilityMode(DirectionalSchemaCompatibilityType direction, boolean transitive) {
    this.direction = direction;
    this.transitive = transitive;
  }

  public DirectionalSchemaCompatibilityType getDirection() {
    return direction;
  }

  public boolean isTransitive() {
    return transitive;
  }

  /**
   * Case-insensitive lookup, surrounding whitespace ignored.
   *
   * @throws InvalidCompatibilityModeException if the value does not name a mode
   */
  public static CompatibilityMode fromString(String mode) {
    if (mode != null) {
      String normalized = mode.trim();
      for (CompatibilityMode compatibilityMode: values()) {
        if (compatibilityMode.name().equalsIgnoreCase(normalized)) {
          return compatibilityMode;
        }
      }
    }
    throw new InvalidCompatibilityModeException(mode, Arrays.toString(values()));
  }
}
