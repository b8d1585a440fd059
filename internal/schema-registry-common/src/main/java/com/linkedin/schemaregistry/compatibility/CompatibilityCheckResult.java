package com.linkedin.schemaregistry.compatibility;

import com.linkedin.schemaregistry.meta.CompatibilityMode;
import com.linkedin.schemaregistry.schema.SchemaEntry;
import com.linkedin.schemaregistry.schema.avro.DirectionalSchemaCompatibilityType;
import java.util.Collections;
import java.util.List;


/**
 * Outcome of a compatibility check. An incompatible result names the existing schema the candidate clashed with,
 * the direction that failed and the rules Avro reported as violated.
 */
public final class CompatibilityCheckResult {
  private final CompatibilityMode mode;
  private final boolean compatible;
  private final SchemaEntry incompatibleSchema;
  private final DirectionalSchemaCompatibilityType failedDirection;
  private final List<String> violations;

  private CompatibilityCheckResult(
      CompatibilityMode mode,
      boolean compatible,
      SchemaEntry incompatibleSchema,
      DirectionalSchemaCompatibilityType failedDirection,
      List<String> violations) {
    this.mode = mode;
    this.compatible = compatible;
    this.incompatibleSchema = incompatibleSchema;
    this.failedDirection = failedDirection;
    this.violations = violations;
  }

  public static CompatibilityCheckResult compatible(CompatibilityMode mode) {
    return new CompatibilityCheckResult(mode, true, null, null, Collections.emptyList());
  }

  public static CompatibilityCheckResult incompatible(
      CompatibilityMode mode,
      SchemaEntry incompatibleSchema,
      DirectionalSchemaCompatibilityType failedDirection,
      List<String> violations) {
    return new CompatibilityCheckResult(
        mode,
        false,
        incompatibleSchema,
        failedDirection,
        Collections.unmodifiableList(violations));
  }

  public CompatibilityMode getMode() {
    return mode;
  }

  public boolean isCompatible() {
    return compatible;
  }

  /**
   * @return the existing schema the candidate is incompatible with, or null when compatible.
   */
  public SchemaEntry getIncompatibleSchema() {
    return incompatibleSchema;
  }

  /**
   * @return {@link DirectionalSchemaCompatibilityType#BACKWARD} or {@link DirectionalSchemaCompatibilityType#FORWARD}
   *         for an incompatible result, null otherwise.
   */
  public DirectionalSchemaCompatibilityType getFailedDirection() {
    return failedDirection;
  }

  public List<String> getViolations() {
    return violations;
  }

  public String getDescription() {
    if (compatible) {
      return "Schema is compatible under mode " + mode;
    }
    String relation = failedDirection == DirectionalSchemaCompatibilityType.BACKWARD
        ? "cannot read data written with"
        : "cannot have its data read by";
    return "New schema " + relation + " existing schema id " + incompatibleSchema.getId() + ": "
        + String.join("; ", violations);
  }

  @Override
  public String toString() {
    return getDescription();
  }
}
