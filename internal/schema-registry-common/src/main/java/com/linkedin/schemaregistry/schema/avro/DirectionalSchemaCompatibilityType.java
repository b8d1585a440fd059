package com.linkedin.schemaregistry.schema.avro;

/**
 * Direction(s) in which reader/writer compatibility is checked between an existing schema and a new one.
 */
public enum DirectionalSchemaCompatibilityType {
  /** No check at all. */
  NONE,
  /** The new schema can read data written with the existing schema. */
  BACKWARD,
  /** The existing schema can read data written with the new schema. */
  FORWARD,
  /** Both of the above. */
  FULL;

  public boolean checksBackward() {
    return this == BACKWARD || this == FULL;
  }

  public boolean checksForward() {
    return this == FORWARD || this == FULL;
  }
}
