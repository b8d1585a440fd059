package com.linkedin.schemaregistry.schema;

import org.apache.avro.Schema;


/**
 * {@link SchemaEntry} is an immutable row of the schema log: a global id bound to a canonical schema.
 * Internally, this class keeps the parsed {@link org.apache.avro.Schema} so compatibility checks do not re-parse.
 *
 * Two entries are equal when their fingerprints are, whatever their ids.
 */
public class SchemaEntry {
  private final int id;
  private final CanonicalSchema canonicalSchema;

  public SchemaEntry(int id, CanonicalSchema canonicalSchema) {
    if (canonicalSchema == null) {
      throw new IllegalArgumentException("The canonicalSchema parameter cannot be null!");
    }
    this.id = id;
    this.canonicalSchema = canonicalSchema;
  }

  /** @return the id */
  public int getId() {
    return id;
  }

  public Schema getSchema() {
    return canonicalSchema.getSchema();
  }

  public String getFingerprint() {
    return canonicalSchema.getFingerprint();
  }

  public String getCanonicalSchemaStr() {
    return canonicalSchema.getCanonicalSchemaStr();
  }

  /**
   * @return the text the schema was first registered with.
   */
  public String getSchemaStr() {
    return canonicalSchema.getRawSchemaStr();
  }

  public CanonicalSchema getCanonicalSchema() {
    return canonicalSchema;
  }

  @Override
  public int hashCode() {
    return getFingerprint().hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    SchemaEntry other = (SchemaEntry) obj;
    return getFingerprint().equals(other.getFingerprint());
  }

  @Override
  public String toString() {
    return this.toString(false);
  }

  public String toString(boolean pretty) {
    return id + "\t" + getSchema().toString(pretty) + "\t" + getFingerprint();
  }
}
