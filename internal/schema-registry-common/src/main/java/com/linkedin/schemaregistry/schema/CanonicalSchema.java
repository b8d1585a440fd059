package com.linkedin.schemaregistry.schema;

import org.apache.avro.Schema;


/**
 * Output of a {@link SchemaCanonicalizer}: the parsed schema, its canonical rendering, the fingerprint of that
 * rendering and the raw text it came from.
 */
public final class CanonicalSchema {
  private final Schema schema;
  private final String rawSchemaStr;
  private final String canonicalSchemaStr;
  private final String fingerprint;

  public CanonicalSchema(Schema schema, String rawSchemaStr, String canonicalSchemaStr, String fingerprint) {
    this.schema = schema;
    this.rawSchemaStr = rawSchemaStr;
    this.canonicalSchemaStr = canonicalSchemaStr;
    this.fingerprint = fingerprint;
  }

  public Schema getSchema() {
    return schema;
  }

  public String getRawSchemaStr() {
    return rawSchemaStr;
  }

  public String getCanonicalSchemaStr() {
    return canonicalSchemaStr;
  }

  public String getFingerprint() {
    return fingerprint;
  }

  @Override
  public String toString() {
    return fingerprint + "\t" + canonicalSchemaStr;
  }
}
