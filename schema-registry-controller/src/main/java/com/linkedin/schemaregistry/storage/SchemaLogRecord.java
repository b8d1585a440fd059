package com.linkedin.schemaregistry.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;


/**
 * Persisted form of a schema row. Only the raw body is stored, the canonical form is rebuilt on recovery and
 * checked against the fingerprint.
 */
public class SchemaLogRecord {
  private final int id;
  private final String fingerprint;
  private final String schema;

  @JsonCreator
  public SchemaLogRecord(
      @JsonProperty("id") int id,
      @JsonProperty("fingerprint") String fingerprint,
      @JsonProperty("schema") String schema) {
    this.id = id;
    this.fingerprint = fingerprint;
    this.schema = schema;
  }

  @JsonProperty("id")
  public int getId() {
    return id;
  }

  @JsonProperty("fingerprint")
  public String getFingerprint() {
    return fingerprint;
  }

  @JsonProperty("schema")
  public String getSchema() {
    return schema;
  }

  @Override
  public String toString() {
    return "SchemaLogRecord{id=" + id + ", fingerprint=" + fingerprint + "}";
  }
}
