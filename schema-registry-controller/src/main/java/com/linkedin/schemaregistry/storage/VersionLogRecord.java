package com.linkedin.schemaregistry.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;


/**
 * Persisted form of a subject version. A later record for the same subject and version replaces the earlier one,
 * which is how soft deletes are logged.
 */
public class VersionLogRecord {
  private final String subject;
  private final int version;
  private final int schemaId;
  private final boolean deleted;

  @JsonCreator
  public VersionLogRecord(
      @JsonProperty("subject") String subject,
      @JsonProperty("version") int version,
      @JsonProperty("schemaId") int schemaId,
      @JsonProperty("deleted") boolean deleted) {
    this.subject = subject;
    this.version = version;
    this.schemaId = schemaId;
    this.deleted = deleted;
  }

  @JsonProperty("subject")
  public String getSubject() {
    return subject;
  }

  @JsonProperty("version")
  public int getVersion() {
    return version;
  }

  @JsonProperty("schemaId")
  public int getSchemaId() {
    return schemaId;
  }

  @JsonProperty("deleted")
  public boolean isDeleted() {
    return deleted;
  }

  @Override
  public String toString() {
    return "VersionLogRecord{subject=" + subject + ", version=" + version + ", schemaId=" + schemaId + ", deleted="
        + deleted + "}";
  }
}
