package com.linkedin.schemaregistry.storage;

import com.linkedin.schemaregistry.meta.SubjectVersion;


/**
 * Outcome of {@link SubjectVersionIndex#appendVersion}: the version now holding the schema, and whether it
 * already existed.
 */
public final class VersionAppendResult {
  private final SubjectVersion subjectVersion;
  private final boolean duplicate;

  VersionAppendResult(SubjectVersion subjectVersion, boolean duplicate) {
    this.subjectVersion = subjectVersion;
    this.duplicate = duplicate;
  }

  public SubjectVersion getSubjectVersion() {
    return subjectVersion;
  }

  public int getVersion() {
    return subjectVersion.getVersion();
  }

  public boolean isDuplicate() {
    return duplicate;
  }
}
