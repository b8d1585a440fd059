package com.linkedin.schemaregistry.meta;

import java.util.Objects;


/**
 * A schema as seen through one version of one subject.
 */
public final class SubjectSchema {
  private final SubjectKey subjectKey;
  private final int version;
  private final int schemaId;
  private final String schemaStr;

  public SubjectSchema(SubjectKey subjectKey, int version, int schemaId, String schemaStr) {
    this.subjectKey = subjectKey;
    this.version = version;
    this.schemaId = schemaId;
    this.schemaStr = schemaStr;
  }

  public SubjectKey getSubjectKey() {
    return subjectKey;
  }

  public int getVersion() {
    return version;
  }

  public int getSchemaId() {
    return schemaId;
  }

  /**
   * @return the schema body exactly as it was first registered.
   */
  public String getSchemaStr() {
    return schemaStr;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    SubjectSchema that = (SubjectSchema) o;
    return version == that.version && schemaId == that.schemaId && subjectKey.equals(that.subjectKey)
        && schemaStr.equals(that.schemaStr);
  }

  @Override
  public int hashCode() {
    return Objects.hash(subjectKey, version, schemaId, schemaStr);
  }

  @Override
  public String toString() {
    return "SubjectSchema{subject=" + subjectKey + ", version=" + version + ", id=" + schemaId + "}";
  }
}
