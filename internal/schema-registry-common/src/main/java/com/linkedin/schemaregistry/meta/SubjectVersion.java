package com.linkedin.schemaregistry.meta;

/**
 * One row of a subject's version history. Rows are never removed; deletion flips {@link #isDeleted()}.
 */
public final class SubjectVersion {
  private final int version;
  private final int schemaId;
  private final boolean deleted;

  public SubjectVersion(int version, int schemaId, boolean deleted) {
    this.version = version;
    this.schemaId = schemaId;
    this.deleted = deleted;
  }

  public int getVersion() {
    return version;
  }

  public int getSchemaId() {
    return schemaId;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public SubjectVersion markDeleted() {
    return new SubjectVersion(version, schemaId, true);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    SubjectVersion that = (SubjectVersion) o;
    return version == that.version && schemaId == that.schemaId && deleted == that.deleted;
  }

  @Override
  public int hashCode() {
    int result = version;
    result = 31 * result + schemaId;
    result = 31 * result + (deleted ? 1 : 0);
    return result;
  }

  @Override
  public String toString() {
    return "SubjectVersion{version=" + version + ", schemaId=" + schemaId + ", deleted=" + deleted + "}";
  }
}
