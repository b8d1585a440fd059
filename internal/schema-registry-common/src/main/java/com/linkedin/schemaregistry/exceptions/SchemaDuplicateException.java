package com.linkedin.schemaregistry.exceptions;

import com.linkedin.schemaregistry.meta.SubjectKey;
import com.linkedin.schemaregistry.meta.SubjectVersion;


/**
 * Signals that a subject already has a live version pointing at the schema being appended. It is caught inside the
 * registry and turned into a successful no-op; callers never see it.
 */
public class SchemaDuplicateException extends SchemaRegistryException {
  private static final long serialVersionUID = 1L;

  private final transient SubjectVersion existingVersion;

  public SchemaDuplicateException(SubjectKey subjectKey, SubjectVersion existingVersion) {
    super("Schema id: " + existingVersion.getSchemaId() + " is already registered as version: "
        + existingVersion.getVersion() + " of subject: " + subjectKey);
    this.existingVersion = existingVersion;
  }

  public SubjectVersion getExistingVersion() {
    return existingVersion;
  }
}
