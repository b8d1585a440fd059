package com.linkedin.schemaregistry.exceptions;

import com.linkedin.schemaregistry.compatibility.CompatibilityCheckResult;
import com.linkedin.schemaregistry.meta.SubjectKey;
import org.apache.hc.core5.http.HttpStatus;


/**
 * Thrown when a candidate schema violates the effective compatibility mode of the subject it is registered under.
 * Nothing has been written when this is thrown.
 */
public class SchemaIncompatibilityException extends SchemaRegistryException {
  private static final long serialVersionUID = 1L;

  private final SubjectKey subjectKey;
  private final transient CompatibilityCheckResult checkResult;

  public SchemaIncompatibilityException(SubjectKey subjectKey, CompatibilityCheckResult checkResult) {
    super(
        "Schema is incompatible with subject: " + subjectKey + " under compatibility mode: " + checkResult.getMode()
            + ". " + checkResult.getDescription(),
        ErrorType.INCOMPATIBLE_SCHEMA);
    this.subjectKey = subjectKey;
    this.checkResult = checkResult;
  }

  public SubjectKey getSubjectKey() {
    return subjectKey;
  }

  public CompatibilityCheckResult getCheckResult() {
    return checkResult;
  }

  @Override
  public int getHttpStatusCode() {
    return HttpStatus.SC_CONFLICT;
  }
}
