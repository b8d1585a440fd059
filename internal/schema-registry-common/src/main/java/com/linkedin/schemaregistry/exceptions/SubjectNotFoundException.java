package com.linkedin.schemaregistry.exceptions;

import org.apache.hc.core5.http.HttpStatus;


/**
 * Thrown when an operation needs the version history of a subject, but the subject has no live version.
 */
public class SubjectNotFoundException extends SchemaRegistryException {
  private static final long serialVersionUID = 1L;

  private final String subject;

  public SubjectNotFoundException(String subject) {
    super("Subject: " + subject + " does not exist.", ErrorType.SUBJECT_NOT_FOUND);
    this.subject = subject;
  }

  public String getSubject() {
    return subject;
  }

  @Override
  public int getHttpStatusCode() {
    return HttpStatus.SC_NOT_FOUND;
  }
}
