package com.linkedin.schemaregistry.exceptions;

import org.apache.hc.core5.http.HttpStatus;


/**
 * Thrown when a schema body is looked up under a subject and no live version of that subject points at it.
 */
public class SchemaNotFoundException extends SchemaRegistryException {
  private static final long serialVersionUID = 1L;

  public SchemaNotFoundException(String subject) {
    super("Schema is not registered under subject: " + subject, ErrorType.SCHEMA_NOT_FOUND);
  }

  @Override
  public int getHttpStatusCode() {
    return HttpStatus.SC_NOT_FOUND;
  }
}
