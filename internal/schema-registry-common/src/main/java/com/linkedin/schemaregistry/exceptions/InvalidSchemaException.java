package com.linkedin.schemaregistry.exceptions;

import org.apache.hc.core5.http.HttpStatus;


/**
 * Thrown when a schema body cannot be turned into a canonical schema. The message carries the parser diagnostic.
 */
public class InvalidSchemaException extends SchemaRegistryException {
  private static final long serialVersionUID = 1L;

  public InvalidSchemaException(String message) {
    super(message, ErrorType.INVALID_SCHEMA);
  }

  public InvalidSchemaException(String message, Throwable cause) {
    super(message, cause, ErrorType.INVALID_SCHEMA);
  }

  @Override
  public int getHttpStatusCode() {
    return HttpStatus.SC_UNPROCESSABLE_ENTITY;
  }
}
