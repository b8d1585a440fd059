package com.linkedin.schemaregistry.exceptions;

import org.apache.hc.core5.http.HttpStatus;


public class SchemaRegistryTimeoutException extends SchemaRegistryException {
  private static final long serialVersionUID = 1L;

  public SchemaRegistryTimeoutException(String message) {
    super(message, ErrorType.TIMEOUT);
  }

  public SchemaRegistryTimeoutException(String message, Throwable cause) {
    super(message, cause, ErrorType.TIMEOUT);
  }

  @Override
  public int getHttpStatusCode() {
    return HttpStatus.SC_SERVICE_UNAVAILABLE;
  }
}
