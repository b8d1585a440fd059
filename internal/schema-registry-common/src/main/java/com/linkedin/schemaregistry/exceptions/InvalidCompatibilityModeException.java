package com.linkedin.schemaregistry.exceptions;

import org.apache.hc.core5.http.HttpStatus;


public class InvalidCompatibilityModeException extends SchemaRegistryException {
  private static final long serialVersionUID = 1L;

  private final String mode;

  public InvalidCompatibilityModeException(String mode, String validModes) {
    super("Invalid compatibility mode: " + mode + ". Valid modes are: " + validModes,
        ErrorType.INVALID_COMPATIBILITY_MODE);
    this.mode = mode;
  }

  public String getMode() {
    return mode;
  }

  @Override
  public int getHttpStatusCode() {
    return HttpStatus.SC_UNPROCESSABLE_ENTITY;
  }
}
