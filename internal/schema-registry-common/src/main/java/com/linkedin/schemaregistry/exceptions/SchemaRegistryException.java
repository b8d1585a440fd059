package com.linkedin.schemaregistry.exceptions;

import org.apache.hc.core5.http.HttpStatus;


/**
 * Base exception that all other schema registry exceptions extend
 */
public class SchemaRegistryException extends RuntimeException {
  private static final long serialVersionUID = 1L;
  protected ErrorType errorType = ErrorType.GENERAL_ERROR;

  public SchemaRegistryException() {
    super();
  }

  public SchemaRegistryException(String s) {
    super(s);
  }

  public SchemaRegistryException(String s, ErrorType errorType) {
    super(s);
    this.errorType = errorType;
  }

  public SchemaRegistryException(Throwable t) {
    super(t);
  }

  public SchemaRegistryException(String s, Throwable t) {
    super(s, t);
  }

  public SchemaRegistryException(String s, Throwable t, ErrorType errorType) {
    super(s, t);
    this.errorType = errorType;
  }

  /**
   * If this exception is caught in handling an http request, what status code should be returned?
   * Exceptions that extend SchemaRegistryException can override this for different behavior
   * @return 500 (Internal Server Error)
   */
  public int getHttpStatusCode() {
    return HttpStatus.SC_INTERNAL_SERVER_ERROR;
  }

  /**
   * Returns the errorType.  Extenders of this class should fill in the errorType member
   */
  public final ErrorType getErrorType() {
    return errorType;
  }
}
