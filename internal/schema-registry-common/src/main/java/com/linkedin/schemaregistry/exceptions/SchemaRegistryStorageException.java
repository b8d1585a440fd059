package com.linkedin.schemaregistry.exceptions;

/**
 * Thrown when the durable logs cannot be written or read back, or when recovered data breaks a registry invariant.
 */
public class SchemaRegistryStorageException extends SchemaRegistryException {
  private static final long serialVersionUID = 1L;

  public SchemaRegistryStorageException(String message) {
    super(message, ErrorType.STORAGE_ERROR);
  }

  public SchemaRegistryStorageException(String message, Throwable cause) {
    super(message, cause, ErrorType.STORAGE_ERROR);
  }
}
