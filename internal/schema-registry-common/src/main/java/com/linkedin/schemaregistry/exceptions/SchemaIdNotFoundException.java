package com.linkedin.schemaregistry.exceptions;

import org.apache.hc.core5.http.HttpStatus;


public class SchemaIdNotFoundException extends SchemaRegistryException {
  private static final long serialVersionUID = 1L;

  private final int schemaId;

  public SchemaIdNotFoundException(int schemaId) {
    super("Schema id: " + schemaId + " does not exist.", ErrorType.SCHEMA_NOT_FOUND);
    this.schemaId = schemaId;
  }

  public int getSchemaId() {
    return schemaId;
  }

  @Override
  public int getHttpStatusCode() {
    return HttpStatus.SC_NOT_FOUND;
  }
}
