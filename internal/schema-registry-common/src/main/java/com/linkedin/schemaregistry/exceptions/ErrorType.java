package com.linkedin.schemaregistry.exceptions;

/**
 * Coarse classification of registry failures. The transport layer sitting on top of the registry uses it to
 * pick an error code without having to know every concrete exception class.
 */
public enum ErrorType {
  GENERAL_ERROR, BAD_REQUEST, INVALID_SCHEMA, INCOMPATIBLE_SCHEMA, INVALID_COMPATIBILITY_MODE, INVALID_CONFIG,
  SUBJECT_NOT_FOUND, VERSION_NOT_FOUND, SCHEMA_NOT_FOUND, STORAGE_ERROR, TIMEOUT
}
