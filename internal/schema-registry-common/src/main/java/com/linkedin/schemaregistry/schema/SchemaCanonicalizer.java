package com.linkedin.schemaregistry.schema;

import com.linkedin.schemaregistry.exceptions.InvalidSchemaException;


/**
 * Turns raw schema text into its canonical structural form and a stable fingerprint. Two schema texts that only
 * differ in surface syntax canonicalize to the same body and fingerprint.
 */
public interface SchemaCanonicalizer {
  /**
   * @throws InvalidSchemaException if the text is not a valid, non-degenerate schema; the message carries the
   *         parser diagnostic.
   */
  CanonicalSchema canonicalize(String schemaStr);
}
