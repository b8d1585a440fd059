package com.linkedin.schemaregistry.schema;

import org.apache.avro.Schema;


public class AvroSchemaParseUtils {
  private AvroSchemaParseUtils() {
    // Util class
  }

  /**
   * Parses with name validation and default value validation enabled. A fresh {@link Schema.Parser} is used for
   * every call since a parser remembers the named types it has seen.
   */
  public static Schema parseSchemaFromJSONStrictValidation(String jsonSchema) {
    return new Schema.Parser().setValidate(true).setValidateDefaults(true).parse(jsonSchema);
  }
}
