package com.linkedin.schemaregistry.schema;

import com.linkedin.schemaregistry.exceptions.InvalidSchemaException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;
import org.apache.avro.Schema;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;


/**
 * {@link SchemaCanonicalizer} for Avro schemas.
 *
 * The canonical body is the compact JSON rendering of the parsed schema. It normalizes whitespace, attribute order
 * and inherited namespaces, but keeps defaults, docs and aliases: defaults take part in compatibility decisions, so
 * two schemas that only differ in a default must not share an id. The fingerprint is the SHA-256 of that body.
 */
public class AvroSchemaCanonicalizer implements SchemaCanonicalizer {
  private static final Logger LOGGER = LogManager.getLogger(AvroSchemaCanonicalizer.class);

  private static final AvroSchemaCanonicalizer INSTANCE = new AvroSchemaCanonicalizer();

  public static AvroSchemaCanonicalizer getInstance() {
    return INSTANCE;
  }

  @Override
  public CanonicalSchema canonicalize(String schemaStr) {
    if (StringUtils.isBlank(schemaStr)) {
      throw new InvalidSchemaException("Schema body cannot be empty");
    }

    Schema schema;
    try {
      schema = AvroSchemaParseUtils.parseSchemaFromJSONStrictValidation(schemaStr);
    } catch (Exception e) {
      LOGGER.info("Failed to parse schema: {}", schemaStr, e);
      throw new InvalidSchemaException("Invalid Avro schema: " + e.getMessage(), e);
    }
    validateStructure(schema, new HashSet<>());

    String canonicalSchemaStr = schema.toString();
    String fingerprint = DigestUtils.sha256Hex(canonicalSchemaStr.getBytes(StandardCharsets.UTF_8));
    return new CanonicalSchema(schema, schemaStr, canonicalSchemaStr, fingerprint);
  }

  /**
   * Rejects records without fields and enums without symbols, at any depth.
   */
  private static void validateStructure(Schema schema, Set<String> visitedNames) {
    switch (schema.getType()) {
      case RECORD:
        if (!visitedNames.add(schema.getFullName())) {
          return;
        }
        if (schema.getFields().isEmpty()) {
          throw new InvalidSchemaException("Record: " + schema.getFullName() + " has no fields");
        }
        for (Schema.Field field: schema.getFields()) {
          validateStructure(field.schema(), visitedNames);
        }
        return;
      case ENUM:
        if (schema.getEnumSymbols().isEmpty()) {
          throw new InvalidSchemaException("Enum: " + schema.getFullName() + " has no symbols");
        }
        return;
      case ARRAY:
        validateStructure(schema.getElementType(), visitedNames);
        return;
      case MAP:
        validateStructure(schema.getValueType(), visitedNames);
        return;
      case UNION:
        for (Schema branch: schema.getTypes()) {
          validateStructure(branch, visitedNames);
        }
        return;
      default:
        // primitives and fixed carry no nested structure
    }
  }
}
