package com.linkedin.schemaregistry.compatibility;

import static org.apache.avro.SchemaCompatibility.SchemaCompatibilityType.INCOMPATIBLE;
import static org.apache.avro.SchemaCompatibility.checkReaderWriterCompatibility;

import com.linkedin.schemaregistry.meta.CompatibilityMode;
import com.linkedin.schemaregistry.schema.SchemaEntry;
import com.linkedin.schemaregistry.schema.avro.DirectionalSchemaCompatibilityType;
import java.util.ArrayList;
import java.util.List;
import org.apache.avro.SchemaCompatibility;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;


/**
 * Decides whether a candidate schema may follow a subject's existing schemas under a {@link CompatibilityMode}.
 *
 * Backward means the candidate, used as reader, can decode data written with an existing schema. Forward means an
 * existing schema, used as reader, can decode data written with the candidate. Both inputs are expected to be valid
 * canonical schemas already.
 */
public class SchemaCompatibilityChecker {
  private static final Logger LOGGER = LogManager.getLogger(SchemaCompatibilityChecker.class);

  private static final SchemaCompatibilityChecker INSTANCE = new SchemaCompatibilityChecker();

  public static SchemaCompatibilityChecker getInstance() {
    return INSTANCE;
  }

  public boolean isCompatible(SchemaEntry candidate, List<SchemaEntry> references, CompatibilityMode mode) {
    return check(candidate, references, mode).isCompatible();
  }

  /**
   * @param references existing schemas of the subject, oldest first. Non-transitive modes only look at the last one,
   *                   transitive modes at all of them, newest first. An empty list is always compatible.
   */
  public CompatibilityCheckResult check(SchemaEntry candidate, List<SchemaEntry> references, CompatibilityMode mode) {
    if (mode == CompatibilityMode.NONE || references.isEmpty()) {
      return CompatibilityCheckResult.compatible(mode);
    }

    int oldestToCheck = mode.isTransitive() ? 0 : references.size() - 1;
    for (int i = references.size() - 1; i >= oldestToCheck; i--) {
      CompatibilityCheckResult result = checkPair(candidate, references.get(i), mode);
      if (!result.isCompatible()) {
        return result;
      }
    }
    return CompatibilityCheckResult.compatible(mode);
  }

  private CompatibilityCheckResult checkPair(SchemaEntry candidate, SchemaEntry existing, CompatibilityMode mode) {
    DirectionalSchemaCompatibilityType direction = mode.getDirection();

    if (direction.checksBackward()) {
      SchemaCompatibility.SchemaPairCompatibility backwardCompatibility = checkReaderWriterCompatibility(
          /** reader */
          candidate.getSchema(),
          /** writer */
          existing.getSchema());
      if (backwardCompatibility.getType() == INCOMPATIBLE) {
        LOGGER.info(
            "New schema is not backward compatible with (i.e.: cannot read data written by) existing schema (id {}),"
                + " Full message:\n{}",
            existing.getId(),
            backwardCompatibility.getDescription());
        return CompatibilityCheckResult.incompatible(
            mode,
            existing,
            DirectionalSchemaCompatibilityType.BACKWARD,
            describe(backwardCompatibility));
      }
    }

    if (direction.checksForward()) {
      SchemaCompatibility.SchemaPairCompatibility forwardCompatibility = checkReaderWriterCompatibility(
          /** reader */
          existing.getSchema(),
          /** writer */
          candidate.getSchema());
      if (forwardCompatibility.getType() == INCOMPATIBLE) {
        LOGGER.info(
            "New schema is not forward compatible with (i.e.: cannot have its written data read by) existing schema"
                + " (id {}), Full message:\n{}",
            existing.getId(),
            forwardCompatibility.getDescription());
        return CompatibilityCheckResult.incompatible(
            mode,
            existing,
            DirectionalSchemaCompatibilityType.FORWARD,
            describe(forwardCompatibility));
      }
    }

    return CompatibilityCheckResult.compatible(mode);
  }

  /**
   * Renders each incompatibility as {@code TYPE at location: message}, e.g.
   * {@code READER_FIELD_MISSING_DEFAULT_VALUE at /fields/1: email}.
   */
  static List<String> describe(SchemaCompatibility.SchemaPairCompatibility pairCompatibility) {
    List<String> violations = new ArrayList<>();
    for (SchemaCompatibility.Incompatibility incompatibility: pairCompatibility.getResult().getIncompatibilities()) {
      violations.add(
          incompatibility.getType() + " at " + incompatibility.getLocation() + ": " + incompatibility.getMessage());
    }
    if (violations.isEmpty()) {
      violations.add(pairCompatibility.getDescription());
    }
    return violations;
  }
}
