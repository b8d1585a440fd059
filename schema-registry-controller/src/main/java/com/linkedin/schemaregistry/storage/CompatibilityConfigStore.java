package com.linkedin.schemaregistry.storage;

import com.linkedin.schemaregistry.exceptions.SchemaRegistryException;
import com.linkedin.schemaregistry.exceptions.SchemaRegistryStorageException;
import com.linkedin.schemaregistry.meta.CompatibilityMode;
import com.linkedin.schemaregistry.meta.SubjectKey;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;


/**
 * Holds the global compatibility mode and the per-subject overrides. A subject without an override follows the
 * global mode, including later changes to it.
 */
public class CompatibilityConfigStore {
  private static final Logger LOGGER = LogManager.getLogger(CompatibilityConfigStore.class);

  private final SchemaRegistryAccessor accessor;
  private final Map<SubjectKey, CompatibilityMode> overrides = new HashMap<>();
  private CompatibilityMode globalMode;

  /**
   * @param defaultGlobalMode global mode until one is persisted.
   */
  public CompatibilityConfigStore(SchemaRegistryAccessor accessor, CompatibilityMode defaultGlobalMode) {
    this.accessor = accessor;
    this.globalMode = defaultGlobalMode;
    restore();
  }

  private void restore() {
    for (ConfigLogRecord record: accessor.readConfigs()) {
      try {
        if (record.isGlobal()) {
          if (record.isTombstone()) {
            throw new SchemaRegistryStorageException("The global compatibility mode cannot be cleared");
          }
          globalMode = CompatibilityMode.fromString(record.getMode());
        } else if (record.isTombstone()) {
          overrides.remove(SubjectKey.parse(record.getScope()));
        } else {
          overrides.put(SubjectKey.parse(record.getScope()), CompatibilityMode.fromString(record.getMode()));
        }
      } catch (SchemaRegistryStorageException e) {
        throw e;
      } catch (SchemaRegistryException e) {
        throw new SchemaRegistryStorageException("Invalid stored config " + record, e);
      }
    }
    LOGGER.info("Global compatibility mode is {}, {} subject overrides restored", globalMode, overrides.size());
  }

  public synchronized CompatibilityMode getGlobalMode() {
    return globalMode;
  }

  public synchronized CompatibilityMode setGlobalMode(CompatibilityMode mode) {
    accessor.appendConfig(new ConfigLogRecord(ConfigLogRecord.GLOBAL_SCOPE, mode.name()));
    CompatibilityMode previous = globalMode;
    globalMode = mode;
    LOGGER.info("Global compatibility mode changed from {} to {}", previous, mode);
    return mode;
  }

  public synchronized Optional<CompatibilityMode> getOverride(SubjectKey subjectKey) {
    return Optional.ofNullable(overrides.get(subjectKey));
  }

  public synchronized CompatibilityMode setOverride(SubjectKey subjectKey, CompatibilityMode mode) {
    accessor.appendConfig(new ConfigLogRecord(subjectKey.toString(), mode.name()));
    overrides.put(subjectKey, mode);
    LOGGER.info("Compatibility mode of {} set to {}", subjectKey, mode);
    return mode;
  }

  /**
   * @return whether there was an override to clear.
   */
  public synchronized boolean clearOverride(SubjectKey subjectKey) {
    if (!overrides.containsKey(subjectKey)) {
      return false;
    }
    accessor.appendConfig(ConfigLogRecord.tombstone(subjectKey.toString()));
    overrides.remove(subjectKey);
    LOGGER.info("Compatibility mode override of {} cleared", subjectKey);
    return true;
  }

  /**
   * @return the override of the subject, or the global mode.
   */
  public synchronized CompatibilityMode getEffectiveMode(SubjectKey subjectKey) {
    CompatibilityMode override = overrides.get(subjectKey);
    return override != null ? override : globalMode;
  }
}
