package com.linkedin.schemaregistry.controller;

import static com.linkedin.schemaregistry.controller.ConfigKeys.DEFAULT_COMPATIBILITY_MODE;
import static com.linkedin.schemaregistry.controller.ConfigKeys.LOCK_REPORTING_THRESHOLD_MS;
import static com.linkedin.schemaregistry.controller.ConfigKeys.SCHEMA_MAX_BYTES;
import static com.linkedin.schemaregistry.controller.ConfigKeys.STORAGE_DIR;
import static com.linkedin.schemaregistry.controller.ConfigKeys.STORAGE_TYPE;
import static com.linkedin.schemaregistry.controller.ConfigKeys.SUBJECT_LOCK_TIMEOUT_MS;

import com.linkedin.schemaregistry.exceptions.ConfigurationException;
import com.linkedin.schemaregistry.exceptions.InvalidCompatibilityModeException;
import com.linkedin.schemaregistry.meta.CompatibilityMode;
import com.linkedin.schemaregistry.storage.StorageType;
import com.linkedin.schemaregistry.utils.RegistryProperties;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;


/**
 * Typed view over the registry properties. All values are read and validated once, at construction.
 */
public class SchemaRegistryConfig {
  private static final Logger LOGGER = LogManager.getLogger(SchemaRegistryConfig.class);

  public static final CompatibilityMode DEFAULT_DEFAULT_COMPATIBILITY_MODE = CompatibilityMode.BACKWARD;
  public static final long DEFAULT_SUBJECT_LOCK_TIMEOUT_MS = 10000;
  public static final long DEFAULT_LOCK_REPORTING_THRESHOLD_MS = 1000;
  public static final int DEFAULT_SCHEMA_MAX_BYTES = 1024 * 1024;

  private CompatibilityMode defaultCompatibilityMode;
  private StorageType storageType;
  private String storageDir;
  private long subjectLockTimeoutMs;
  private long lockReportingThresholdMs;
  private int schemaMaxBytes;

  public SchemaRegistryConfig(RegistryProperties props) {
    initFieldsWithProperties(props);
    LOGGER.debug("Registry properties: {}", props.toString(true));
    LOGGER.info(
        "Loaded configuration: storage type {}, default compatibility mode {}",
        storageType,
        defaultCompatibilityMode);
  }

  private void initFieldsWithProperties(RegistryProperties props) {
    if (props.containsKey(DEFAULT_COMPATIBILITY_MODE)) {
      try {
        defaultCompatibilityMode = CompatibilityMode.fromString(props.getString(DEFAULT_COMPATIBILITY_MODE));
      } catch (InvalidCompatibilityModeException e) {
        throw new ConfigurationException("Invalid value for " + DEFAULT_COMPATIBILITY_MODE, e);
      }
    } else {
      defaultCompatibilityMode = DEFAULT_DEFAULT_COMPATIBILITY_MODE;
    }

    if (props.containsKey(STORAGE_TYPE)) {
      storageType = StorageType.fromString(props.getString(STORAGE_TYPE));
    } else {
      storageType = StorageType.IN_MEMORY;
    }
    storageDir = props.getString(STORAGE_DIR, null);
    if (storageType == StorageType.LOCAL_FILE && StringUtils.isBlank(storageDir)) {
      throw new ConfigurationException(STORAGE_DIR + " is required when " + STORAGE_TYPE + " is " + storageType);
    }

    subjectLockTimeoutMs = props.getLong(SUBJECT_LOCK_TIMEOUT_MS, DEFAULT_SUBJECT_LOCK_TIMEOUT_MS);
    if (subjectLockTimeoutMs <= 0) {
      throw new ConfigurationException(SUBJECT_LOCK_TIMEOUT_MS + " must be positive, got " + subjectLockTimeoutMs);
    }
    lockReportingThresholdMs = props.getLong(LOCK_REPORTING_THRESHOLD_MS, DEFAULT_LOCK_REPORTING_THRESHOLD_MS);
    if (lockReportingThresholdMs < 0) {
      throw new ConfigurationException(
          LOCK_REPORTING_THRESHOLD_MS + " must not be negative, got " + lockReportingThresholdMs);
    }
    schemaMaxBytes = props.getInt(SCHEMA_MAX_BYTES, DEFAULT_SCHEMA_MAX_BYTES);
    if (schemaMaxBytes <= 0) {
      throw new ConfigurationException(SCHEMA_MAX_BYTES + " must be positive, got " + schemaMaxBytes);
    }
  }

  public CompatibilityMode getDefaultCompatibilityMode() {
    return defaultCompatibilityMode;
  }

  public StorageType getStorageType() {
    return storageType;
  }

  /**
   * @return the storage directory, null unless configured.
   */
  public String getStorageDir() {
    return storageDir;
  }

  public long getSubjectLockTimeoutMs() {
    return subjectLockTimeoutMs;
  }

  public long getLockReportingThresholdMs() {
    return lockReportingThresholdMs;
  }

  public int getSchemaMaxBytes() {
    return schemaMaxBytes;
  }
}
