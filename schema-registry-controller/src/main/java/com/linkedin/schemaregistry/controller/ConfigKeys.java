package com.linkedin.schemaregistry.controller;

public class ConfigKeys {
  private ConfigKeys() {
  }

  // compatibility
  public static final String DEFAULT_COMPATIBILITY_MODE = "schema.registry.default.compatibility.mode";

  // storage
  public static final String STORAGE_TYPE = "schema.registry.storage.type";
  public static final String STORAGE_DIR = "schema.registry.storage.dir";

  // locking
  public static final String SUBJECT_LOCK_TIMEOUT_MS = "schema.registry.subject.lock.timeout.ms";
  public static final String LOCK_REPORTING_THRESHOLD_MS = "schema.registry.lock.reporting.threshold.ms";

  /**
   * Schema bodies longer than this many UTF-8 bytes are rejected.
   */
  public static final String SCHEMA_MAX_BYTES = "schema.registry.schema.max.bytes";
}
