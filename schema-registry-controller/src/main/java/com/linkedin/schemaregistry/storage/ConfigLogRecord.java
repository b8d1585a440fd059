package com.linkedin.schemaregistry.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;


/**
 * Persisted form of a compatibility setting. A null mode is a tombstone clearing a subject override.
 */
public class ConfigLogRecord {
  public static final String GLOBAL_SCOPE = "__global__";

  private final String scope;
  private final String mode;

  @JsonCreator
  public ConfigLogRecord(@JsonProperty("scope") String scope, @JsonProperty("mode") String mode) {
    this.scope = scope;
    this.mode = mode;
  }

  public static ConfigLogRecord tombstone(String scope) {
    return new ConfigLogRecord(scope, null);
  }

  @JsonProperty("scope")
  public String getScope() {
    return scope;
  }

  @JsonProperty("mode")
  public String getMode() {
    return mode;
  }

  public boolean isGlobal() {
    return GLOBAL_SCOPE.equals(scope);
  }

  public boolean isTombstone() {
    return mode == null;
  }

  @Override
  public String toString() {
    return "ConfigLogRecord{scope=" + scope + ", mode=" + mode + "}";
  }
}
