package com.linkedin.schemaregistry.storage;

import com.linkedin.schemaregistry.exceptions.ConfigurationException;
import java.util.Arrays;


public enum StorageType {
  IN_MEMORY, LOCAL_FILE;

  public static StorageType fromString(String value) {
    for (StorageType storageType: values()) {
      if (storageType.name().equalsIgnoreCase(value.trim())) {
        return storageType;
      }
    }
    throw new ConfigurationException(
        "Unknown storage type '" + value + "', expected one of " + Arrays.toString(values()));
  }
}
