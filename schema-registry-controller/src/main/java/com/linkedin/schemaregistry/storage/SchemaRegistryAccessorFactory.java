package com.linkedin.schemaregistry.storage;

import com.linkedin.schemaregistry.exceptions.ConfigurationException;
import java.io.File;
import org.apache.commons.lang3.StringUtils;


public final class SchemaRegistryAccessorFactory {
  private SchemaRegistryAccessorFactory() {
  }

  /**
   * @param storageDir required for {@link StorageType#LOCAL_FILE}, ignored otherwise.
   */
  public static SchemaRegistryAccessor create(StorageType storageType, String storageDir) {
    switch (storageType) {
      case IN_MEMORY:
        return new InMemorySchemaRegistryAccessor();
      case LOCAL_FILE:
        if (StringUtils.isBlank(storageDir)) {
          throw new ConfigurationException("A storage directory is required for storage type " + storageType);
        }
        return new LocalFileSchemaRegistryAccessor(new File(storageDir));
      default:
        throw new ConfigurationException("Unsupported storage type " + storageType);
    }
  }
}
