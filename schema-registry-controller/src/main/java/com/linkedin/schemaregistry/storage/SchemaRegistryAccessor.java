package com.linkedin.schemaregistry.storage;

import java.util.List;


/**
 * Durable side of the registry. Every mutation is appended here before it becomes visible in memory, and the
 * in-memory stores are rebuilt from the read methods on startup.
 *
 * Implementations must be safe to call from multiple threads.
 */
public interface SchemaRegistryAccessor extends AutoCloseable {
  void appendSchema(SchemaLogRecord record);

  void appendVersion(VersionLogRecord record);

  void appendConfig(ConfigLogRecord record);

  /**
   * @return schema records in the order they were appended.
   */
  List<SchemaLogRecord> readSchemas();

  List<VersionLogRecord> readVersions();

  List<ConfigLogRecord> readConfigs();

  @Override
  void close();
}
