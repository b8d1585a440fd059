package com.linkedin.schemaregistry.storage;

import java.util.ArrayList;
import java.util.List;


/**
 * Keeps the logs on the heap. Nothing survives a restart of the process.
 */
public class InMemorySchemaRegistryAccessor implements SchemaRegistryAccessor {
  private final List<SchemaLogRecord> schemas = new ArrayList<>();
  private final List<VersionLogRecord> versions = new ArrayList<>();
  private final List<ConfigLogRecord> configs = new ArrayList<>();

  @Override
  public synchronized void appendSchema(SchemaLogRecord record) {
    schemas.add(record);
  }

  @Override
  public synchronized void appendVersion(VersionLogRecord record) {
    versions.add(record);
  }

  @Override
  public synchronized void appendConfig(ConfigLogRecord record) {
    configs.add(record);
  }

  @Override
  public synchronized List<SchemaLogRecord> readSchemas() {
    return new ArrayList<>(schemas);
  }

  @Override
  public synchronized List<VersionLogRecord> readVersions() {
    return new ArrayList<>(versions);
  }

  @Override
  public synchronized List<ConfigLogRecord> readConfigs() {
    return new ArrayList<>(configs);
  }

  @Override
  public void close() {
  }
}
