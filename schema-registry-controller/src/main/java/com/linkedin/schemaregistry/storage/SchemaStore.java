package com.linkedin.schemaregistry.storage;

import com.linkedin.schemaregistry.exceptions.InvalidSchemaException;
import com.linkedin.schemaregistry.exceptions.SchemaIdNotFoundException;
import com.linkedin.schemaregistry.exceptions.SchemaRegistryStorageException;
import com.linkedin.schemaregistry.schema.CanonicalSchema;
import com.linkedin.schemaregistry.schema.SchemaCanonicalizer;
import com.linkedin.schemaregistry.schema.SchemaEntry;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;


/**
 * Global, append-only catalog of distinct schemas. Each distinct canonical schema gets exactly one id; ids start at
 * {@value #FIRST_SCHEMA_ID}, are dense and are never reused or removed.
 */
public class SchemaStore {
  private static final Logger LOGGER = LogManager.getLogger(SchemaStore.class);

  public static final int FIRST_SCHEMA_ID = 1;
  /** Id carried by candidate schemas that have not been stored. */
  public static final int UNASSIGNED_SCHEMA_ID = 0;

  private final SchemaRegistryAccessor accessor;
  private final Int2ObjectMap<SchemaEntry> schemasById = new Int2ObjectOpenHashMap<>();
  private final Map<String, SchemaEntry> schemasByFingerprint = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private int maxSchemaId = UNASSIGNED_SCHEMA_ID;

  public SchemaStore(SchemaRegistryAccessor accessor, SchemaCanonicalizer canonicalizer) {
    this.accessor = accessor;
    restore(canonicalizer);
  }

  private void restore(SchemaCanonicalizer canonicalizer) {
    for (SchemaLogRecord record: accessor.readSchemas()) {
      CanonicalSchema canonicalSchema;
      try {
        canonicalSchema = canonicalizer.canonicalize(record.getSchema());
      } catch (InvalidSchemaException e) {
        throw new SchemaRegistryStorageException("Stored schema " + record.getId() + " no longer parses", e);
      }
      if (!canonicalSchema.getFingerprint().equals(record.getFingerprint())) {
        throw new SchemaRegistryStorageException(
            "Fingerprint mismatch for stored schema " + record.getId() + ", expected " + record.getFingerprint()
                + " but computed " + canonicalSchema.getFingerprint());
      }
      if (record.getId() < FIRST_SCHEMA_ID || schemasById.containsKey(record.getId())) {
        throw new SchemaRegistryStorageException("Invalid or duplicate stored schema id " + record.getId());
      }
      if (schemasByFingerprint.containsKey(record.getFingerprint())) {
        throw new SchemaRegistryStorageException(
            "Schema " + record.getId() + " duplicates schema " + schemasByFingerprint.get(record.getFingerprint()).getId());
      }
      SchemaEntry entry = new SchemaEntry(record.getId(), canonicalSchema);
      schemasById.put(entry.getId(), entry);
      schemasByFingerprint.put(entry.getFingerprint(), entry);
      maxSchemaId = Math.max(maxSchemaId, entry.getId());
    }
    if (schemasById.size() != maxSchemaId) {
      throw new SchemaRegistryStorageException(
          "Stored schema ids are not dense, found " + schemasById.size() + " schemas with max id " + maxSchemaId);
    }
    LOGGER.info("Restored {} schemas, max schema id is {}", schemasById.size(), maxSchemaId);
  }

  /**
   * Returns the entry holding this schema, storing it under the next id if it is new. Concurrent callers with the
   * same schema always observe a single id.
   */
  public SchemaEntry put(CanonicalSchema canonicalSchema) {
    lock.writeLock().lock();
    try {
      SchemaEntry existing = schemasByFingerprint.get(canonicalSchema.getFingerprint());
      if (existing != null) {
        return existing;
      }
      SchemaEntry entry = new SchemaEntry(maxSchemaId + 1, canonicalSchema);
      accessor.appendSchema(new SchemaLogRecord(entry.getId(), entry.getFingerprint(), entry.getSchemaStr()));
      schemasById.put(entry.getId(), entry);
      schemasByFingerprint.put(entry.getFingerprint(), entry);
      maxSchemaId = entry.getId();
      LOGGER.info("Stored new schema with id {} and fingerprint {}", entry.getId(), entry.getFingerprint());
      return entry;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * @throws SchemaIdNotFoundException if the id was never assigned.
   */
  public SchemaEntry getById(int schemaId) {
    lock.readLock().lock();
    try {
      SchemaEntry entry = schemasById.get(schemaId);
      if (entry == null) {
        throw new SchemaIdNotFoundException(schemaId);
      }
      return entry;
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<SchemaEntry> getByFingerprint(String fingerprint) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(schemasByFingerprint.get(fingerprint));
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean containsId(int schemaId) {
    lock.readLock().lock();
    try {
      return schemasById.containsKey(schemaId);
    } finally {
      lock.readLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return schemasById.size();
    } finally {
      lock.readLock().unlock();
    }
  }
}
