package com.linkedin.schemaregistry.storage;

import com.linkedin.schemaregistry.exceptions.SchemaDuplicateException;
import com.linkedin.schemaregistry.exceptions.VersionNotFoundException;
import com.linkedin.schemaregistry.meta.SubjectKey;
import com.linkedin.schemaregistry.meta.SubjectVersion;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;


/**
 * Versions of one subject, live and soft deleted. Not thread safe, {@link SubjectVersionIndex} guards every call.
 */
class SubjectVersionHistory {
  private final SubjectKey subjectKey;
  private final TreeMap<Integer, SubjectVersion> versions = new TreeMap<>();
  /** Highest version ever handed out, deleted ones included. */
  private int maxVersion = 0;

  SubjectVersionHistory(SubjectKey subjectKey) {
    this.subjectKey = subjectKey;
  }

  /**
   * Applies a persisted record. Later records for the same version win.
   */
  void replay(VersionLogRecord record) {
    versions.put(record.getVersion(), new SubjectVersion(record.getVersion(), record.getSchemaId(), record.isDeleted()));
    maxVersion = Math.max(maxVersion, record.getVersion());
  }

  /**
   * @throws SchemaDuplicateException if a live version already holds the schema.
   */
  SubjectVersion append(int schemaId, SchemaRegistryAccessor accessor) {
    Optional<SubjectVersion> existing = findLiveBySchemaId(schemaId);
    if (existing.isPresent()) {
      throw new SchemaDuplicateException(subjectKey, existing.get());
    }
    SubjectVersion subjectVersion = new SubjectVersion(maxVersion + 1, schemaId, false);
    accessor.appendVersion(toRecord(subjectVersion));
    versions.put(subjectVersion.getVersion(), subjectVersion);
    maxVersion = subjectVersion.getVersion();
    return subjectVersion;
  }

  Optional<SubjectVersion> findLiveBySchemaId(int schemaId) {
    for (SubjectVersion subjectVersion: versions.values()) {
      if (!subjectVersion.isDeleted() && subjectVersion.getSchemaId() == schemaId) {
        return Optional.of(subjectVersion);
      }
    }
    return Optional.empty();
  }

  /**
   * @return live versions, oldest first.
   */
  List<SubjectVersion> getLiveVersions() {
    List<SubjectVersion> live = new ArrayList<>();
    for (SubjectVersion subjectVersion: versions.values()) {
      if (!subjectVersion.isDeleted()) {
        live.add(subjectVersion);
      }
    }
    return live;
  }

  Optional<SubjectVersion> getLatestLive() {
    for (Map.Entry<Integer, SubjectVersion> entry: versions.descendingMap().entrySet()) {
      if (!entry.getValue().isDeleted()) {
        return Optional.of(entry.getValue());
      }
    }
    return Optional.empty();
  }

  Optional<SubjectVersion> getLive(int version) {
    SubjectVersion subjectVersion = versions.get(version);
    if (subjectVersion == null || subjectVersion.isDeleted()) {
      return Optional.empty();
    }
    return Optional.of(subjectVersion);
  }

  SubjectVersion softDelete(int version, SchemaRegistryAccessor accessor) {
    SubjectVersion subjectVersion = versions.get(version);
    if (subjectVersion == null) {
      throw new VersionNotFoundException(subjectKey.toString(), String.valueOf(version));
    }
    if (subjectVersion.isDeleted()) {
      throw new VersionNotFoundException(subjectKey.toString(), String.valueOf(version), "it is already deleted");
    }
    SubjectVersion deleted = subjectVersion.markDeleted();
    accessor.appendVersion(toRecord(deleted));
    versions.put(version, deleted);
    return deleted;
  }

  boolean hasLiveVersion() {
    return getLatestLive().isPresent();
  }

  private VersionLogRecord toRecord(SubjectVersion subjectVersion) {
    return new VersionLogRecord(
        subjectKey.toString(),
        subjectVersion.getVersion(),
        subjectVersion.getSchemaId(),
        subjectVersion.isDeleted());
  }
}
