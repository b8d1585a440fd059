package com.linkedin.schemaregistry.storage;

import com.linkedin.schemaregistry.exceptions.SchemaDuplicateException;
import com.linkedin.schemaregistry.exceptions.SchemaRegistryStorageException;
import com.linkedin.schemaregistry.exceptions.SubjectNotFoundException;
import com.linkedin.schemaregistry.exceptions.VersionNotFoundException;
import com.linkedin.schemaregistry.meta.SubjectKey;
import com.linkedin.schemaregistry.meta.SubjectVersion;
import com.linkedin.schemaregistry.meta.VersionSpec;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.IntPredicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;


/**
 * Maps each subject to its ordered versions. Version numbers start at 1 per subject and are never reused, so a
 * subject whose versions were all deleted continues numbering where it stopped.
 *
 * Each call is atomic. Sequences of calls on one subject (check then append) are serialized by the caller.
 */
public class SubjectVersionIndex {
  private static final Logger LOGGER = LogManager.getLogger(SubjectVersionIndex.class);

  private final SchemaRegistryAccessor accessor;
  private final Map<SubjectKey, SubjectVersionHistory> histories = new HashMap<>();

  public SubjectVersionIndex(SchemaRegistryAccessor accessor) {
    this.accessor = accessor;
    restore();
  }

  private void restore() {
    int count = 0;
    for (VersionLogRecord record: accessor.readVersions()) {
      SubjectKey subjectKey;
      try {
        subjectKey = SubjectKey.parse(record.getSubject());
      } catch (RuntimeException e) {
        throw new SchemaRegistryStorageException("Invalid stored subject in " + record, e);
      }
      if (record.getVersion() < 1) {
        throw new SchemaRegistryStorageException("Invalid stored version in " + record);
      }
      histories.computeIfAbsent(subjectKey, SubjectVersionHistory::new).replay(record);
      count++;
    }
    LOGGER.info("Restored {} version records across {} subjects", count, histories.size());
  }

  /**
   * Throws if any stored version refers to a schema id the predicate rejects.
   */
  public synchronized void validateSchemaIds(IntPredicate schemaIdExists) {
    for (Map.Entry<SubjectKey, SubjectVersionHistory> entry: histories.entrySet()) {
      for (SubjectVersion subjectVersion: entry.getValue().getLiveVersions()) {
        if (!schemaIdExists.test(subjectVersion.getSchemaId())) {
          throw new SchemaRegistryStorageException(
              "Version " + subjectVersion.getVersion() + " of " + entry.getKey() + " refers to unknown schema id "
                  + subjectVersion.getSchemaId());
        }
      }
    }
  }

  /**
   * Appends a version holding the schema, unless a live version of the subject already holds it.
   */
  public synchronized VersionAppendResult appendVersion(SubjectKey subjectKey, int schemaId) {
    SubjectVersionHistory history = histories.get(subjectKey);
    boolean newSubject = history == null;
    if (newSubject) {
      history = new SubjectVersionHistory(subjectKey);
    }
    try {
      SubjectVersion subjectVersion = history.append(schemaId, accessor);
      if (newSubject) {
        histories.put(subjectKey, history);
      }
      LOGGER.info("Added version {} with schema id {} to {}", subjectVersion.getVersion(), schemaId, subjectKey);
      return new VersionAppendResult(subjectVersion, false);
    } catch (SchemaDuplicateException e) {
      LOGGER.debug(e.getMessage());
      return new VersionAppendResult(e.getExistingVersion(), true);
    }
  }

  /**
   * @throws SubjectNotFoundException if the subject has no live version.
   */
  public synchronized List<Integer> listVersions(SubjectKey subjectKey) {
    List<SubjectVersion> live = getLiveVersions(subjectKey);
    if (live.isEmpty()) {
      throw new SubjectNotFoundException(subjectKey.toString());
    }
    List<Integer> versions = new ArrayList<>(live.size());
    for (SubjectVersion subjectVersion: live) {
      versions.add(subjectVersion.getVersion());
    }
    return versions;
  }

  /**
   * @return live versions oldest first, empty if there are none.
   */
  public synchronized List<SubjectVersion> getLiveVersions(SubjectKey subjectKey) {
    SubjectVersionHistory history = histories.get(subjectKey);
    return history == null ? Collections.emptyList() : history.getLiveVersions();
  }

  /**
   * @throws VersionNotFoundException if the version is absent or deleted, or if {@code latest} is requested for a
   *         subject without live versions.
   */
  public synchronized SubjectVersion getVersion(SubjectKey subjectKey, VersionSpec versionSpec) {
    Optional<SubjectVersion> subjectVersion = findVersion(subjectKey, versionSpec);
    if (!subjectVersion.isPresent()) {
      throw new VersionNotFoundException(subjectKey.toString(), versionSpec.toString());
    }
    return subjectVersion.get();
  }

  public synchronized Optional<SubjectVersion> findVersion(SubjectKey subjectKey, VersionSpec versionSpec) {
    SubjectVersionHistory history = histories.get(subjectKey);
    if (history == null) {
      return Optional.empty();
    }
    return versionSpec.isLatest() ? history.getLatestLive() : history.getLive(versionSpec.getVersion());
  }

  public synchronized Optional<SubjectVersion> findLiveVersionBySchemaId(SubjectKey subjectKey, int schemaId) {
    SubjectVersionHistory history = histories.get(subjectKey);
    return history == null ? Optional.empty() : history.findLiveBySchemaId(schemaId);
  }

  /**
   * @throws VersionNotFoundException if the version is absent or already deleted.
   */
  public synchronized SubjectVersion softDeleteVersion(SubjectKey subjectKey, int version) {
    SubjectVersionHistory history = histories.get(subjectKey);
    if (history == null) {
      throw new VersionNotFoundException(subjectKey.toString(), String.valueOf(version));
    }
    SubjectVersion deleted = history.softDelete(version, accessor);
    LOGGER.info("Deleted version {} of {}", version, subjectKey);
    return deleted;
  }

  /**
   * Soft deletes every live version of the subject.
   *
   * @return the deleted version numbers ascending, empty if there were none.
   */
  public synchronized List<Integer> deleteSubject(SubjectKey subjectKey) {
    SubjectVersionHistory history = histories.get(subjectKey);
    if (history == null) {
      return Collections.emptyList();
    }
    List<Integer> deleted = new ArrayList<>();
    for (SubjectVersion subjectVersion: history.getLiveVersions()) {
      history.softDelete(subjectVersion.getVersion(), accessor);
      deleted.add(subjectVersion.getVersion());
    }
    if (!deleted.isEmpty()) {
      LOGGER.info("Deleted versions {} of {}", deleted, subjectKey);
    }
    return deleted;
  }

  public synchronized boolean hasLiveVersion(SubjectKey subjectKey) {
    SubjectVersionHistory history = histories.get(subjectKey);
    return history != null && history.hasLiveVersion();
  }

  /**
   * @return subjects with at least one live version.
   */
  public synchronized SortedSet<SubjectKey> listSubjects() {
    SortedSet<SubjectKey> subjects = new TreeSet<>();
    for (Map.Entry<SubjectKey, SubjectVersionHistory> entry: histories.entrySet()) {
      if (entry.getValue().hasLiveVersion()) {
        subjects.add(entry.getKey());
      }
    }
    return subjects;
  }
}
