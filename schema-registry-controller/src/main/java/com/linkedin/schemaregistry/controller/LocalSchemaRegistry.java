package com.linkedin.schemaregistry.controller;

import com.linkedin.schemaregistry.compatibility.CompatibilityCheckResult;
import com.linkedin.schemaregistry.compatibility.SchemaCompatibilityChecker;
import com.linkedin.schemaregistry.exceptions.InvalidArgumentException;
import com.linkedin.schemaregistry.exceptions.SchemaIncompatibilityException;
import com.linkedin.schemaregistry.exceptions.SchemaNotFoundException;
import com.linkedin.schemaregistry.exceptions.SchemaRegistryStorageException;
import com.linkedin.schemaregistry.meta.CompatibilityMode;
import com.linkedin.schemaregistry.meta.ReadWriteSchemaRegistry;
import com.linkedin.schemaregistry.meta.SubjectKey;
import com.linkedin.schemaregistry.meta.SubjectSchema;
import com.linkedin.schemaregistry.meta.SubjectVersion;
import com.linkedin.schemaregistry.meta.VersionSpec;
import com.linkedin.schemaregistry.schema.AvroSchemaCanonicalizer;
import com.linkedin.schemaregistry.schema.CanonicalSchema;
import com.linkedin.schemaregistry.schema.SchemaCanonicalizer;
import com.linkedin.schemaregistry.schema.SchemaEntry;
import com.linkedin.schemaregistry.storage.CompatibilityConfigStore;
import com.linkedin.schemaregistry.storage.SchemaRegistryAccessor;
import com.linkedin.schemaregistry.storage.SchemaRegistryAccessorFactory;
import com.linkedin.schemaregistry.storage.SchemaStore;
import com.linkedin.schemaregistry.storage.SubjectVersionIndex;
import com.linkedin.schemaregistry.storage.VersionAppendResult;
import com.linkedin.schemaregistry.utils.locks.AutoCloseableLock;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;


/**
 * Schema registry running in the local process, on top of a {@link SchemaStore}, a {@link SubjectVersionIndex} and a
 * {@link CompatibilityConfigStore} sharing one {@link SchemaRegistryAccessor}.
 *
 * Every write to a subject (register, delete, compatibility override) runs under that subject's lock, so the compatibility check and the
 * append that follows it see the same history. Parsing happens before the lock is taken. Reads take no subject lock.
 */
public class LocalSchemaRegistry implements ReadWriteSchemaRegistry {
  private static final Logger LOGGER = LogManager.getLogger(LocalSchemaRegistry.class);

  private final SchemaRegistryConfig config;
  private final SchemaRegistryAccessor accessor;
  private final SchemaCanonicalizer canonicalizer;
  private final SchemaCompatibilityChecker compatibilityChecker;
  private final SchemaStore schemaStore;
  private final SubjectVersionIndex versionIndex;
  private final CompatibilityConfigStore configStore;
  private final SubjectLockManager lockManager;

  public LocalSchemaRegistry(SchemaRegistryConfig config) {
    this(
        config,
        SchemaRegistryAccessorFactory.create(config.getStorageType(), config.getStorageDir()),
        AvroSchemaCanonicalizer.getInstance(),
        SchemaCompatibilityChecker.getInstance());
  }

  public LocalSchemaRegistry(
      SchemaRegistryConfig config,
      SchemaRegistryAccessor accessor,
      SchemaCanonicalizer canonicalizer,
      SchemaCompatibilityChecker compatibilityChecker) {
    this.config = config;
    this.accessor = accessor;
    this.canonicalizer = canonicalizer;
    this.compatibilityChecker = compatibilityChecker;
    this.schemaStore = new SchemaStore(accessor, canonicalizer);
    this.versionIndex = new SubjectVersionIndex(accessor);
    this.versionIndex.validateSchemaIds(schemaStore::containsId);
    this.configStore = new CompatibilityConfigStore(accessor, config.getDefaultCompatibilityMode());
    this.lockManager = new SubjectLockManager(config.getSubjectLockTimeoutMs(), config.getLockReportingThresholdMs());
    LOGGER.info(
        "Schema registry started with {} schemas and {} subjects",
        schemaStore.size(),
        versionIndex.listSubjects().size());
  }

  @Override
  public int register(String subject, String type, String schemaStr) {
    SubjectKey subjectKey = SubjectKey.of(subject, type);
    CanonicalSchema canonicalSchema = canonicalize(schemaStr);

    try (AutoCloseableLock ignored = lockManager.lockSubject(subjectKey)) {
      Optional<SchemaEntry> knownSchema = schemaStore.getByFingerprint(canonicalSchema.getFingerprint());
      if (knownSchema.isPresent()) {
        Optional<SubjectVersion> existingVersion =
            versionIndex.findLiveVersionBySchemaId(subjectKey, knownSchema.get().getId());
        if (existingVersion.isPresent()) {
          LOGGER.info(
              "Schema id {} is already registered as version {} of {}",
              knownSchema.get().getId(),
              existingVersion.get().getVersion(),
              subjectKey);
          return knownSchema.get().getId();
        }
      }

      CompatibilityMode mode = configStore.getEffectiveMode(subjectKey);
      SchemaEntry candidate =
          knownSchema.orElseGet(() -> new SchemaEntry(SchemaStore.UNASSIGNED_SCHEMA_ID, canonicalSchema));
      CompatibilityCheckResult result = compatibilityChecker.check(candidate, getLiveSchemas(subjectKey), mode);
      if (!result.isCompatible()) {
        LOGGER.info("Rejected schema for {} under {}: {}", subjectKey, mode, result.getDescription());
        throw new SchemaIncompatibilityException(subjectKey, result);
      }

      SchemaEntry schemaEntry = schemaStore.put(canonicalSchema);
      VersionAppendResult appendResult = versionIndex.appendVersion(subjectKey, schemaEntry.getId());
      LOGGER.info(
          "Registered schema id {} as version {} of {}",
          schemaEntry.getId(),
          appendResult.getVersion(),
          subjectKey);
      return schemaEntry.getId();
    }
  }

  @Override
  public SortedSet<SubjectKey> listSubjects() {
    return versionIndex.listSubjects();
  }

  @Override
  public List<Integer> listVersions(String subject, String type) {
    return versionIndex.listVersions(SubjectKey.of(subject, type));
  }

  @Override
  public boolean hasSubject(String subject, String type) {
    return versionIndex.hasLiveVersion(SubjectKey.of(subject, type));
  }

  @Override
  public String getSchemaById(int schemaId) {
    if (schemaId <= 0) {
      throw new InvalidArgumentException("schemaId", schemaId + " is not a positive integer");
    }
    return schemaStore.getById(schemaId).getSchemaStr();
  }

  @Override
  public String getSchema(String subject, String type) {
    return getSchema(subject, type, VersionSpec.LATEST_KEYWORD);
  }

  @Override
  public String getSchema(String subject, String type, String version) {
    return getSchemaByVersion(subject, type, version).getSchemaStr();
  }

  @Override
  public SubjectSchema getSchemaByVersion(String subject, String type, String version) {
    SubjectKey subjectKey = SubjectKey.of(subject, type);
    SubjectVersion subjectVersion = versionIndex.getVersion(subjectKey, VersionSpec.parse(version));
    return toSubjectSchema(subjectKey, subjectVersion);
  }

  @Override
  public int getLatestSchemaId(String subject, String type) {
    return versionIndex.getVersion(SubjectKey.of(subject, type), VersionSpec.LATEST).getSchemaId();
  }

  @Override
  public SubjectSchema checkSchema(String subject, String type, String schemaStr) {
    SubjectKey subjectKey = SubjectKey.of(subject, type);
    CanonicalSchema canonicalSchema = canonicalize(schemaStr);
    Optional<SchemaEntry> schemaEntry = schemaStore.getByFingerprint(canonicalSchema.getFingerprint());
    if (schemaEntry.isPresent()) {
      Optional<SubjectVersion> subjectVersion =
          versionIndex.findLiveVersionBySchemaId(subjectKey, schemaEntry.get().getId());
      if (subjectVersion.isPresent()) {
        return toSubjectSchema(subjectKey, subjectVersion.get());
      }
    }
    throw new SchemaNotFoundException(subjectKey.toString());
  }

  @Override
  public boolean testCompatibility(String subject, String type, String schemaStr) {
    return testCompatibility(subject, type, schemaStr, VersionSpec.LATEST_KEYWORD);
  }

  @Override
  public boolean testCompatibility(String subject, String type, String schemaStr, String version) {
    return checkCompatibility(subject, type, schemaStr, version).isCompatible();
  }

  /**
   * With {@code latest}, the candidate is checked the way {@link #register} would check it. With an explicit
   * version, it is checked against that version alone, in the direction of the effective mode.
   */
  @Override
  public CompatibilityCheckResult checkCompatibility(String subject, String type, String schemaStr, String version) {
    SubjectKey subjectKey = SubjectKey.of(subject, type);
    VersionSpec versionSpec = VersionSpec.parse(version);
    SchemaEntry candidate = new SchemaEntry(SchemaStore.UNASSIGNED_SCHEMA_ID, canonicalize(schemaStr));
    CompatibilityMode mode = configStore.getEffectiveMode(subjectKey);

    List<SchemaEntry> references;
    if (versionSpec.isLatest()) {
      references = getLiveSchemas(subjectKey);
    } else {
      SubjectVersion subjectVersion = versionIndex.getVersion(subjectKey, versionSpec);
      references = Collections.singletonList(schemaStore.getById(subjectVersion.getSchemaId()));
    }
    return compatibilityChecker.check(candidate, references, mode);
  }

  @Override
  public int deleteVersion(String subject, String type, String version) {
    SubjectKey subjectKey = SubjectKey.of(subject, type);
    VersionSpec versionSpec = VersionSpec.parse(version);
    if (versionSpec.isLatest()) {
      throw new InvalidArgumentException("version", "an explicit version number is required to delete a version");
    }
    try (AutoCloseableLock ignored = lockManager.lockSubject(subjectKey)) {
      return versionIndex.softDeleteVersion(subjectKey, versionSpec.getVersion()).getVersion();
    }
  }

  @Override
  public List<Integer> deleteSubject(String subject, String type) {
    SubjectKey subjectKey = SubjectKey.of(subject, type);
    try (AutoCloseableLock ignored = lockManager.lockSubject(subjectKey)) {
      return versionIndex.deleteSubject(subjectKey);
    }
  }

  @Override
  public List<Integer> deleteAllSchemas(String subject, String type) {
    return deleteSubject(subject, type);
  }

  @Override
  public CompatibilityMode getGlobalConfig() {
    return configStore.getGlobalMode();
  }

  @Override
  public CompatibilityMode setGlobalConfig(String mode) {
    return configStore.setGlobalMode(CompatibilityMode.fromString(mode));
  }

  @Override
  public CompatibilityMode getSubjectConfig(String subject, String type) {
    return configStore.getEffectiveMode(SubjectKey.of(subject, type));
  }

  @Override
  public Optional<CompatibilityMode> getSubjectConfigOverride(String subject, String type) {
    return configStore.getOverride(SubjectKey.of(subject, type));
  }

  @Override
  public CompatibilityMode setSubjectConfig(String subject, String type, String mode) {
    SubjectKey subjectKey = SubjectKey.of(subject, type);
    CompatibilityMode compatibilityMode = CompatibilityMode.fromString(mode);
    try (AutoCloseableLock ignored = lockManager.lockSubject(subjectKey)) {
      return configStore.setOverride(subjectKey, compatibilityMode);
    }
  }

  @Override
  public boolean clearSubjectConfig(String subject, String type) {
    SubjectKey subjectKey = SubjectKey.of(subject, type);
    try (AutoCloseableLock ignored = lockManager.lockSubject(subjectKey)) {
      return configStore.clearOverride(subjectKey);
    }
  }

  @Override
  public void close() {
    try {
      accessor.close();
    } catch (SchemaRegistryStorageException e) {
      LOGGER.error("Failed to close schema registry storage", e);
      throw e;
    }
    LOGGER.info("Schema registry closed");
  }

  private CanonicalSchema canonicalize(String schemaStr) {
    if (schemaStr != null && schemaStr.getBytes(StandardCharsets.UTF_8).length > config.getSchemaMaxBytes()) {
      throw new InvalidArgumentException(
          "schema",
          "schema is larger than the limit of " + config.getSchemaMaxBytes() + " bytes");
    }
    return canonicalizer.canonicalize(schemaStr);
  }

  /**
   * @return schemas of the live versions, oldest first.
   */
  private List<SchemaEntry> getLiveSchemas(SubjectKey subjectKey) {
    List<SubjectVersion> liveVersions = versionIndex.getLiveVersions(subjectKey);
    List<SchemaEntry> schemas = new ArrayList<>(liveVersions.size());
    for (SubjectVersion subjectVersion: liveVersions) {
      schemas.add(schemaStore.getById(subjectVersion.getSchemaId()));
    }
    return schemas;
  }

  private SubjectSchema toSubjectSchema(SubjectKey subjectKey, SubjectVersion subjectVersion) {
    SchemaEntry schemaEntry = schemaStore.getById(subjectVersion.getSchemaId());
    return new SubjectSchema(subjectKey, subjectVersion.getVersion(), schemaEntry.getId(), schemaEntry.getSchemaStr());
  }
}
