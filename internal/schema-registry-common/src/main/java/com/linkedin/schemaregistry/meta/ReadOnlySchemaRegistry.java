package com.linkedin.schemaregistry.meta;

import com.linkedin.schemaregistry.compatibility.CompatibilityCheckResult;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;


/**
 * Read side of the schema registry. Subjects are addressed by name plus type ({@code key} or {@code value});
 * versions by a positive number or {@code latest}.
 */
public interface ReadOnlySchemaRegistry {
  /**
   * @return every subject with at least one live version.
   */
  SortedSet<SubjectKey> listSubjects();

  /**
   * @return live version numbers, ascending.
   * @throws com.linkedin.schemaregistry.exceptions.SubjectNotFoundException if the subject has no live version.
   */
  List<Integer> listVersions(String subject, String type);

  boolean hasSubject(String subject, String type);

  /**
   * @return the schema body registered under the global id, whether or not any subject still refers to it.
   * @throws com.linkedin.schemaregistry.exceptions.SchemaIdNotFoundException if the id was never assigned.
   */
  String getSchemaById(int schemaId);

  /**
   * Body of the latest live version.
   */
  String getSchema(String subject, String type);

  /**
   * @param version a positive number, {@code latest} or null for latest.
   * @throws com.linkedin.schemaregistry.exceptions.VersionNotFoundException if the version is absent or deleted.
   */
  String getSchema(String subject, String type, String version);

  SubjectSchema getSchemaByVersion(String subject, String type, String version);

  int getLatestSchemaId(String subject, String type);

  /**
   * Looks up a schema body among the live versions of a subject.
   *
   * @throws com.linkedin.schemaregistry.exceptions.SchemaNotFoundException if no live version holds that schema.
   */
  SubjectSchema checkSchema(String subject, String type, String schemaStr);

  /**
   * Checks the schema against the latest live version, or all live versions under a transitive mode.
   */
  boolean testCompatibility(String subject, String type, String schemaStr);

  /**
   * Checks the schema against one version of the subject. {@code latest} on a subject without versions is
   * compatible.
   */
  boolean testCompatibility(String subject, String type, String schemaStr, String version);

  CompatibilityCheckResult checkCompatibility(String subject, String type, String schemaStr, String version);

  CompatibilityMode getGlobalConfig();

  /**
   * @return the override of the subject if there is one, the global default otherwise.
   */
  CompatibilityMode getSubjectConfig(String subject, String type);

  Optional<CompatibilityMode> getSubjectConfigOverride(String subject, String type);
}
