package com.linkedin.schemaregistry.meta;

import java.util.List;


public interface ReadWriteSchemaRegistry extends ReadOnlySchemaRegistry, AutoCloseable {
  /**
   * Registers a schema under a subject.
   *
   * @return the global schema id. Registering a schema the subject already holds returns the existing id and
   *         creates nothing.
   * @throws com.linkedin.schemaregistry.exceptions.InvalidArgumentException if subject or type is malformed.
   * @throws com.linkedin.schemaregistry.exceptions.InvalidSchemaException if the schema does not parse.
   * @throws com.linkedin.schemaregistry.exceptions.SchemaIncompatibilityException if the schema breaks the
   *         subject's compatibility mode.
   */
  int register(String subject, String type, String schemaStr);

  /**
   * Soft deletes one version.
   *
   * @param version an explicit positive version number.
   * @return the deleted version number.
   */
  int deleteVersion(String subject, String type, String version);

  /**
   * Soft deletes every live version of the subject.
   *
   * @return the deleted version numbers, ascending; empty if the subject had none.
   */
  List<Integer> deleteSubject(String subject, String type);

  /**
   * Same as {@link #deleteSubject(String, String)}.
   */
  List<Integer> deleteAllSchemas(String subject, String type);

  CompatibilityMode setGlobalConfig(String mode);

  CompatibilityMode setSubjectConfig(String subject, String type, String mode);

  /**
   * @return whether the subject had an override.
   */
  boolean clearSubjectConfig(String subject, String type);

  @Override
  void close();
}
