package com.linkedin.schemaregistry.meta;

import com.linkedin.schemaregistry.exceptions.InvalidArgumentException;


/**
 * Whether a subject holds the schemas of record keys or of record values.
 */
public enum SubjectType {
  KEY("key"), VALUE("value");

  private final String suffix;

  SubjectType(String suffix) {
    this.suffix = suffix;
  }

  /**
   * @return the lower case form used when rendering a {@link SubjectKey}.
   */
  public String getSuffix() {
    return suffix;
  }

  public static SubjectType fromString(String type) {
    if (type != null) {
      for (SubjectType subjectType: values()) {
        if (subjectType.suffix.equalsIgnoreCase(type)) {
          return subjectType;
        }
      }
    }
    throw new InvalidArgumentException("type", "'" + type + "' is not one of [key, value]");
  }

  @Override
  public String toString() {
    return suffix;
  }
}
