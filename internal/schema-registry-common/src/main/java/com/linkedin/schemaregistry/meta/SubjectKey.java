package com.linkedin.schemaregistry.meta;

import com.linkedin.schemaregistry.exceptions.InvalidArgumentException;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;


/**
 * Scope key of a subject: the subject name plus whether it holds key or value schemas. It renders as
 * {@code {name}-{type}}, e.g. {@code orders-value}.
 */
public final class SubjectKey implements Comparable<SubjectKey> {
  static final char TYPE_DELIMITER = '-';

  private final String name;
  private final SubjectType type;

  public SubjectKey(String name, SubjectType type) {
    validateName(name);
    if (type == null) {
      throw new InvalidArgumentException("type", "subject type cannot be null");
    }
    this.name = name;
    this.type = type;
  }

  public static SubjectKey of(String name, String type) {
    return new SubjectKey(name, SubjectType.fromString(type));
  }

  /**
   * Parses the rendered form produced by {@link #toString()}. The type is taken from the text after the last
   * delimiter, so subject names may themselves contain the delimiter.
   */
  public static SubjectKey parse(String scopeKey) {
    if (StringUtils.isEmpty(scopeKey)) {
      throw new InvalidArgumentException("subject", "scope key cannot be empty");
    }
    int delimiterIndex = scopeKey.lastIndexOf(TYPE_DELIMITER);
    if (delimiterIndex <= 0 || delimiterIndex == scopeKey.length() - 1) {
      throw new InvalidArgumentException("subject", "'" + scopeKey + "' is not of the form {name}-{key|value}");
    }
    return of(scopeKey.substring(0, delimiterIndex), scopeKey.substring(delimiterIndex + 1));
  }

  private static void validateName(String name) {
    if (StringUtils.isBlank(name)) {
      throw new InvalidArgumentException("subject", "subject name cannot be empty");
    }
    if (StringUtils.containsAny(name, '\n', '\r')) {
      throw new InvalidArgumentException("subject", "subject name cannot contain line breaks");
    }
  }

  public String getName() {
    return name;
  }

  public SubjectType getType() {
    return type;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    SubjectKey that = (SubjectKey) o;
    return name.equals(that.name) && type == that.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override
  public int compareTo(SubjectKey other) {
    return toString().compareTo(other.toString());
  }

  @Override
  public String toString() {
    return name + TYPE_DELIMITER + type.getSuffix();
  }
}
