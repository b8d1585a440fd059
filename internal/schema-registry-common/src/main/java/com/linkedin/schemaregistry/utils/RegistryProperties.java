package com.linkedin.schemaregistry.utils;

import com.linkedin.schemaregistry.exceptions.ConfigurationException;
import com.linkedin.schemaregistry.exceptions.UndefinedPropertyException;
import java.io.Serializable;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;


/**
 * Immutable view over string properties with typed getters. Build instances with {@link PropertyBuilder}.
 */
public class RegistryProperties implements Serializable {
  private static final long serialVersionUID = 1L;
  private static final RegistryProperties EMPTY = new RegistryProperties(new Properties());

  private final Map<String, String> props;

  public RegistryProperties(Properties properties) {
    Map<String, String> tmpProps = new HashMap<>(properties.size());
    for (Map.Entry<Object, Object> e: properties.entrySet()) {
      tmpProps.put(e.getKey().toString(), e.getValue() == null ? null : e.getValue().toString());
    }
    props = Collections.unmodifiableMap(tmpProps);
  }

  public static RegistryProperties empty() {
    return EMPTY;
  }

  public boolean containsKey(String k) {
    return props.containsKey(k);
  }

  private String get(String key) {
    if (props.containsKey(key)) {
      return props.get(key);
    } else {
      throw new UndefinedPropertyException(
          "Property " + key + " is not defined, some codePath is calling without calling containsKeys");
    }
  }

  public String getString(String key, String defaultValue) {
    if (containsKey(key)) {
      return get(key);
    } else {
      return defaultValue;
    }
  }

  public String getString(String key) {
    if (containsKey(key)) {
      return get(key);
    } else {
      throw new UndefinedPropertyException(key);
    }
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    if (containsKey(key)) {
      return "true".equalsIgnoreCase(get(key));
    } else {
      return defaultValue;
    }
  }

  public long getLong(String name, long defaultValue) {
    if (containsKey(name)) {
      return parseNumber(name, Long::parseLong);
    } else {
      return defaultValue;
    }
  }

  public long getLong(String name) {
    if (containsKey(name)) {
      return parseNumber(name, Long::parseLong);
    } else {
      throw new UndefinedPropertyException(name);
    }
  }

  public int getInt(String name, int defaultValue) {
    if (containsKey(name)) {
      return parseNumber(name, Integer::parseInt);
    } else {
      return defaultValue;
    }
  }

  public int getInt(String name) {
    if (containsKey(name)) {
      return parseNumber(name, Integer::parseInt);
    } else {
      throw new UndefinedPropertyException(name);
    }
  }

  private <T> T parseNumber(String name, Function<String, T> parser) {
    String value = get(name);
    try {
      return parser.apply(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Property " + name + " has a non numeric value: " + value, e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    RegistryProperties that = (RegistryProperties) o;

    return props.equals(that.props);
  }

  @Override
  public int hashCode() {
    return this.props.hashCode();
  }

  @Override
  public String toString() {
    return toString(false);
  }

  public String toString(boolean prettyPrint) {
    StringBuilder builder = new StringBuilder("{");
    final AtomicBoolean first = new AtomicBoolean(true);
    this.props.entrySet().stream().sorted((o1, o2) -> o1.getKey().compareTo(o2.getKey())).forEach(entry -> {
      if (first.get()) {
        first.set(false);
      } else {
        builder.append(", ");
      }
      if (prettyPrint) {
        builder.append("\n\t");
      }
      builder.append(entry.getKey());
      builder.append(": ");
      builder.append(entry.getValue());
    });
    if (prettyPrint && !props.isEmpty()) {
      builder.append("\n");
    }
    builder.append("}");
    return builder.toString();
  }
}
