package com.linkedin.schemaregistry.meta;

import com.linkedin.schemaregistry.exceptions.InvalidArgumentException;


/**
 * Either an explicit, positive version number or the {@code latest} live version of a subject.
 */
public final class VersionSpec {
  public static final String LATEST_KEYWORD = "latest";
  public static final VersionSpec LATEST = new VersionSpec(-1);

  private final int version;

  private VersionSpec(int version) {
    this.version = version;
  }

  public static VersionSpec of(int version) {
    if (version <= 0) {
      throw new InvalidArgumentException("version", version + " is not a positive integer");
    }
    return new VersionSpec(version);
  }

  /**
   * Accepts {@code latest} (any case), a positive integer, or {@code null} which stands for {@code latest}.
   */
  public static VersionSpec parse(String version) {
    if (version == null || LATEST_KEYWORD.equalsIgnoreCase(version)) {
      return LATEST;
    }
    if (!version.matches("\\d{1,10}")) {
      throw new InvalidArgumentException("version", "'" + version + "' is neither 'latest' nor a positive integer");
    }
    long parsed = Long.parseLong(version);
    if (parsed > Integer.MAX_VALUE) {
      throw new InvalidArgumentException("version", version + " is out of range");
    }
    return of((int) parsed);
  }

  public boolean isLatest() {
    return this == LATEST;
  }

  /**
   * @throws IllegalStateException if this is {@link #LATEST}
   */
  public int getVersion() {
    if (isLatest()) {
      throw new IllegalStateException("The latest version spec does not carry a version number");
    }
    return version;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return version == ((VersionSpec) o).version;
  }

  @Override
  public int hashCode() {
    return version;
  }

  @Override
  public String toString() {
    return isLatest() ? LATEST_KEYWORD : String.valueOf(version);
  }
}
