package com.linkedin.schemaregistry.exceptions;

import org.apache.hc.core5.http.HttpStatus;


public class VersionNotFoundException extends SchemaRegistryException {
  private static final long serialVersionUID = 1L;

  private final String subject;
  private final String version;

  public VersionNotFoundException(String subject, String version) {
    super("Version: " + version + " does not exist for subject: " + subject, ErrorType.VERSION_NOT_FOUND);
    this.subject = subject;
    this.version = version;
  }

  public VersionNotFoundException(String subject, String version, String reason) {
    super("Version: " + version + " of subject: " + subject + " " + reason, ErrorType.VERSION_NOT_FOUND);
    this.subject = subject;
    this.version = version;
  }

  public String getSubject() {
    return subject;
  }

  public String getVersion() {
    return version;
  }

  @Override
  public int getHttpStatusCode() {
    return HttpStatus.SC_NOT_FOUND;
  }
}
