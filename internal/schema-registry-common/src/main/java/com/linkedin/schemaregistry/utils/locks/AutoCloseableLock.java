package com.linkedin.schemaregistry.utils.locks;

/**
 * A held lock that is released by {@link #close()}, so it can be scoped with try-with-resources.
 */
public interface AutoCloseableLock extends AutoCloseable {
  /**
   * Releases the lock. Does not throw.
   */
  @Override
  void close();
}
