package com.linkedin.schemaregistry.utils.locks;

import com.linkedin.schemaregistry.exceptions.SchemaRegistryTimeoutException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;


/**
 * Wrapper around a {@link Lock} that bounds the time spent waiting for it and emits logs when acquiring or holding
 * the lock takes too long.
 */
public class RegistryLock {
  private static final Logger LOGGER = LogManager.getLogger(RegistryLock.class);

  private final Lock lock;
  private final String lockDescription;
  private final long acquireTimeoutMs;
  private final long reportingThresholdMs;

  /**
   * @param lock underlying {@link Lock}.
   * @param lockDescription describes the lock to give context in logs and errors.
   * @param acquireTimeoutMs how long {@link #lock()} waits before giving up.
   * @param reportingThresholdMs waits and holds longer than this are logged.
   */
  public RegistryLock(Lock lock, String lockDescription, long acquireTimeoutMs, long reportingThresholdMs) {
    this.lock = lock;
    this.lockDescription = lockDescription;
    this.acquireTimeoutMs = acquireTimeoutMs;
    this.reportingThresholdMs = reportingThresholdMs;
  }

  /**
   * Acquires the lock, waiting at most the configured timeout.
   *
   * @throws SchemaRegistryTimeoutException if the lock could not be acquired in time or the thread was interrupted.
   */
  public AutoCloseableLock lock() {
    long acquireStartTime = System.currentTimeMillis();
    boolean acquired;
    try {
      acquired = lock.tryLock(acquireTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SchemaRegistryTimeoutException("Interrupted while waiting for the lock of " + lockDescription, e);
    }
    if (!acquired) {
      throw new SchemaRegistryTimeoutException(
          "Failed to acquire the lock of " + lockDescription + " within " + acquireTimeoutMs + " ms");
    }

    long acquiredTime = System.currentTimeMillis();
    long waitTimeMs = acquiredTime - acquireStartTime;
    if (waitTimeMs > reportingThresholdMs) {
      LOGGER.warn("Waited {} ms to acquire the lock of {}", waitTimeMs, lockDescription);
    }
    return () -> unlock(acquiredTime);
  }

  private void unlock(long acquiredTime) {
    lock.unlock();
    long lockRetentionTimeMs = Math.max(0, System.currentTimeMillis() - acquiredTime);
    if (lockRetentionTimeMs > reportingThresholdMs) {
      LOGGER.warn(
          "Lock of {} was held for {} ms which exceeded the reporting threshold of {} ms",
          lockDescription,
          lockRetentionTimeMs,
          reportingThresholdMs);
    }
  }
}
