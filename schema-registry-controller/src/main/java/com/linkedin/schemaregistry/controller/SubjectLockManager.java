package com.linkedin.schemaregistry.controller;

import com.linkedin.schemaregistry.meta.SubjectKey;
import com.linkedin.schemaregistry.utils.locks.AutoCloseableLock;
import com.linkedin.schemaregistry.utils.locks.RegistryLock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;


/**
 * One lock per subject. Writers on different subjects never contend; writers on the same subject run one at a time.
 *
 * A subject's lock exists only while some thread holds it or waits for it.
 */
public class SubjectLockManager {
  private final ConcurrentMap<SubjectKey, SubjectLock> locks = new ConcurrentHashMap<>();
  private final long acquireTimeoutMs;
  private final long reportingThresholdMs;

  public SubjectLockManager(long acquireTimeoutMs, long reportingThresholdMs) {
    this.acquireTimeoutMs = acquireTimeoutMs;
    this.reportingThresholdMs = reportingThresholdMs;
  }

  /**
   * @throws com.linkedin.schemaregistry.exceptions.SchemaRegistryTimeoutException if the lock is not acquired in
   *         time.
   */
  public AutoCloseableLock lockSubject(SubjectKey subjectKey) {
    SubjectLock subjectLock = locks.compute(subjectKey, (key, existing) -> {
      SubjectLock entry = existing == null ? newSubjectLock(key) : existing;
      entry.users++;
      return entry;
    });
    AutoCloseableLock heldLock;
    try {
      heldLock = subjectLock.lock.lock();
    } catch (RuntimeException e) {
      release(subjectKey);
      throw e;
    }
    return () -> {
      heldLock.close();
      release(subjectKey);
    };
  }

  private SubjectLock newSubjectLock(SubjectKey subjectKey) {
    return new SubjectLock(
        new RegistryLock(new ReentrantLock(), "subject " + subjectKey, acquireTimeoutMs, reportingThresholdMs));
  }

  private void release(SubjectKey subjectKey) {
    locks.computeIfPresent(subjectKey, (key, entry) -> --entry.users == 0 ? null : entry);
  }

  int getLockCount() {
    return locks.size();
  }

  /** Mutated only inside map compute calls for its key. */
  private static class SubjectLock {
    private final RegistryLock lock;
    private int users = 0;

    SubjectLock(RegistryLock lock) {
      this.lock = lock;
    }
  }
}
