package io.github.mrozowski.registry;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Read/write lock that turns unusable once a writer fails while holding it.
 */
final class GuardedLock {

  private static final System.Logger log = System.getLogger(GuardedLock.class.getName());

  private final String name;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private volatile boolean poisoned;

  GuardedLock(String name) {
    this.name = name;
  }

  String name() {
    return name;
  }

  boolean isPoisoned() {
    return poisoned;
  }

  <R> R read(Supplier<R> body) {
    lock.readLock().lock();
    try {
      ensureNotPoisoned();
      return body.get();
    } finally {
      lock.readLock().unlock();
    }
  }

  <R> R write(Supplier<R> body) {
    lock.writeLock().lock();
    try {
      ensureNotPoisoned();
      try {
        return body.get();
      } catch (RuntimeException | Error ex) {
        poison(ex);
        throw ex;
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void poison(Throwable cause) {
    poisoned = true;
    log.log(System.Logger.Level.WARNING,
        "Lock on {0} poisoned by {1}",
        name,
        cause.toString());
  }

  private void ensureNotPoisoned() {
    if (poisoned) {
      throw new LockUnavailableException(name);
    }
  }
}
