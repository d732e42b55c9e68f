package io.github.mrozowski.registry;

/**
 * Thrown when a lock in the table, bucket or slot tier was poisoned by a writer that failed while
 * holding it. The value behind such a lock may be half-updated, so the registry refuses to hand it
 * out again.
 */
public final class LockUnavailableException extends RegistryException {

  private final String lockName;

  public LockUnavailableException(String lockName) {
    super("Lock on " + lockName + " is poisoned by an earlier failure");
    this.lockName = lockName;
  }

  public String lockName() {
    return lockName;
  }
}
