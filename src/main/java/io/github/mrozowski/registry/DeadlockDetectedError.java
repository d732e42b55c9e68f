package io.github.mrozowski.registry;

/**
 * Raised when the calling thread asks for a lock that one of its own enclosing {@code with} or
 * {@code apply} scopes already holds in a conflicting mode. Waiting would never end, so the
 * request fails immediately instead.
 *
 * <p>This is an {@link Error}: callers are not expected to catch it or retry.</p>
 */
public final class DeadlockDetectedError extends Error {

  public DeadlockDetectedError(String message) {
    super(message);
  }
}
