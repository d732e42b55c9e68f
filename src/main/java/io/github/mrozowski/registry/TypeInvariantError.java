package io.github.mrozowski.registry;

/**
 * Raised when a stored value is accessed through a type other than the one it was registered
 * with. Slots are looked up by type, so seeing this means the registry itself is broken.
 */
public final class TypeInvariantError extends Error {

  public TypeInvariantError(String message) {
    super(message);
  }
}
