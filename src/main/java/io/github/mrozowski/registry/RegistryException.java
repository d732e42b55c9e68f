package io.github.mrozowski.registry;

/**
 * Base type of the recoverable failures reported by the registry.
 */
public class RegistryException extends RuntimeException {

  public RegistryException(String message) {
    super(message);
  }

  public RegistryException(String message, Throwable cause) {
    super(message, cause);
  }
}
