package io.github.mrozowski.registry;

import java.util.Locale;

public final class RegistryOptions {

  /**
   * System property switching deadlock detection on ({@code true}, the default) or off ({@code false}).
   */
  public static final String DEADLOCK_DETECTION_PROPERTY = "light.registry.deadlock-detection";

  private final boolean deadlockDetection;

  private RegistryOptions(boolean deadlockDetection) {
    this.deadlockDetection = deadlockDetection;
  }

  public static RegistryOptions defaults() {
    return new RegistryOptions(true);
  }

  /**
   * Reads the options from system properties, falling back to {@link #defaults()} for anything unset.
   *
   * @return options described by the current system properties
   * @throws IllegalArgumentException if a property holds something other than {@code true} or {@code false}
   */
  public static RegistryOptions fromSystemProperties() {
    String detection = System.getProperty(DEADLOCK_DETECTION_PROPERTY);
    if (detection == null) {
      return defaults();
    }
    return builder()
        .deadlockDetection(parseBoolean(DEADLOCK_DETECTION_PROPERTY, detection))
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean deadlockDetection() {
    return deadlockDetection;
  }

  @Override
  public String toString() {
    return "RegistryOptions[deadlockDetection=" + deadlockDetection + "]";
  }

  private static boolean parseBoolean(String property, String value) {
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true":
        return true;
      case "false":
        return false;
      default:
        throw new IllegalArgumentException(
            "System property " + property + " must be 'true' or 'false' but was '" + value + "'");
    }
  }

  public static final class Builder {

    private boolean deadlockDetection = true;

    /**
     * Enables or disables deadlock detection.
     * <p>
     * With detection disabled, nested access that would deadlock is no longer reported and the
     * calling thread may block forever instead: {@code apply} inside {@code with} on the same key
     * never returns. Exclusive locks are reentrant, so {@code apply} or {@code with} inside
     * {@code apply} on the same key re-enters and runs with two handles on one value.
     * </p>
     *
     * @param enabled whether nested access is checked before locking
     * @return this builder
     */
    public Builder deadlockDetection(boolean enabled) {
      this.deadlockDetection = enabled;
      return this;
    }

    public RegistryOptions build() {
      return new RegistryOptions(deadlockDetection);
    }
  }
}
