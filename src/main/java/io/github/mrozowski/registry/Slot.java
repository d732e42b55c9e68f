package io.github.mrozowski.registry;

import java.util.Objects;

/**
 * One stored value together with the type it was registered under.
 */
class Slot {

  private final Class<?> type;
  private Object value;

  Slot(Class<?> type, Object value) {
    this.type = Objects.requireNonNull(type);
    Objects.requireNonNull(value, "value");
    if (!type.isInstance(value)) {
      throw new TypeInvariantError(
          "Value of " + value.getClass().getName() + " cannot be stored as " + type.getName());
    }
    this.value = value;
  }

  static <T> Class<T> checkValueType(Class<T> type) {
    Objects.requireNonNull(type, "type");
    if (type.isPrimitive()) {
      throw new IllegalArgumentException(
          "Primitive type " + type.getName() + " cannot be registered, use its wrapper class");
    }
    return type;
  }

  final Class<?> type() {
    return type;
  }

  final <T> T value(Class<T> expected) {
    ensureType(expected);
    return expected.cast(value);
  }

  final <T> void set(Class<T> expected, T newValue) {
    ensureType(expected);
    value = expected.cast(Objects.requireNonNull(newValue, "value"));
  }

  private void ensureType(Class<?> expected) {
    if (expected != type) {
      throw new TypeInvariantError(
          "Slot holds " + type.getName() + " but was accessed as " + expected.getName());
    }
  }
}
