package io.github.mrozowski.registry;

record ContextFrame(String key, Class<?> type, Access access) {

  enum Access {
    SHARED,
    EXCLUSIVE
  }

  boolean sameEntry(Class<?> otherType, String otherKey) {
    return type == otherType && key.equals(otherKey);
  }

  @Override
  public String toString() {
    return access + " scope on " + type.getName() + " '" + key + "'";
  }
}
