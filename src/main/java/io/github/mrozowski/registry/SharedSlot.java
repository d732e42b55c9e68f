package io.github.mrozowski.registry;

/**
 * Slot of the global table, guarded by its own lock for {@code with} and {@code apply}.
 */
final class SharedSlot extends Slot {

  private final GuardedLock lock;

  SharedSlot(Class<?> type, String key, Object value) {
    super(type, value);
    this.lock = new GuardedLock("slot " + type.getName() + " '" + key + "'");
  }

  GuardedLock lock() {
    return lock;
  }
}
