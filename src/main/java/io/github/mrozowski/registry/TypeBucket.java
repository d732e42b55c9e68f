package io.github.mrozowski.registry;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

final class TypeBucket {

  private final GuardedLock lock;
  private final Map<String, SharedSlot> slots = new HashMap<>();

  TypeBucket(Class<?> type) {
    this.lock = new GuardedLock("type bucket " + type.getName());
  }

  boolean contains(String key) {
    return lock.read(() -> slots.containsKey(key));
  }

  // the bucket stays read-locked while body runs
  <R> Optional<R> lookup(String key, Function<SharedSlot, Optional<R>> body) {
    return lock.read(() -> {
      SharedSlot slot = slots.get(key);
      return slot == null ? Optional.empty() : body.apply(slot);
    });
  }

  SharedSlot put(String key, SharedSlot slot) {
    return lock.write(() -> slots.put(key, slot));
  }

  SharedSlot detach(String key) {
    return lock.write(() -> slots.remove(key));
  }

  // replaces only an existing entry, returns the previous slot or null
  SharedSlot swap(String key, SharedSlot slot) {
    return lock.write(() -> slots.replace(key, slot));
  }
}
