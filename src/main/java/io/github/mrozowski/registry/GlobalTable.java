package io.github.mrozowski.registry;

import io.github.mrozowski.registry.ContextFrame.Access;
import io.github.mrozowski.registry.ContextTracker.LockTarget;
import io.github.mrozowski.registry.ContextTracker.Scope;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Root of the store: one {@link TypeBucket} per registered value type.
 * <p>
 * Locks are taken table, bucket, slot and released in the opposite order. The table and the bucket
 * stay read-locked for the whole of a {@code with}/{@code apply} callback.
 * </p>
 */
final class GlobalTable {

  private static final System.Logger log = System.getLogger(GlobalTable.class.getName());

  private static final AtomicReference<GlobalTable> INSTANCE = new AtomicReference<>();

  private final ContextTracker tracker;
  private final GuardedLock lock = new GuardedLock("global table");
  private final Map<Class<?>, TypeBucket> buckets = new HashMap<>();

  GlobalTable(RegistryOptions options) {
    Objects.requireNonNull(options);
    this.tracker = new ContextTracker(options.deadlockDetection());
  }

  static GlobalTable instance() {
    GlobalTable table;
    while ((table = INSTANCE.get()) == null) {
      INSTANCE.compareAndSet(null, new GlobalTable(RegistryOptions.fromSystemProperties()));
    }
    return table;
  }

  static void initialize(RegistryOptions options) {
    if (!INSTANCE.compareAndSet(null, new GlobalTable(options))) {
      throw new IllegalStateException("Registry is already initialized, tear it down before configuring it again");
    }
    log.log(System.Logger.Level.INFO, "Registry initialized with {0}", options);
  }

  static void teardown() {
    if (INSTANCE.getAndSet(null) != null) {
      log.log(System.Logger.Level.INFO, "Registry torn down");
    }
  }

  ContextTracker tracker() {
    return tracker;
  }

  int bucketCount() {
    return lock.read(buckets::size);
  }

  <T> void register(Class<T> type, String key, T value) {
    SharedSlot slot = new SharedSlot(type, key, value);
    ensureBucket(type, key);
    inBucket(type, bucket -> {
      tracker.check(LockTarget.TYPE_BUCKET, type, key);
      bucket.put(key, slot);
      return Optional.empty();
    });
  }

  <T> Optional<T> remove(Class<T> type, String key) {
    return inBucket(type, bucket -> {
      tracker.check(LockTarget.TYPE_BUCKET, type, key);
      return Optional.ofNullable(bucket.detach(key)).map(slot -> detachedValue(slot, type));
    });
  }

  boolean exists(Class<?> type, String key) {
    try {
      return inBucket(type, bucket -> Optional.of(bucket.contains(key))).orElse(false);
    } catch (LockUnavailableException ex) {
      return false;
    }
  }

  <T, R> Optional<R> apply(Class<T> type, String key, Function<Handle<T>, ? extends R> mutator) {
    return inBucket(type, bucket -> bucket.lookup(key, slot -> {
      tracker.check(LockTarget.SLOT_EXCLUSIVE, type, key);
      return slot.lock().write(() -> {
        Handle<T> handle = new Handle<>(slot, type);
        try (Scope ignored = tracker.open(key, type, Access.EXCLUSIVE)) {
          return Optional.ofNullable(mutator.apply(handle));
        } finally {
          handle.close();
        }
      });
    }));
  }

  <T, R> Optional<R> with(Class<T> type, String key, Function<? super T, ? extends R> reader) {
    return inBucket(type, bucket -> bucket.lookup(key, slot -> {
      tracker.check(LockTarget.SLOT_SHARED, type, key);
      return slot.lock().read(() -> {
        T value = slot.value(type);
        try (Scope ignored = tracker.open(key, type, Access.SHARED)) {
          return Optional.ofNullable(reader.apply(value));
        }
      });
    }));
  }

  <T> Optional<T> replace(Class<T> type, String key, T value) {
    SharedSlot replacement = new SharedSlot(type, key, value);
    return inBucket(type, bucket -> {
      tracker.check(LockTarget.TYPE_BUCKET, type, key);
      return Optional.ofNullable(bucket.swap(key, replacement)).map(slot -> detachedValue(slot, type));
    });
  }

  private void ensureBucket(Class<?> type, String key) {
    if (lock.read(() -> buckets.containsKey(type))) {
      return;
    }
    tracker.check(LockTarget.GLOBAL_TABLE, type, key);
    // another thread may have created the bucket since the read above
    lock.write(() -> buckets.computeIfAbsent(type, this::newBucket));
  }

  private TypeBucket newBucket(Class<?> type) {
    log.log(System.Logger.Level.DEBUG, "Creating type bucket for {0}", type.getName());
    return new TypeBucket(type);
  }

  // the table stays read-locked while body runs
  private <R> Optional<R> inBucket(Class<?> type, Function<TypeBucket, Optional<R>> body) {
    return lock.read(() -> {
      TypeBucket bucket = buckets.get(type);
      return bucket == null ? Optional.empty() : body.apply(bucket);
    });
  }

  private static <T> T detachedValue(SharedSlot slot, Class<T> type) {
    if (slot.lock().isPoisoned()) {
      throw new LockUnavailableException(slot.lock().name());
    }
    return slot.value(type);
  }
}
