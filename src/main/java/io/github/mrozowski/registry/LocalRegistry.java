package io.github.mrozowski.registry;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Registry whose values are visible only to the thread that registered them.
 * <p>
 * Offers the operations of {@link Registry} without locking. Inside an {@code apply} callback the
 * key being applied to cannot be registered, removed or replaced; such calls throw
 * {@link IllegalStateException}. Nested {@code with} and {@code apply} on that key are allowed.
 * </p>
 *
 * @param <T> type of the stored values
 */
public final class LocalRegistry<T> {

  private final Class<T> type;

  private LocalRegistry(Class<T> type) {
    this.type = Slot.checkValueType(type);
  }

  public static <T> LocalRegistry<T> of(Class<T> type) {
    return new LocalRegistry<>(type);
  }

  /**
   * Drops every value registered by the calling thread.
   */
  public static void clear() {
    LocalTable.clear();
  }

  public Class<T> type() {
    return type;
  }

  public void register(String key, T value) {
    Objects.requireNonNull(key, "key");
    LocalTable.ensureNotApplying(type, key, "register");
    Slot slot = new Slot(type, type.cast(Objects.requireNonNull(value, "value")));
    LocalTable.bucketOrCreate(type).put(key, slot);
  }

  public Optional<T> remove(String key) {
    Objects.requireNonNull(key, "key");
    LocalTable.ensureNotApplying(type, key, "remove");
    Map<String, Slot> bucket = LocalTable.bucket(type);
    if (bucket == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(bucket.remove(key))
        .map(slot -> slot.value(type));
  }

  public boolean exists(String key) {
    return LocalTable.slot(type, Objects.requireNonNull(key, "key")) != null;
  }

  public <R> Optional<R> apply(String key, Function<Handle<T>, ? extends R> mutator) {
    Objects.requireNonNull(mutator, "mutator");
    Slot slot = LocalTable.slot(type, Objects.requireNonNull(key, "key"));
    if (slot == null) {
      return Optional.empty();
    }
    Handle<T> handle = new Handle<>(slot, type);
    ContextFrame frame = LocalTable.openApply(type, key);
    try {
      return Optional.ofNullable(mutator.apply(handle));
    } finally {
      handle.close();
      LocalTable.closeApply(frame);
    }
  }

  public <R> Optional<R> with(String key, Function<? super T, ? extends R> reader) {
    Objects.requireNonNull(reader, "reader");
    Slot slot = LocalTable.slot(type, Objects.requireNonNull(key, "key"));
    if (slot == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(reader.apply(slot.value(type)));
  }

  /**
   * Replaces the value registered under the key; nothing is stored when the key is absent.
   *
   * @return previous value, or empty if the key was absent
   * @throws IllegalStateException if an apply callback on the key is running on this thread
   */
  public Optional<T> replace(String key, T value) {
    Objects.requireNonNull(key, "key");
    LocalTable.ensureNotApplying(type, key, "replace");
    Slot replacement = new Slot(type, type.cast(Objects.requireNonNull(value, "value")));
    Map<String, Slot> bucket = LocalTable.bucket(type);
    if (bucket == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(bucket.replace(key, replacement)).map(slot -> slot.value(type));
  }

  @Override
  public String toString() {
    return "LocalRegistry[" + type.getName() + "]";
  }
}
