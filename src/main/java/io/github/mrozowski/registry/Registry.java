package io.github.mrozowski.registry;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Process-wide store of values of type {@code T}, addressed by string keys.
 * <p>
 * Entries are unique per (type, key): the same key can hold one value of every type. All
 * registries share a single table that is created on first use.
 * </p>
 * <p>Example usage:</p>
 * <pre>{@code
 *     Registry<Integer> counters = Registry.of(Integer.class);
 *     counters.register("hits", 0);
 *     counters.apply("hits", h -> h.update(v -> v + 1));
 *     int hits = counters.with("hits", v -> v).orElse(0);
 * }</pre>
 * <p>
 * Functions passed to {@link #with} and {@link #apply} may call the registry again. Calls that
 * would wait for a lock the enclosing call already holds throw {@link DeadlockDetectedError}
 * instead of blocking, unless detection is disabled through {@link RegistryOptions}:
 * <ul>
 *   <li>registering a value of a type never registered before, inside any callback</li>
 *   <li>register, remove or replace of a type whose value the callback is using</li>
 *   <li>apply of the key the callback is using</li>
 *   <li>with of the key an enclosing apply is using</li>
 * </ul>
 * </p>
 *
 * @param <T> type of the stored values
 */
public final class Registry<T> {

  private final Class<T> type;
  private final Supplier<GlobalTable> table;

  Registry(Class<T> type, Supplier<GlobalTable> table) {
    this.type = Slot.checkValueType(type);
    this.table = table;
  }

  /**
   * @param type class of the stored values, not a primitive class
   * @param <T>  type of the stored values
   * @return registry for values of {@code type}
   */
  public static <T> Registry<T> of(Class<T> type) {
    return new Registry<>(type, GlobalTable::instance);
  }

  /**
   * Initializes the shared table with the given options. Without this call the table is built from
   * {@link RegistryOptions#fromSystemProperties()} on first use.
   *
   * @param options options of the table
   * @throws IllegalStateException if the table is already in use
   */
  public static void configure(RegistryOptions options) {
    GlobalTable.initialize(Objects.requireNonNull(options, "options"));
  }

  /**
   * Drops every registered value. The next call creates a new, empty table.
   */
  public static void teardown() {
    GlobalTable.teardown();
  }

  public Class<T> type() {
    return type;
  }

  /**
   * Registers a value, replacing any value already registered under the key.
   *
   * @param key   key of the value
   * @param value value to store
   * @throws LockUnavailableException if the table or the type bucket is poisoned
   */
  public void register(String key, T value) {
    Objects.requireNonNull(key, "key");
    table.get().register(type, key, type.cast(Objects.requireNonNull(value, "value")));
  }

  /**
   * Removes the value registered under the key.
   *
   * @param key key of the value
   * @return removed value, or empty if there was none
   * @throws LockUnavailableException if the value was poisoned by a failed {@link #apply}; the entry
   *                                  is removed nevertheless
   */
  public Optional<T> remove(String key) {
    return table.get().remove(type, Objects.requireNonNull(key, "key"));
  }

  /**
   * @param key key of the value
   * @return whether a value is registered under the key; a poisoned table or bucket reads as {@code false}
   */
  public boolean exists(String key) {
    return table.get().exists(type, Objects.requireNonNull(key, "key"));
  }

  /**
   * Runs {@code mutator} with exclusive access to the value registered under the key.
   * <p>
   * If {@code mutator} throws, the value is poisoned: later calls for the key throw
   * {@link LockUnavailableException} until the key is registered again.
   * </p>
   *
   * @param key     key of the value
   * @param mutator reads and replaces the value through the {@link Handle}
   * @param <R>     result type of {@code mutator}
   * @return result of {@code mutator}, or empty if no value is registered or the result is {@code null}
   * @throws LockUnavailableException if the value is poisoned
   * @throws DeadlockDetectedError    if an enclosing callback of this thread uses the same key
   */
  public <R> Optional<R> apply(String key, Function<Handle<T>, ? extends R> mutator) {
    Objects.requireNonNull(mutator, "mutator");
    return table.get().apply(type, Objects.requireNonNull(key, "key"), mutator);
  }

  /**
   * Runs {@code reader} with shared access to the value registered under the key. Readers of the
   * same key run concurrently.
   *
   * @param key    key of the value
   * @param reader reads the value
   * @param <R>    result type of {@code reader}
   * @return result of {@code reader}, or empty if no value is registered or the result is {@code null}
   * @throws LockUnavailableException if the value is poisoned
   * @throws DeadlockDetectedError    if an enclosing {@link #apply} of this thread uses the same key
   */
  public <R> Optional<R> with(String key, Function<? super T, ? extends R> reader) {
    Objects.requireNonNull(reader, "reader");
    return table.get().with(type, Objects.requireNonNull(key, "key"), reader);
  }

  /**
   * Replaces the value registered under the key. Unlike {@link #register} nothing is stored when
   * the key is absent.
   *
   * @param key   key of the value
   * @param value new value
   * @return previous value, or empty if the key was absent
   * @throws LockUnavailableException if the previous value was poisoned; {@code value} is stored nevertheless
   */
  public Optional<T> replace(String key, T value) {
    Objects.requireNonNull(key, "key");
    return table.get().replace(type, key, type.cast(Objects.requireNonNull(value, "value")));
  }

  /**
   * @deprecated use {@link #replace(String, Object)}
   */
  @Deprecated
  public Optional<T> take(String key, T value) {
    return replace(key, value);
  }

  @Override
  public String toString() {
    return "Registry[" + type.getName() + "]";
  }
}
