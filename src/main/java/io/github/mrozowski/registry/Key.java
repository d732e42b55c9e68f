package io.github.mrozowski.registry;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Name and value type of one registry entry.
 * <p>Example usage:</p>
 * <pre>{@code
 *     static final Key<StringBuilder> LOG = Key.of(Ids.extend(ROOT, "log"), StringBuilder.class);
 *
 *     LOG.register(new StringBuilder());
 *     LOG.apply(h -> h.get().append("hello"));
 * }</pre>
 *
 * @param <T> type of the value
 */
public final class Key<T> {

  private final String name;
  private final Class<T> type;

  private Key(String name, Class<T> type) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = Slot.checkValueType(type);
  }

  public static <T> Key<T> of(String name, Class<T> type) {
    return new Key<>(name, type);
  }

  public String name() {
    return name;
  }

  public Class<T> type() {
    return type;
  }

  public Registry<T> registry() {
    return Registry.of(type);
  }

  public void register(T value) {
    registry().register(name, value);
  }

  public Optional<T> remove() {
    return registry().remove(name);
  }

  public boolean exists() {
    return registry().exists(name);
  }

  public <R> Optional<R> apply(Function<Handle<T>, ? extends R> mutator) {
    return registry().apply(name, mutator);
  }

  public <R> Optional<R> with(Function<? super T, ? extends R> reader) {
    return registry().with(name, reader);
  }

  public Optional<T> replace(T value) {
    return registry().replace(name, value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Key<?> other)) {
      return false;
    }
    return name.equals(other.name) && type == other.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override
  public String toString() {
    return "Key[" + type.getSimpleName() + " " + name + "]";
  }
}
