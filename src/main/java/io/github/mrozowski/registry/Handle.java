package io.github.mrozowski.registry;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Mutable view of a registered value, handed to the function passed to {@code apply}.
 * <p>
 * The handle is only valid while that function runs. Any use after it returned throws
 * {@link IllegalStateException}.
 * </p>
 *
 * @param <T> type of the registered value
 */
public final class Handle<T> {

  private final Slot slot;
  private final Class<T> type;
  private volatile boolean open = true;

  Handle(Slot slot, Class<T> type) {
    this.slot = slot;
    this.type = type;
  }

  /**
   * @return the current value
   */
  public T get() {
    ensureOpen();
    return slot.value(type);
  }

  /**
   * Replaces the registered value.
   *
   * @param value new value, not {@code null}
   */
  public void set(T value) {
    ensureOpen();
    slot.set(type, Objects.requireNonNull(value, "value"));
  }

  /**
   * Replaces the registered value with the result of {@code operator} applied to the current one.
   *
   * @param operator computes the new value
   * @return the new value
   */
  public T update(UnaryOperator<T> operator) {
    T next = operator.apply(get());
    set(next);
    return next;
  }

  void close() {
    open = false;
  }

  private void ensureOpen() {
    if (!open) {
      throw new IllegalStateException("Handle of " + type.getName() + " used outside of its apply scope");
    }
  }
}
