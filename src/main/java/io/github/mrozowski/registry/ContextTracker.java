package io.github.mrozowski.registry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Keeps, for every thread, the stack of {@code with}/{@code apply} scopes it currently has open
 * and refuses lock requests that would block on a lock held by one of those scopes.
 * <p>
 * Only the calling thread's own stack is consulted. Deadlocks between different threads are not
 * detected.
 * </p>
 */
final class ContextTracker {

  private static final System.Logger log = System.getLogger(ContextTracker.class.getName());

  private static final Scope NO_SCOPE = () -> {
  };

  enum LockTarget {
    GLOBAL_TABLE("exclusive global table lock"),
    TYPE_BUCKET("exclusive type bucket lock"),
    SLOT_EXCLUSIVE("exclusive slot lock"),
    SLOT_SHARED("shared slot lock");

    private final String description;

    LockTarget(String description) {
      this.description = description;
    }
  }

  /**
   * Open scope; closing it pops the frame pushed by {@link #open}.
   */
  interface Scope extends AutoCloseable {
    @Override
    void close();
  }

  private final boolean enabled;
  private final ThreadLocal<Deque<ContextFrame>> frames = new ThreadLocal<>();

  ContextTracker(boolean enabled) {
    this.enabled = enabled;
  }

  boolean enabled() {
    return enabled;
  }

  void check(LockTarget target, Class<?> type, String key) {
    if (!enabled) {
      return;
    }
    Deque<ContextFrame> stack = frames.get();
    if (stack == null) {
      return;
    }
    for (ContextFrame frame : stack) {
      if (conflicts(target, frame, type, key)) {
        deadlock(target, type, key, frame, stack.size());
      }
    }
  }

  Scope open(String key, Class<?> type, ContextFrame.Access access) {
    if (!enabled) {
      return NO_SCOPE;
    }
    Deque<ContextFrame> stack = frames.get();
    if (stack == null) {
      stack = new ArrayDeque<>();
      frames.set(stack);
    }
    ContextFrame frame = new ContextFrame(key, type, access);
    stack.addLast(frame);
    return () -> close(frame);
  }

  int depth() {
    Deque<ContextFrame> stack = frames.get();
    return stack == null ? 0 : stack.size();
  }

  List<ContextFrame> snapshot() {
    Deque<ContextFrame> stack = frames.get();
    return stack == null ? List.of() : List.copyOf(stack);
  }

  private void close(ContextFrame frame) {
    Deque<ContextFrame> stack = frames.get();
    if (stack == null || stack.peekLast() != frame) {
      throw new IllegalStateException("Scope closed out of order: " + frame);
    }
    stack.removeLast();
    if (stack.isEmpty()) {
      frames.remove();
    }
  }

  private static boolean conflicts(LockTarget target, ContextFrame frame, Class<?> type, String key) {
    return switch (target) {
      case GLOBAL_TABLE -> true;
      case TYPE_BUCKET -> frame.type() == type;
      case SLOT_EXCLUSIVE -> frame.sameEntry(type, key);
      case SLOT_SHARED -> frame.access() == ContextFrame.Access.EXCLUSIVE && frame.sameEntry(type, key);
    };
  }

  private static void deadlock(LockTarget target, Class<?> type, String key, ContextFrame frame, int depth) {
    String thread = Thread.currentThread().getName();
    log.log(System.Logger.Level.ERROR,
        "Thread {0} would deadlock acquiring {1} for {2} ''{3}'' inside {4} (depth {5})",
        thread,
        target.description,
        type.getName(),
        key,
        frame,
        depth);
    throw new DeadlockDetectedError("Thread '" + thread + "' would deadlock acquiring "
        + target.description + " for " + type.getName() + " '" + key + "' inside " + frame);
  }
}
