package io.github.mrozowski.registry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-thread counterpart of {@link GlobalTable}. Buckets are created lazily and kept until
 * {@link #clear()}.
 */
final class LocalTable {

  private static final ThreadLocal<Map<Class<?>, Map<String, Slot>>> TABLE = new ThreadLocal<>();

  // entries whose apply callback is running on this thread
  private static final ThreadLocal<List<ContextFrame>> APPLYING = new ThreadLocal<>();

  private LocalTable() {
  }

  // null when nothing of the type was registered on this thread
  static Map<String, Slot> bucket(Class<?> type) {
    Map<Class<?>, Map<String, Slot>> table = TABLE.get();
    return table == null ? null : table.get(type);
  }

  static Map<String, Slot> bucketOrCreate(Class<?> type) {
    Map<Class<?>, Map<String, Slot>> table = TABLE.get();
    if (table == null) {
      table = new HashMap<>();
      TABLE.set(table);
    }
    return table.computeIfAbsent(type, t -> new HashMap<>());
  }

  static Slot slot(Class<?> type, String key) {
    Map<String, Slot> bucket = bucket(type);
    return bucket == null ? null : bucket.get(key);
  }

  static void clear() {
    TABLE.remove();
  }

  static ContextFrame openApply(Class<?> type, String key) {
    List<ContextFrame> open = APPLYING.get();
    if (open == null) {
      open = new ArrayList<>();
      APPLYING.set(open);
    }
    ContextFrame frame = new ContextFrame(key, type, ContextFrame.Access.EXCLUSIVE);
    open.add(frame);
    return frame;
  }

  static void closeApply(ContextFrame frame) {
    List<ContextFrame> open = APPLYING.get();
    if (open == null || open.isEmpty() || open.get(open.size() - 1) != frame) {
      throw new IllegalStateException("Apply scope closed out of order: " + frame);
    }
    open.remove(open.size() - 1);
    if (open.isEmpty()) {
      APPLYING.remove();
    }
  }

  static void ensureNotApplying(Class<?> type, String key, String operation) {
    List<ContextFrame> open = APPLYING.get();
    if (open == null) {
      return;
    }
    for (ContextFrame frame : open) {
      if (frame.sameEntry(type, key)) {
        throw new IllegalStateException(
            "Cannot " + operation + " " + type.getName() + " '" + key + "' while its apply callback is running");
      }
    }
  }
}
