package io.github.mrozowski.registry;

import java.util.Objects;

/**
 * Builds hierarchical, dot separated key names.
 * <pre>{@code
 *     static final String MY_ID = Ids.id("my", "module", "MyType");        // ".my.module.MyType"
 *     static final String OTHER_ID = Ids.extend(MY_ID, "other", "Other");  // ".my.module.MyType.other.Other"
 * }</pre>
 */
public final class Ids {

  private Ids() {
  }

  /**
   * @param segments path segments, each a Java identifier
   * @return the segments, each preceded by a dot
   */
  public static String id(String... segments) {
    return appendSegments(new StringBuilder(), segments).toString();
  }

  /**
   * @param root     name built earlier, typically by {@link #id}
   * @param segments path segments appended below {@code root}, each a Java identifier
   * @return {@code root} followed by the segments, each preceded by a dot
   */
  public static String extend(String root, String... segments) {
    Objects.requireNonNull(root, "root");
    return appendSegments(new StringBuilder(root), segments).toString();
  }

  private static StringBuilder appendSegments(StringBuilder name, String... segments) {
    Objects.requireNonNull(segments, "segments");
    if (segments.length == 0) {
      throw new IllegalArgumentException("At least one segment is required");
    }
    for (String segment : segments) {
      name.append('.').append(checkSegment(segment));
    }
    return name;
  }

  private static String checkSegment(String segment) {
    Objects.requireNonNull(segment, "segment");
    if (segment.isEmpty() || !Character.isJavaIdentifierStart(segment.charAt(0))) {
      throw new IllegalArgumentException("Segment '" + segment + "' is not an identifier");
    }
    for (int i = 1; i < segment.length(); i++) {
      if (!Character.isJavaIdentifierPart(segment.charAt(i))) {
        throw new IllegalArgumentException("Segment '" + segment + "' is not an identifier");
      }
    }
    return segment;
  }
}
