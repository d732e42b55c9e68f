package io.github.mrozowski.registry.core;

import io.github.mrozowski.registry.Ids;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IdsTest {

  private static final String MY_ID = Ids.id("my", "module", "MyType");
  private static final String OTHER_ID = Ids.extend(MY_ID, "other", "OtherType");

  @Test
  void should_prefix_every_segment_with_a_dot() {
    assertEquals(".my.module.MyType", MY_ID);
    assertEquals(".Vec", Ids.id("Vec"));
  }

  @Test
  void should_extend_previously_built_id() {
    assertEquals(".my.module.MyType.other.OtherType", OTHER_ID);
  }

  @Test
  void should_build_distinct_ids_for_distinct_paths() {
    assertNotEquals(Ids.id("a", "b"), Ids.id("ab"));
    assertEquals(Ids.id("a", "b"), Ids.extend(Ids.id("a"), "b"));
  }

  @Test
  void should_reject_segments_that_are_not_identifiers() {
    assertThrows(IllegalArgumentException.class, () -> Ids.id("my.module"));
    assertThrows(IllegalArgumentException.class, () -> Ids.id("1st"));
    assertThrows(IllegalArgumentException.class, () -> Ids.id(""));
    assertThrows(IllegalArgumentException.class, () -> Ids.id());
    assertThrows(IllegalArgumentException.class, () -> Ids.extend(MY_ID));
  }
}
