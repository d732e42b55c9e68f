package io.github.mrozowski.registry.core;

import io.github.mrozowski.registry.Handle;
import io.github.mrozowski.registry.LocalRegistry;
import io.github.mrozowski.registry.Registry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class LocalRegistryTest {

  private final LocalRegistry<Integer> ints = LocalRegistry.of(Integer.class);

  @AfterEach
  void tearDown() {
    LocalRegistry.clear();
  }

  @Test
  void should_store_and_update_values_of_calling_thread() {
    // Given
    ints.register("a", 1);

    // When
    Optional<Integer> incremented = ints.apply("a", h -> h.update(v -> v + 1));

    // Then
    assertEquals(Optional.of(2), incremented);
    assertEquals(Optional.of(2), ints.with("a", v -> v));
    assertEquals(Optional.of(2), ints.remove("a"));
    assertFalse(ints.exists("a"));
    assertEquals(Optional.empty(), ints.remove("a"));
  }

  @Test
  void should_overwrite_value_when_registering_same_key_twice() {
    // Given
    LocalRegistry<String> strings = LocalRegistry.of(String.class);
    strings.register("b", "x");

    // When
    strings.register("b", "y");

    // Then
    assertEquals(Optional.of("y"), strings.with("b", v -> v));
  }

  @Test
  void should_not_create_entry_when_replacing_absent_key() {
    // Given
    ints.register("present", 1);

    // When
    Optional<Integer> missing = ints.replace("absent", 2);
    Optional<Integer> previous = ints.replace("present", 3);

    // Then
    assertEquals(Optional.empty(), missing);
    assertFalse(ints.exists("absent"));
    assertEquals(Optional.of(1), previous);
    assertEquals(Optional.of(3), ints.with("present", v -> v));
  }

  @Test
  void should_report_not_found_for_type_never_registered() {
    // Given
    LocalRegistry<Long> longs = LocalRegistry.of(Long.class);

    // When / Then
    assertFalse(longs.exists("x"));
    assertEquals(Optional.empty(), longs.with("x", v -> v));
    assertEquals(Optional.empty(), longs.apply("x", h -> h.get()));
    assertEquals(Optional.empty(), longs.replace("x", 1L));
    assertEquals(Optional.empty(), longs.remove("x"));
  }

  @Test
  void should_hide_values_from_other_threads() throws Exception {
    // Given
    ints.register("mine", 1);
    AtomicBoolean visibleElsewhere = new AtomicBoolean(true);

    // When
    Thread other = new Thread(() -> visibleElsewhere.set(ints.exists("mine")));
    other.start();
    other.join(5_000);

    // Then
    assertFalse(visibleElsewhere.get());
    assertTrue(ints.exists("mine"));
  }

  @Test
  void should_keep_local_and_global_values_apart() {
    // Given
    Registry<Integer> global = Registry.of(Integer.class);
    ints.register("both", 1);

    try {
      // When
      global.register("both", 2);

      // Then
      assertEquals(Optional.of(1), ints.with("both", v -> v));
      assertEquals(Optional.of(2), global.with("both", v -> v));
    } finally {
      Registry.teardown();
    }
  }

  @Test
  void should_allow_nested_access_to_same_key() {
    // Given
    ints.register("nested", 1);

    // When
    Optional<Integer> result = ints.apply("nested", outer ->
        outer.update(v -> v + ints.with("nested", inner -> inner).orElseThrow()));

    // Then
    assertEquals(Optional.of(2), result);
  }

  @Test
  void should_reject_replace_of_key_inside_its_apply() {
    // Given
    ints.register("a", 1);

    // When
    assertThrows(IllegalStateException.class, () -> ints.apply("a", h -> {
      ints.replace("a", 5);
      h.set(10);
      return h.get();
    }));

    // Then
    assertEquals(Optional.of(1), ints.with("a", v -> v));
  }

  @Test
  void should_reject_remove_of_key_inside_its_apply() {
    // Given
    ints.register("b", 1);

    // When
    assertThrows(IllegalStateException.class, () -> ints.apply("b", h -> {
      ints.remove("b");
      h.set(10);
      return null;
    }));

    // Then
    assertTrue(ints.exists("b"));
    assertEquals(Optional.of(1), ints.with("b", v -> v));
  }

  @Test
  void should_reject_register_of_key_inside_its_apply() {
    // Given
    ints.register("c", 1);

    // When
    assertThrows(IllegalStateException.class, () -> ints.apply("c", h -> {
      ints.register("c", 5);
      return null;
    }));

    // Then
    assertEquals(Optional.of(1), ints.with("c", v -> v));
  }

  @Test
  void should_allow_changing_other_keys_inside_apply_and_release_key_afterwards() {
    // Given
    LocalRegistry<String> strings = LocalRegistry.of(String.class);
    ints.register("busy", 1);
    ints.register("other", 2);
    strings.register("busy", "s");

    // When
    ints.apply("busy", h -> {
      ints.replace("other", 20);
      ints.register("third", 3);
      strings.replace("busy", "t");
      return h.update(v -> v + 1);
    });

    // Then
    assertEquals(Optional.of(20), ints.with("other", v -> v));
    assertEquals(Optional.of(3), ints.with("third", v -> v));
    assertEquals(Optional.of("t"), strings.with("busy", v -> v));
    assertEquals(Optional.of(2), ints.replace("busy", 7));
    assertEquals(Optional.of(7), ints.remove("busy"));
  }

  @Test
  void should_release_key_when_apply_callback_throws() {
    // Given
    ints.register("fragile", 1);
    assertThrows(IllegalArgumentException.class, () -> ints.apply("fragile", h -> {
      throw new IllegalArgumentException("boom");
    }));

    // When
    Optional<Integer> previous = ints.replace("fragile", 2);

    // Then
    assertEquals(Optional.of(1), previous);
  }

  @Test
  void should_reject_handle_used_after_apply_returned() {
    // Given
    ints.register("escape", 1);
    AtomicReference<Handle<Integer>> escaped = new AtomicReference<>();

    // When
    ints.apply("escape", h -> {
      escaped.set(h);
      return null;
    });

    // Then
    assertThrows(IllegalStateException.class, () -> escaped.get().get());
  }

  @Test
  void should_drop_values_of_calling_thread_on_clear() {
    // Given
    ints.register("temporary", 1);

    // When
    LocalRegistry.clear();

    // Then
    assertFalse(ints.exists("temporary"));
  }
}
