package io.b2mash.taskregistry.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.taskregistry.access.Principal;
import io.b2mash.taskregistry.exception.ResourceNotFoundException;
import org.junit.jupiter.api.Test;

class TaskStoreTest {

  private static final Principal ALICE = Principal.of("alice");

  private final TaskStore store = new TaskStore();

  @Test
  void ids_start_at_one_and_increase() {
    var first = store.create("a", 10, TaskPriority.LOW, ALICE, 1);
    var second = store.create("b", 20, TaskPriority.LOW, ALICE, 1);

    assertThat(first.getId()).isEqualTo(1);
    assertThat(second.getId()).isEqualTo(2);
    assertThat(store.taskCounter()).isEqualTo(2);
    assertThat(store.liveCount()).isEqualTo(2);
  }

  @Test
  void ids_never_reused_after_clear() {
    store.create("a", 10, TaskPriority.LOW, ALICE, 1);
    store.create("b", 10, TaskPriority.LOW, ALICE, 1);
    store.clear(2);

    var third = store.create("c", 10, TaskPriority.LOW, ALICE, 1);

    assertThat(third.getId()).isEqualTo(3);
    assertThat(store.taskCounter()).isEqualTo(3);
    assertThat(store.liveCount()).isEqualTo(2);
  }

  @Test
  void cleared_slot_stays_addressable() {
    store.create("a", 10, TaskPriority.HIGH, ALICE, 1);
    store.clear(1);

    assertThat(store.isValidId(1)).isTrue();
    assertThat(store.requireSlot(1).isCleared()).isTrue();
  }

  @Test
  void zero_and_out_of_range_ids_are_invalid() {
    store.create("a", 10, TaskPriority.HIGH, ALICE, 1);

    assertThat(store.isValidId(0)).isFalse();
    assertThat(store.isValidId(-1)).isFalse();
    assertThat(store.isValidId(2)).isFalse();
    assertThatThrownBy(() -> store.requireSlot(2)).isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void clearing_twice_is_rejected_without_touching_counter() {
    store.create("a", 10, TaskPriority.HIGH, ALICE, 1);
    store.clear(1);

    assertThatThrownBy(() -> store.clear(1)).isInstanceOf(IllegalStateException.class);
    assertThat(store.liveCount()).isZero();
  }

  @Test
  void slots_view_is_read_only() {
    store.create("a", 10, TaskPriority.HIGH, ALICE, 1);

    assertThatThrownBy(() -> store.slots().clear())
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
