package io.b2mash.taskregistry.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.taskregistry.access.Principal;
import io.b2mash.taskregistry.exception.InvalidRequestException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class TaskPaginationTest {

  private static final Principal ALICE = Principal.of("alice");

  private static TaskSnapshot task(long id, long dueDate) {
    return new TaskSnapshot(id, "t" + id, ALICE, false, dueDate, TaskPriority.MEDIUM, 0);
  }

  private static List<Long> ids(List<TaskSnapshot> tasks) {
    return tasks.stream().map(TaskSnapshot::id).toList();
  }

  @Test
  void sorts_ascending_by_due_date() {
    var sorted = TaskPagination.sortByDueDate(List.of(task(1, 100), task(2, 50), task(3, 75)));

    assertThat(ids(sorted)).containsExactly(2L, 3L, 1L);
  }

  @Test
  void equal_due_dates_keep_input_order() {
    var sorted =
        TaskPagination.sortByDueDate(
            List.of(task(1, 30), task(2, 10), task(3, 30), task(4, 10), task(5, 30)));

    assertThat(ids(sorted)).containsExactly(2L, 4L, 1L, 3L, 5L);
  }

  @Test
  void sort_does_not_modify_input() {
    var input = List.of(task(1, 9), task(2, 1));

    TaskPagination.sortByDueDate(input);

    assertThat(ids(input)).containsExactly(1L, 2L);
  }

  @Test
  void slice_returns_requested_window() {
    var tasks = List.of(task(1, 1), task(2, 2), task(3, 3), task(4, 4), task(5, 5));

    var page = TaskPagination.slice(tasks, 1, 2);

    assertThat(ids(page.content())).containsExactly(3L, 4L);
    assertThat(page.totalElements()).isEqualTo(5);
    assertThat(page.isLast()).isFalse();
  }

  @Test
  void last_partial_page() {
    var tasks = List.of(task(1, 1), task(2, 2), task(3, 3));

    var page = TaskPagination.slice(tasks, 1, 2);

    assertThat(ids(page.content())).containsExactly(3L);
    assertThat(page.isLast()).isTrue();
  }

  @Test
  void page_past_end_is_empty() {
    var tasks = List.of(task(1, 1), task(2, 2));

    assertThat(TaskPagination.slice(tasks, 1, 2).content()).isEmpty();
    assertThat(TaskPagination.slice(tasks, 5, 10).content()).isEmpty();
  }

  @Test
  void zero_page_size_yields_empty_page() {
    var page = TaskPagination.slice(List.of(task(1, 1)), 0, 0);

    assertThat(page.content()).isEmpty();
    assertThat(page.totalElements()).isEqualTo(1);
    assertThat(page.isLast()).isTrue();
  }

  @Test
  void huge_page_index_does_not_overflow() {
    var page = TaskPagination.slice(List.of(task(1, 1)), Integer.MAX_VALUE, Integer.MAX_VALUE);

    assertThat(page.content()).isEmpty();
    assertThat(page.isLast()).isTrue();
    assertThat(TaskPagination.slice(List.of(), Integer.MAX_VALUE, 10).isLast()).isTrue();
  }

  @Test
  void negative_arguments_rejected() {
    assertThatThrownBy(() -> TaskPagination.slice(List.of(), -1, 10))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> TaskPagination.slice(List.of(), 0, -1))
        .isInstanceOf(InvalidRequestException.class);
  }

  @Test
  void concatenated_pages_reproduce_sorted_list() {
    var random = new Random(42);
    var tasks = new ArrayList<TaskSnapshot>();
    for (long id = 1; id <= 37; id++) {
      tasks.add(task(id, random.nextInt(8)));
    }
    var sorted = TaskPagination.sortByDueDate(tasks);

    for (int size = 1; size <= 10; size++) {
      var concatenated = new ArrayList<TaskSnapshot>();
      for (int page = 0; ; page++) {
        var slice = TaskPagination.slice(sorted, page, size);
        if (slice.content().isEmpty()) {
          break;
        }
        concatenated.addAll(slice.content());
      }
      assertThat(concatenated).as("page size %d", size).containsExactlyElementsOf(sorted);
    }
  }
}
