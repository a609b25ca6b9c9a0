package io.b2mash.taskregistry.task;

import java.util.List;

/**
 * One page of a caller's tasks.
 *
 * @param content tasks on this page, in due-date order
 * @param page zero-based page index that was requested
 * @param size requested page size
 * @param totalElements number of tasks across all pages
 */
public record TaskPage(List<TaskSnapshot> content, int page, int size, int totalElements) {

  public TaskPage {
    content = List.copyOf(content);
  }

  public boolean isLast() {
    return size == 0 || ((long) page + 1) * size >= totalElements;
  }
}
