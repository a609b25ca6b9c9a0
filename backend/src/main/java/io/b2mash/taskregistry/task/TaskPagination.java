package io.b2mash.taskregistry.task;

import io.b2mash.taskregistry.exception.InvalidRequestException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Due-date ordering and slicing used by the per-caller task listing. */
public final class TaskPagination {

  private static final Comparator<TaskSnapshot> BY_DUE_DATE =
      Comparator.comparingLong(TaskSnapshot::dueDate);

  private TaskPagination() {}

  /**
   * Returns a copy of {@code tasks} sorted by ascending due date. The sort is stable: tasks with
   * equal due dates keep their relative input order.
   */
  public static List<TaskSnapshot> sortByDueDate(List<TaskSnapshot> tasks) {
    var sorted = new ArrayList<>(tasks);
    sorted.sort(BY_DUE_DATE);
    return sorted;
  }

  /**
   * Returns the slice {@code [page*size, min((page+1)*size, total))} of {@code sorted}. A page
   * starting at or beyond the end, or a size of 0, yields an empty page.
   */
  public static TaskPage slice(List<TaskSnapshot> sorted, int page, int size) {
    if (page < 0) {
      throw new InvalidRequestException("page must not be negative");
    }
    if (size < 0) {
      throw new InvalidRequestException("size must not be negative");
    }
    int total = sorted.size();
    long from = (long) page * size;
    if (size == 0 || from >= total) {
      return new TaskPage(List.of(), page, size, total);
    }
    int to = (int) Math.min(from + size, total);
    return new TaskPage(sorted.subList((int) from, to), page, size, total);
  }
}
