package io.b2mash.taskregistry.task;

import io.b2mash.taskregistry.access.Principal;
import io.b2mash.taskregistry.registry.RegistryState;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import org.springframework.stereotype.Service;

/**
 * Read-only views over the task store. Never gated by pause state or role; every result is built
 * from snapshots taken under the registry read lock.
 *
 * <p>Apart from {@link #count()}, the queries walk identifiers {@code 1..taskCounter}, so cleared
 * slots take part with their default values.
 */
@Service
public class TaskQueryService {

  private final RegistryState state;

  public TaskQueryService(RegistryState state) {
    this.state = state;
  }

  public TaskSnapshot getTask(long taskId) {
    return state.read(() -> state.taskStore().requireSlot(taskId).snapshot());
  }

  /** Tasks assigned to {@code caller}, stably sorted by due date, then sliced into a page. */
  public TaskPage listMine(Principal caller, int page, int size) {
    List<TaskSnapshot> mine =
        state.read(
            () ->
                state.taskStore().slots().stream()
                    .filter(task -> task.getAssignedTo().equals(caller))
                    .map(Task::snapshot)
                    .toList());
    return TaskPagination.slice(TaskPagination.sortByDueDate(mine), page, size);
  }

  public List<Long> listByPriority(TaskPriority priority) {
    Objects.requireNonNull(priority, "priority");
    return idsMatching(task -> task.getPriority() == priority);
  }

  public List<Long> listByCompletion(boolean completed) {
    return idsMatching(task -> task.isCompleted() == completed);
  }

  public long countByAssignee(Principal assignee) {
    return state.read(
        () ->
            state.taskStore().slots().stream()
                .filter(task -> task.getAssignedTo().equals(assignee))
                .count());
  }

  /** Every slot from identifier 1 to the highest identifier assigned, cleared slots included. */
  public List<TaskSnapshot> listAll() {
    return state.read(() -> state.taskStore().slots().stream().map(Task::snapshot).toList());
  }

  /** Number of tasks not deleted. */
  public long count() {
    return state.read(() -> state.taskStore().liveCount());
  }

  private List<Long> idsMatching(Predicate<Task> predicate) {
    return state.read(
        () -> {
          var slots = state.taskStore().slots();
          var ids = new ArrayList<Long>();
          for (int i = 0; i < slots.size(); i++) {
            if (predicate.test(slots.get(i))) {
              ids.add(i + 1L);
            }
          }
          return List.copyOf(ids);
        });
  }
}
