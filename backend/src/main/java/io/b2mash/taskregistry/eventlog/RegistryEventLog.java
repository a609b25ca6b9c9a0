package io.b2mash.taskregistry.eventlog;

import io.b2mash.taskregistry.config.RegistryProperties;
import io.b2mash.taskregistry.event.RegistryEvent;
import io.b2mash.taskregistry.exception.InvalidRequestException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Bounded, in-memory feed of every notification the registry has emitted. Once {@code capacity}
 * entries are held, the oldest entry is evicted for each new one. Sequence numbers keep counting
 * across evictions.
 */
@Component
public class RegistryEventLog {

  private final int capacity;
  private final Deque<RegistryEventEntry> entries = new ArrayDeque<>();
  private long nextSequence = 1;

  @Autowired
  public RegistryEventLog(RegistryProperties properties) {
    this(properties.eventLogCapacity());
  }

  RegistryEventLog(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be at least 1");
    }
    this.capacity = capacity;
  }

  public synchronized RegistryEventEntry append(RegistryEvent event) {
    var entry =
        new RegistryEventEntry(
            nextSequence++,
            event.eventType(),
            event.taskId(),
            event.actor(),
            event.occurredAt(),
            Collections.unmodifiableMap(new LinkedHashMap<>(event.details())));
    if (entries.size() == capacity) {
      entries.removeFirst();
    }
    entries.addLast(entry);
    return entry;
  }

  /** Returns entries newest first, skipping {@code page * size} of them. */
  public synchronized List<RegistryEventEntry> newestFirst(int page, int size) {
    if (page < 0 || size < 0) {
      throw new InvalidRequestException("page and size must not be negative");
    }
    long skip = (long) page * size;
    var result = new ArrayList<RegistryEventEntry>(Math.min(size, entries.size()));
    Iterator<RegistryEventEntry> it = entries.descendingIterator();
    for (long i = 0; it.hasNext() && result.size() < size; i++) {
      var entry = it.next();
      if (i >= skip) {
        result.add(entry);
      }
    }
    return result;
  }

  public int capacity() {
    return capacity;
  }

  public synchronized int size() {
    return entries.size();
  }
}
