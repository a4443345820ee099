package com.github.fsmhub;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Size-bounded, append-only ring of entries. Once the capacity is reached, every append evicts the
 * oldest entry. All methods are synchronized; readers always get a copy.
 */
public final class BoundedHistory<T> {
  private final int capacity;
  private final Deque<T> entries;
  private long totalAppended;

  public BoundedHistory(final int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive, but was: " + capacity);
    }
    this.capacity = capacity;
    this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
  }

  public synchronized void add(final T entry) {
    if (entry == null) {
      return;
    }
    if (entries.size() == capacity) {
      entries.pollFirst();
    }
    entries.addLast(entry);
    totalAppended++;
  }

  public synchronized void addAll(final Collection<? extends T> newEntries) {
    for (final T entry : newEntries) {
      add(entry);
    }
  }

  /**
   * Oldest first.
   */
  public synchronized List<T> toList() {
    return new ArrayList<>(entries);
  }

  public synchronized T newest() {
    return entries.peekLast();
  }

  public synchronized int size() {
    return entries.size();
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Count of every entry ever appended, including evicted ones.
   */
  public synchronized long totalAppended() {
    return totalAppended;
  }

  public synchronized void clear() {
    entries.clear();
  }

  @Override
  public synchronized String toString() {
    return "BoundedHistory [capacity=" + capacity + ", size=" + entries.size() + ", totalAppended="
        + totalAppended + "]";
  }
}
