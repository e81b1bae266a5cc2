package org.waabox.cachito;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates records fetched page by page into one contiguous sequence.
 *
 * <p>The sequence only grows between resets and never exceeds the
 * capacity. "More available" holds exactly while the loaded length is
 * below the capacity. A page shorter than requested means the source
 * ended early, so the capacity shrinks to the loaded length;
 * {@link #clear()} restores the declared capacity.
 *
 * <p>Every {@link #clear()} advances an epoch counter. An append is only
 * accepted if the epoch is unchanged and the sequence still ends at the
 * offset the page was fetched from, so late or duplicate pages never
 * leave gaps or repeats.
 *
 * @param <T> the type of records held in this cache
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class PagedCache<T> {

  /** The capacity known for the dataset, restored on every clear. */
  private final int declaredCapacity;

  /** The loaded records, guarded by {@link #writeLock}. */
  private final List<T> records;

  /** The lock guarding every access to {@link #records}. */
  private final ReentrantLock writeLock;

  /** The number of loaded records. */
  private volatile int size;

  /** The current upper bound on {@link #size}. */
  private volatile int capacity;

  /** Advanced on every clear. */
  private volatile long epoch;

  /**
   * Creates a new, empty cache.
   *
   * @param theCapacity the total number of records in the dataset, must
   *                    be greater than zero
   */
  PagedCache(final int theCapacity) {
    if (theCapacity <= 0) {
      throw new IllegalArgumentException(
          "capacity must be greater than 0, got: " + theCapacity);
    }
    this.declaredCapacity = theCapacity;
    this.capacity = theCapacity;
    this.records = new ArrayList<>();
    this.writeLock = new ReentrantLock();
  }

  /**
   * Returns the number of loaded records.
   *
   * @return the loaded length, never negative
   */
  int size() {
    return size;
  }

  /**
   * Returns the current capacity.
   *
   * @return the capacity, never below {@link #size()}
   */
  int capacity() {
    return capacity;
  }

  /**
   * Returns whether more records can still be fetched.
   *
   * @return true while the loaded length is below the capacity
   */
  boolean hasMore() {
    return size < capacity;
  }

  /**
   * Returns the current epoch, to be passed back to {@link #append} once
   * the page fetch completes.
   *
   * @return the current epoch
   */
  long epoch() {
    return epoch;
  }

  /**
   * Copies a window of the loaded records.
   *
   * @param start the offset of the first record, never negative
   * @param count the maximum number of records to copy, never negative
   *
   * @return the records in {@code [start, start + count)} that are loaded,
   *         empty if {@code start} is past the loaded end, never null
   */
  List<T> slice(final int start, final int count) {
    writeLock.lock();
    try {
      if (start >= records.size()) {
        return Collections.emptyList();
      }
      final int end = (int) Math.min((long) start + count, records.size());
      return List.copyOf(records.subList(start, end));
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Appends a fetched page.
   *
   * <p>The page is rejected if the cache was cleared since
   * {@code expectedEpoch} was read, or if the sequence no longer ends at
   * {@code offset}. Records past {@code requested} or past the capacity
   * are dropped.
   *
   * @param expectedEpoch the epoch read before the fetch started
   * @param offset        the offset the page was fetched from
   * @param requested     the number of records that were requested
   * @param page          the fetched records, never null
   *
   * @return the records actually appended, or null if the page was
   *         rejected
   */
  List<T> append(final long expectedEpoch, final int offset,
      final int requested, final List<T> page) {
    Objects.requireNonNull(page, "page must not be null");
    writeLock.lock();
    try {
      if (expectedEpoch != epoch || offset != records.size()) {
        return null;
      }
      final int room = capacity - records.size();
      final int accepted = Math.min(page.size(), Math.min(requested, room));
      final List<T> appended = List.copyOf(page.subList(0, accepted));
      records.addAll(appended);
      size = records.size();
      if (page.size() < requested && size < capacity) {
        capacity = size;
      }
      return appended;
    } finally {
      writeLock.unlock();
    }
  }

  /** Empties the cache, restores the declared capacity and advances the
   * epoch. */
  void clear() {
    writeLock.lock();
    try {
      records.clear();
      size = 0;
      capacity = declaredCapacity;
      epoch++;
    } finally {
      writeLock.unlock();
    }
  }
}
