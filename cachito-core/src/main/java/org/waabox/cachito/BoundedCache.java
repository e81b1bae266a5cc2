package org.waabox.cachito;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.ToIntFunction;

/**
 * Holds an entire finite collection in memory, plus a key index filled on
 * demand.
 *
 * <p>The collection is either absent or complete; it is never partially
 * populated. Every {@link #clear()} advances an epoch counter, and writes
 * tagged with an older epoch are rejected. This keeps a fetch that
 * started before an invalidation from repopulating the cache when it
 * completes.
 *
 * <p>Writes are serialized by a lock; reads are lock-free.
 *
 * @param <T> the type of records held in this cache
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class BoundedCache<T> {

  /** Reads the unique key out of a record. */
  private final ToIntFunction<T> keyExtractor;

  /** The full collection, null while absent. */
  private volatile List<T> records;

  /** Records memoized by key. */
  private final Map<Integer, T> recordsByKey;

  /** The lock used to serialize write operations. */
  private final ReentrantLock writeLock;

  /** Advanced on every clear. */
  private volatile long epoch;

  /**
   * Creates a new, empty cache.
   *
   * @param keyExtractor reads the key of a record, never null
   */
  BoundedCache(final ToIntFunction<T> keyExtractor) {
    this.keyExtractor = Objects.requireNonNull(keyExtractor,
        "keyExtractor must not be null");
    this.recordsByKey = new ConcurrentHashMap<>();
    this.writeLock = new ReentrantLock();
  }

  /**
   * Returns the cached collection.
   *
   * @return the collection, or empty if absent
   */
  Optional<List<T>> records() {
    return Optional.ofNullable(records);
  }

  /**
   * Returns the record memoized under the given key.
   *
   * @param key the record key
   *
   * @return the record, or empty if the key was never memoized
   */
  Optional<T> lookup(final int key) {
    return Optional.ofNullable(recordsByKey.get(key));
  }

  /**
   * Scans the cached collection for a record with the given key.
   *
   * @param key the record key
   *
   * @return the record, or empty if the collection is absent or does not
   *         contain the key
   */
  Optional<T> scan(final int key) {
    final List<T> current = records;
    if (current == null) {
      return Optional.empty();
    }
    for (final T record : current) {
      if (keyExtractor.applyAsInt(record) == key) {
        return Optional.of(record);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the current epoch, to be passed back to {@link #store} or
   * {@link #remember} once an asynchronous fetch completes.
   *
   * @return the current epoch
   */
  long epoch() {
    return epoch;
  }

  /**
   * Stores the full collection, unless the cache was cleared since
   * {@code expectedEpoch} was read.
   *
   * @param expectedEpoch the epoch read before the fetch started
   * @param newRecords    the complete collection, never null
   *
   * @return true if the collection was stored
   */
  boolean store(final long expectedEpoch, final List<T> newRecords) {
    Objects.requireNonNull(newRecords, "newRecords must not be null");
    writeLock.lock();
    try {
      if (expectedEpoch != epoch) {
        return false;
      }
      records = List.copyOf(newRecords);
      return true;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Memoizes a record under its key, unless the cache was cleared since
   * {@code expectedEpoch} was read.
   *
   * @param expectedEpoch the epoch read before the lookup started
   * @param key           the record key
   * @param record        the record, never null
   */
  void remember(final long expectedEpoch, final int key, final T record) {
    Objects.requireNonNull(record, "record must not be null");
    writeLock.lock();
    try {
      if (expectedEpoch == epoch) {
        recordsByKey.put(key, record);
      }
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Drops the full collection after a failed fetch, unless the cache was
   * cleared since {@code expectedEpoch} was read. The key index is kept.
   *
   * @param expectedEpoch the epoch read before the fetch started
   */
  void discardRecords(final long expectedEpoch) {
    writeLock.lock();
    try {
      if (expectedEpoch == epoch) {
        records = null;
      }
    } finally {
      writeLock.unlock();
    }
  }

  /** Drops the collection and the key index, and advances the epoch. */
  void clear() {
    writeLock.lock();
    try {
      records = null;
      recordsByKey.clear();
      epoch++;
    } finally {
      writeLock.unlock();
    }
  }
}
