package org.waabox.cachito;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Data access for a dataset small enough to be fetched and cached in
 * full.
 *
 * @param <T> the type of records served by this repository
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface BoundedRepository<T> {

  /**
   * Returns the whole collection, fetching it only if it is not cached.
   *
   * <p>If the fetch fails, the cache is left absent and the returned
   * future completes exceptionally with the fetcher's failure.
   *
   * @return a future of the unmodifiable record list, never null
   */
  CompletableFuture<List<T>> getAll();

  /**
   * Returns the record with the given key.
   *
   * <p>Looks in the key index first, then in the cached collection, and
   * only then asks the source. The future completes exceptionally with a
   * {@link RecordNotFoundException} when the source has no such key.
   *
   * @param key the record key
   *
   * @return a future of the record, never null
   */
  CompletableFuture<T> getByKey(int key);

  /** Drops the cached collection and every memoized key. Never fetches. */
  void invalidate();
}
