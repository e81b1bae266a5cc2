package org.waabox.cachito;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches a complete, finite collection from a remote source.
 *
 * <p>Used by {@link CachedBoundedRepository} for datasets small enough to
 * be held in memory in full. Partial results are not supported.
 *
 * @param <T> the type of records this fetcher produces
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface CollectionFetcher<T> {

  /**
   * Fetches every record of the collection.
   *
   * <p>The returned future completes with a non-null list (an empty list
   * means the source holds no records), or exceptionally with a
   * {@link NetworkException} or {@link ServerException}.
   *
   * @return a future of the full record list, never null
   */
  CompletableFuture<List<T>> fetchAll();
}
