package org.waabox.cachito;

import java.util.concurrent.CompletableFuture;

/**
 * Fetches a single record by its integer key.
 *
 * @param <T> the type of records this fetcher produces
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface KeyFetcher<T> {

  /**
   * Fetches the record identified by the given key.
   *
   * <p>The returned future completes exceptionally with a
   * {@link RecordNotFoundException} when the source has no such key, or
   * with a {@link NetworkException} or {@link ServerException}.
   *
   * @param key the record key
   *
   * @return a future of the record, never null
   */
  CompletableFuture<T> fetchByKey(int key);
}
