package org.waabox.cachito;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches a contiguous window of records from a remote source.
 *
 * <p>Used by {@link CachedPagedRepository} to grow its cache page by page.
 *
 * @param <T> the type of records this fetcher produces
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface PageFetcher<T> {

  /**
   * Fetches up to {@code limit} records starting at offset {@code start}.
   *
   * <p>Fewer than {@code limit} records are only returned at or near the
   * end of the source's collection.
   *
   * @param start the zero-based offset of the first record
   * @param limit the maximum number of records to return
   *
   * @return a future of the fetched records, never null
   */
  CompletableFuture<List<T>> fetchPage(int start, int limit);
}
