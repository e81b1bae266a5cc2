package org.waabox.cachito;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Data access for a dataset fetched incrementally, one page at a time.
 *
 * @param <T> the type of records served by this repository
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface PagedRepository<T> {

  /**
   * Returns a page of records.
   *
   * <p>Pages already in memory are served without a fetch. Otherwise the
   * next {@code pageSize} records after the loaded end are fetched and
   * appended, whichever page index was requested, so the cache always
   * grows contiguously. Only fully loaded pages are served from memory:
   * once the whole dataset is loaded, every other page is empty.
   *
   * @param pageIndex the zero-based page index, never negative
   * @param pageSize  the number of records per page, greater than zero
   *
   * @return a future of the page's records, never null
   *
   * @throws IllegalArgumentException if pageSize is not positive or
   *                                  pageIndex is negative
   */
  CompletableFuture<List<T>> getPage(int pageIndex, int pageSize);

  /**
   * Returns whether more records can still be fetched.
   *
   * @return true while fewer records than the dataset's total are loaded
   */
  boolean hasMore();

  /**
   * Returns the number of records loaded so far.
   *
   * @return the loaded length, never negative
   */
  int totalLoaded();

  /** Empties the cache and resets the loaded length to zero. */
  void clearCache();
}
