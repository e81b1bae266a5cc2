package org.waabox.cachito;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.cachito.metrics.CacheMetrics;
import org.waabox.cachito.metrics.NoopCacheMetrics;

/**
 * A {@link PagedRepository} that builds its cache incrementally.
 *
 * <p>Instances are created through the fluent builder starting with
 * {@link #of(Class)}:
 * <pre>{@code
 * PagedRepository<Photo> photos = CachedPagedRepository.of(Photo.class)
 *     .named("photos")
 *     .fetchPagesWith(api::fetchPhotos)
 *     .capacity(5000)
 *     .build();
 * }</pre>
 *
 * @param <T> the type of records served by this repository
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CachedPagedRepository<T> implements PagedRepository<T> {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CachedPagedRepository.class);

  /** The name of this repository, used in logs and metrics. */
  private final String name;

  /** The cache owned by this repository. */
  private final PagedCache<T> cache;

  /** Fetches pages from the source. */
  private final PageFetcher<T> pageFetcher;

  /** The metrics reporter. */
  private final CacheMetrics metrics;

  /**
   * Creates a new repository.
   *
   * @param name        the repository name, never null
   * @param pageFetcher the page fetcher, never null
   * @param capacity    the total number of records in the dataset
   * @param metrics     the metrics reporter, never null
   */
  private CachedPagedRepository(final String name,
      final PageFetcher<T> pageFetcher, final int capacity,
      final CacheMetrics metrics) {
    this.name = name;
    this.pageFetcher = pageFetcher;
    this.cache = new PagedCache<>(capacity);
    this.metrics = metrics;
  }

  /**
   * Starts the fluent builder for a new repository of the given type.
   *
   * @param type the class of the records, never null
   * @param <T>  the type of records
   *
   * @return the first step of the builder chain, never null
   *
   * @throws NullPointerException if type is null
   */
  public static <T> NameStep<T> of(final Class<T> type) {
    Objects.requireNonNull(type, "type must not be null");
    return new NameStep<>();
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<List<T>> getPage(final int pageIndex,
      final int pageSize) {
    if (pageSize <= 0) {
      throw new IllegalArgumentException(
          "pageSize must be greater than 0, got: " + pageSize);
    }
    if (pageIndex < 0) {
      throw new IllegalArgumentException(
          "pageIndex must not be negative, got: " + pageIndex);
    }

    final long start = (long) pageIndex * pageSize;
    if (start >= cache.capacity()) {
      metrics.cacheHit(name);
      return CompletableFuture.completedFuture(Collections.emptyList());
    }

    if (cache.size() >= start + pageSize) {
      metrics.cacheHit(name);
      log.debug("Repository '{}': serving page {} from cache", name,
          pageIndex);
      return CompletableFuture.completedFuture(
          cache.slice((int) start, pageSize));
    }

    if (!cache.hasMore()) {
      metrics.cacheHit(name);
      log.debug("Repository '{}': all records loaded, page {} is empty",
          name, pageIndex);
      return CompletableFuture.completedFuture(Collections.emptyList());
    }

    metrics.cacheMiss(name);
    final long epoch = cache.epoch();
    final int offset = cache.size();

    return Fetches.invoke(() -> pageFetcher.fetchPage(offset, pageSize))
        .thenApply(page -> {
          Objects.requireNonNull(page,
              "PageFetcher.fetchPage() must not complete with null for"
                  + " repository '" + name + "'");
          final List<T> appended = cache.append(epoch, offset, pageSize,
              page);
          if (appended == null) {
            log.debug("Repository '{}': page at offset {} is stale, not"
                + " cached", name, offset);
            return List.copyOf(page.subList(0,
                Math.min(page.size(), pageSize)));
          }
          metrics.recordsLoaded(name, appended.size());
          if (!cache.hasMore()) {
            log.info("Repository '{}': all {} records loaded", name,
                cache.size());
          }
          return appended;
        })
        .whenComplete((page, error) -> {
          if (error != null) {
            final Throwable cause = Fetches.unwrap(error);
            metrics.fetchFailed(name, cause);
            log.warn("Repository '{}': fetch at offset {} failed: {}", name,
                offset, cause.getMessage());
          }
        });
  }

  /** {@inheritDoc} */
  @Override
  public boolean hasMore() {
    return cache.hasMore();
  }

  /** {@inheritDoc} */
  @Override
  public int totalLoaded() {
    return cache.size();
  }

  /** {@inheritDoc} */
  @Override
  public void clearCache() {
    cache.clear();
    log.info("Repository '{}': cache cleared", name);
  }

  /**
   * Returns the name of this repository.
   *
   * @return the repository name, never null
   */
  public String name() {
    return name;
  }

  /**
   * Returns the current capacity. It equals the configured capacity unless
   * the source ended early.
   *
   * @return the capacity
   */
  public int capacity() {
    return cache.capacity();
  }

  /**
   * First step of the builder: collects the repository name.
   *
   * @param <T> the type of records
   */
  public static final class NameStep<T> {

    /** Creates a new NameStep. */
    private NameStep() {
    }

    /**
     * Sets the name for the repository being built.
     *
     * @param name the repository name, never null or empty
     *
     * @return the next step in the builder chain, never null
     *
     * @throws NullPointerException     if name is null
     * @throws IllegalArgumentException if name is empty
     */
    public SourceStep<T> named(final String name) {
      Objects.requireNonNull(name, "name must not be null");
      if (name.isEmpty()) {
        throw new IllegalArgumentException("name must not be empty");
      }
      return new SourceStep<>(name);
    }
  }

  /**
   * Second step of the builder: collects the page fetcher.
   *
   * @param <T> the type of records
   */
  public static final class SourceStep<T> {

    /** The repository name. */
    private final String name;

    /**
     * Creates a new SourceStep.
     *
     * @param name the repository name, never null
     */
    private SourceStep(final String name) {
      this.name = name;
    }

    /**
     * Sets the fetcher for pages.
     *
     * @param fetcher the page fetcher, never null
     *
     * @return the next step in the builder chain, never null
     *
     * @throws NullPointerException if fetcher is null
     */
    public BuildStep<T> fetchPagesWith(final PageFetcher<T> fetcher) {
      Objects.requireNonNull(fetcher, "fetcher must not be null");
      return new BuildStep<>(name, fetcher);
    }
  }

  /**
   * Final step of the builder: collects the capacity and optional
   * configuration, then builds the repository.
   *
   * @param <T> the type of records
   */
  public static final class BuildStep<T> {

    /** The repository name. */
    private final String name;

    /** The page fetcher. */
    private final PageFetcher<T> pageFetcher;

    /** The total number of records in the dataset, 0 until set. */
    private int capacity;

    /** The metrics reporter. */
    private CacheMetrics metrics = new NoopCacheMetrics();

    /**
     * Creates a new BuildStep.
     *
     * @param name        the repository name, never null
     * @param pageFetcher the page fetcher, never null
     */
    private BuildStep(final String name, final PageFetcher<T> pageFetcher) {
      this.name = name;
      this.pageFetcher = pageFetcher;
    }

    /**
     * Sets the total number of records the source holds, as declared by
     * the server.
     *
     * @param total the capacity, must be greater than zero
     *
     * @return this builder step for chaining, never null
     *
     * @throws IllegalArgumentException if total is not positive
     */
    public BuildStep<T> capacity(final int total) {
      if (total <= 0) {
        throw new IllegalArgumentException(
            "capacity must be greater than 0, got: " + total);
      }
      this.capacity = total;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder step for chaining, never null
     *
     * @throws NullPointerException if theMetrics is null
     */
    public BuildStep<T> metrics(final CacheMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Builds the repository. Its cache starts empty.
     *
     * @return a new repository, never null
     *
     * @throws IllegalStateException if no capacity has been set
     */
    public CachedPagedRepository<T> build() {
      if (capacity == 0) {
        throw new IllegalStateException("capacity must be set");
      }
      return new CachedPagedRepository<>(name, pageFetcher, capacity,
          metrics);
    }
  }
}
