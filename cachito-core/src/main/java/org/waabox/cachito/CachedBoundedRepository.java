package org.waabox.cachito;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.ToIntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.cachito.metrics.CacheMetrics;
import org.waabox.cachito.metrics.NoopCacheMetrics;

/**
 * A {@link BoundedRepository} that fetches its collection once and serves
 * every later call from memory until {@link #invalidate()} is called.
 *
 * <p>Concurrent {@link #getAll()} calls issued before the first fetch
 * completes are not deduplicated; each of them goes to the source. Once
 * the collection is cached, no further fetch happens.
 *
 * <p>Instances are created through the fluent builder starting with
 * {@link #of(Class)}:
 * <pre>{@code
 * BoundedRepository<User> users = CachedBoundedRepository.of(User.class)
 *     .named("users")
 *     .keyedBy(User::id)
 *     .fetchAllWith(api::fetchUsers)
 *     .fetchByKeyWith(api::fetchUser)
 *     .build();
 * }</pre>
 *
 * @param <T> the type of records served by this repository
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CachedBoundedRepository<T> implements BoundedRepository<T> {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CachedBoundedRepository.class);

  /** The name of this repository, used in logs and metrics. */
  private final String name;

  /** The cache owned by this repository. */
  private final BoundedCache<T> cache;

  /** Fetches the whole collection. */
  private final CollectionFetcher<T> collectionFetcher;

  /** Fetches single records, null if lookups never reach the source. */
  private final KeyFetcher<T> keyFetcher;

  /** The metrics reporter. */
  private final CacheMetrics metrics;

  /**
   * Creates a new repository.
   *
   * @param name              the repository name, never null
   * @param keyExtractor      reads the key of a record, never null
   * @param collectionFetcher fetches the collection, never null
   * @param keyFetcher        fetches single records, may be null
   * @param metrics           the metrics reporter, never null
   */
  private CachedBoundedRepository(final String name,
      final ToIntFunction<T> keyExtractor,
      final CollectionFetcher<T> collectionFetcher,
      final KeyFetcher<T> keyFetcher,
      final CacheMetrics metrics) {
    this.name = name;
    this.cache = new BoundedCache<>(keyExtractor);
    this.collectionFetcher = collectionFetcher;
    this.keyFetcher = keyFetcher;
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
  public CompletableFuture<List<T>> getAll() {
    final Optional<List<T>> cached = cache.records();
    if (cached.isPresent()) {
      metrics.cacheHit(name);
      log.debug("Repository '{}': serving {} cached records", name,
          cached.get().size());
      return CompletableFuture.completedFuture(cached.get());
    }

    metrics.cacheMiss(name);
    final long epoch = cache.epoch();

    return Fetches.invoke(collectionFetcher::fetchAll)
        .thenApply(records -> {
          Objects.requireNonNull(records,
              "CollectionFetcher.fetchAll() must not complete with null for"
                  + " repository '" + name + "'");
          final List<T> loaded = List.copyOf(records);
          if (cache.store(epoch, loaded)) {
            metrics.recordsLoaded(name, loaded.size());
          } else {
            log.debug("Repository '{}': invalidated while fetching, result"
                + " not cached", name);
          }
          return loaded;
        })
        .whenComplete((records, error) -> {
          if (error != null) {
            final Throwable cause = Fetches.unwrap(error);
            cache.discardRecords(epoch);
            metrics.fetchFailed(name, cause);
            log.warn("Repository '{}': full fetch failed: {}", name,
                cause.getMessage());
          }
        });
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<T> getByKey(final int key) {
    final Optional<T> memoized = cache.lookup(key);
    if (memoized.isPresent()) {
      metrics.cacheHit(name);
      return CompletableFuture.completedFuture(memoized.get());
    }

    final long epoch = cache.epoch();

    final Optional<T> scanned = cache.scan(key);
    if (scanned.isPresent()) {
      metrics.cacheHit(name);
      cache.remember(epoch, key, scanned.get());
      return CompletableFuture.completedFuture(scanned.get());
    }

    metrics.cacheMiss(name);

    if (keyFetcher == null) {
      return CompletableFuture.failedFuture(
          new RecordNotFoundException(name, key));
    }

    return Fetches.invoke(() -> keyFetcher.fetchByKey(key))
        .thenApply(record -> {
          Objects.requireNonNull(record,
              "KeyFetcher.fetchByKey() must not complete with null for"
                  + " repository '" + name + "'");
          cache.remember(epoch, key, record);
          return record;
        })
        .whenComplete((record, error) -> {
          if (error != null) {
            final Throwable cause = Fetches.unwrap(error);
            metrics.fetchFailed(name, cause);
            log.warn("Repository '{}': fetch of key {} failed: {}", name,
                key, cause.getMessage());
          }
        });
  }

  /** {@inheritDoc} */
  @Override
  public void invalidate() {
    cache.clear();
    log.info("Repository '{}': cache invalidated", name);
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
   * Returns whether the full collection is currently cached.
   *
   * @return true if a later {@link #getAll()} is served without a fetch
   */
  public boolean isCached() {
    return cache.records().isPresent();
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
    public KeyStep<T> named(final String name) {
      Objects.requireNonNull(name, "name must not be null");
      if (name.isEmpty()) {
        throw new IllegalArgumentException("name must not be empty");
      }
      return new KeyStep<>(name);
    }
  }

  /**
   * Second step of the builder: collects how to read a record's key.
   *
   * @param <T> the type of records
   */
  public static final class KeyStep<T> {

    /** The repository name. */
    private final String name;

    /**
     * Creates a new KeyStep.
     *
     * @param name the repository name, never null
     */
    private KeyStep(final String name) {
      this.name = name;
    }

    /**
     * Sets the function that reads the unique key of a record.
     *
     * @param keyExtractor the key function, never null
     *
     * @return the next step in the builder chain, never null
     *
     * @throws NullPointerException if keyExtractor is null
     */
    public SourceStep<T> keyedBy(final ToIntFunction<T> keyExtractor) {
      Objects.requireNonNull(keyExtractor, "keyExtractor must not be null");
      return new SourceStep<>(name, keyExtractor);
    }
  }

  /**
   * Third step of the builder: collects the collection fetcher.
   *
   * @param <T> the type of records
   */
  public static final class SourceStep<T> {

    /** The repository name. */
    private final String name;

    /** The key function. */
    private final ToIntFunction<T> keyExtractor;

    /**
     * Creates a new SourceStep.
     *
     * @param name         the repository name, never null
     * @param keyExtractor the key function, never null
     */
    private SourceStep(final String name,
        final ToIntFunction<T> keyExtractor) {
      this.name = name;
      this.keyExtractor = keyExtractor;
    }

    /**
     * Sets the fetcher for the whole collection.
     *
     * @param fetcher the collection fetcher, never null
     *
     * @return the next step in the builder chain, never null
     *
     * @throws NullPointerException if fetcher is null
     */
    public BuildStep<T> fetchAllWith(final CollectionFetcher<T> fetcher) {
      Objects.requireNonNull(fetcher, "fetcher must not be null");
      return new BuildStep<>(name, keyExtractor, fetcher);
    }
  }

  /**
   * Final step of the builder: collects optional configuration and builds
   * the repository.
   *
   * @param <T> the type of records
   */
  public static final class BuildStep<T> {

    /** The repository name. */
    private final String name;

    /** The key function. */
    private final ToIntFunction<T> keyExtractor;

    /** The collection fetcher. */
    private final CollectionFetcher<T> collectionFetcher;

    /** The optional key fetcher. */
    private KeyFetcher<T> keyFetcher;

    /** The metrics reporter. */
    private CacheMetrics metrics = new NoopCacheMetrics();

    /**
     * Creates a new BuildStep.
     *
     * @param name              the repository name, never null
     * @param keyExtractor      the key function, never null
     * @param collectionFetcher the collection fetcher, never null
     */
    private BuildStep(final String name,
        final ToIntFunction<T> keyExtractor,
        final CollectionFetcher<T> collectionFetcher) {
      this.name = name;
      this.keyExtractor = keyExtractor;
      this.collectionFetcher = collectionFetcher;
    }

    /**
     * Sets the fetcher used when a key is found neither in the key index
     * nor in the cached collection.
     *
     * <p>Without it, such lookups fail with
     * {@link RecordNotFoundException}.
     *
     * @param fetcher the key fetcher, never null
     *
     * @return this builder step for chaining, never null
     *
     * @throws NullPointerException if fetcher is null
     */
    public BuildStep<T> fetchByKeyWith(final KeyFetcher<T> fetcher) {
      Objects.requireNonNull(fetcher, "fetcher must not be null");
      this.keyFetcher = fetcher;
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
     * Builds the repository. Its cache starts absent.
     *
     * @return a new repository, never null
     */
    public CachedBoundedRepository<T> build() {
      return new CachedBoundedRepository<>(name, keyExtractor,
          collectionFetcher, keyFetcher, metrics);
    }
  }
}
