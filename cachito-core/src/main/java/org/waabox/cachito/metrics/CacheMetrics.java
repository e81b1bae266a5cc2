package org.waabox.cachito.metrics;

/**
 * An abstraction for recording operational metrics of Cachito
 * repositories.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopCacheMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CacheMetrics {

  /**
   * Records a request that was answered from memory without a fetch.
   *
   * @param repositoryName the name of the repository, never null
   */
  void cacheHit(String repositoryName);

  /**
   * Records a request that had to go to the fetch port.
   *
   * @param repositoryName the name of the repository, never null
   */
  void cacheMiss(String repositoryName);

  /**
   * Records a failed fetch.
   *
   * @param repositoryName the name of the repository, never null
   * @param cause          the throwable that caused the failure, never null
   */
  void fetchFailed(String repositoryName, Throwable cause);

  /**
   * Records the number of records added to a cache by a single fetch.
   *
   * @param repositoryName the name of the repository, never null
   * @param count          the number of records stored
   */
  void recordsLoaded(String repositoryName, int count);
}
