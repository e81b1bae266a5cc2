package org.waabox.cachito.metrics;

/**
 * A no-operation implementation of {@link CacheMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopCacheMetrics implements CacheMetrics {

  /** {@inheritDoc} */
  @Override
  public void cacheHit(final String repositoryName) {
  }

  /** {@inheritDoc} */
  @Override
  public void cacheMiss(final String repositoryName) {
  }

  /** {@inheritDoc} */
  @Override
  public void fetchFailed(final String repositoryName,
      final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void recordsLoaded(final String repositoryName, final int count) {
  }
}
