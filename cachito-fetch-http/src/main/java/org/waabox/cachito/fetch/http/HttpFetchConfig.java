package org.waabox.cachito.fetch.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration holder for {@link HttpFetcher}.
 *
 * <p>Holds the base URL of the service, the path of the resource, the
 * names of the query parameters used for paging, and the request timeout.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpFetchConfig {

  /** The default name of the paging offset parameter. */
  private static final String DEFAULT_START_PARAM = "_start";

  /** The default name of the paging size parameter. */
  private static final String DEFAULT_LIMIT_PARAM = "_limit";

  /** The default request timeout. */
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  /** The base URL, without a trailing slash. */
  private final String baseUrl;

  /** The resource path, starting with a slash. */
  private final String path;

  /** The name of the paging offset parameter. */
  private final String startParam;

  /** The name of the paging size parameter. */
  private final String limitParam;

  /** The timeout applied to every request. */
  private final Duration timeout;

  /** Private constructor; use the static factory methods instead. */
  private HttpFetchConfig(final String baseUrl, final String path,
      final String startParam, final String limitParam,
      final Duration timeout) {
    this.baseUrl = stripTrailingSlash(baseUrl);
    this.path = path.startsWith("/") ? path : "/" + path;
    this.startParam = startParam;
    this.limitParam = limitParam;
    this.timeout = timeout;
  }

  /**
   * Creates a new configuration with the default paging parameters
   * ({@value #DEFAULT_START_PARAM}, {@value #DEFAULT_LIMIT_PARAM}) and a
   * 10 second timeout.
   *
   * @param baseUrl the base URL of the service, never null
   * @param path    the resource path, e.g. {@code /users}, never null
   * @return a new {@link HttpFetchConfig} instance, never null
   */
  public static HttpFetchConfig create(final String baseUrl,
      final String path) {
    return create(baseUrl, path, DEFAULT_START_PARAM, DEFAULT_LIMIT_PARAM,
        DEFAULT_TIMEOUT);
  }

  /**
   * Creates a new configuration.
   *
   * @param baseUrl    the base URL of the service, never null
   * @param path       the resource path, never null
   * @param startParam the name of the paging offset parameter, never null
   * @param limitParam the name of the paging size parameter, never null
   * @param timeout    the request timeout, must be positive
   * @return a new {@link HttpFetchConfig} instance, never null
   * @throws IllegalArgumentException if timeout is zero or negative
   */
  public static HttpFetchConfig create(final String baseUrl,
      final String path, final String startParam, final String limitParam,
      final Duration timeout) {
    Objects.requireNonNull(baseUrl, "baseUrl cannot be null");
    Objects.requireNonNull(path, "path cannot be null");
    Objects.requireNonNull(startParam, "startParam cannot be null");
    Objects.requireNonNull(limitParam, "limitParam cannot be null");
    Objects.requireNonNull(timeout, "timeout cannot be null");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException(
          "timeout must be positive, got: " + timeout);
    }
    return new HttpFetchConfig(baseUrl, path, startParam, limitParam,
        timeout);
  }

  /**
   * Returns the base URL, without a trailing slash.
   *
   * @return the base URL, never null
   */
  public String baseUrl() {
    return baseUrl;
  }

  /**
   * Returns the resource path.
   *
   * @return the path, always starting with a slash, never null
   */
  public String path() {
    return path;
  }

  /**
   * Returns the name of the paging offset parameter.
   *
   * @return the parameter name, never null
   */
  public String startParam() {
    return startParam;
  }

  /**
   * Returns the name of the paging size parameter.
   *
   * @return the parameter name, never null
   */
  public String limitParam() {
    return limitParam;
  }

  /**
   * Returns the timeout applied to every request.
   *
   * @return the timeout, never null
   */
  public Duration timeout() {
    return timeout;
  }

  private static String stripTrailingSlash(final String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
