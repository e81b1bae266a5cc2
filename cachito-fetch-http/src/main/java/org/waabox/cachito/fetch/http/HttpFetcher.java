package org.waabox.cachito.fetch.http;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.cachito.CollectionFetcher;
import org.waabox.cachito.FetchException;
import org.waabox.cachito.Fetches;
import org.waabox.cachito.KeyFetcher;
import org.waabox.cachito.NetworkException;
import org.waabox.cachito.PageFetcher;
import org.waabox.cachito.RecordNotFoundException;
import org.waabox.cachito.ServerException;

/**
 * Fetches records from a JSON REST resource.
 *
 * <p>Implements every Cachito fetch port against one resource:
 * <ul>
 *   <li>{@link #fetchAll()}: {@code GET {baseUrl}{path}}, a JSON array.</li>
 *   <li>{@link #fetchByKey(int)}: {@code GET {baseUrl}{path}/{key}}, a
 *       JSON object; 404 means {@link RecordNotFoundException}.</li>
 *   <li>{@link #fetchPage(int, int)}:
 *       {@code GET {baseUrl}{path}?_start={start}&_limit={limit}}.</li>
 * </ul>
 *
 * <p>Any other non-2xx status, or a body that cannot be decoded, fails
 * with {@link ServerException}. A request that gets no response fails with
 * {@link NetworkException}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * HttpFetcher<User> users = new HttpFetcher<>(
 *     HttpFetchConfig.create("https://jsonplaceholder.typicode.com",
 *         "/users"), User.class);
 * BoundedRepository<User> repository = CachedBoundedRepository
 *     .of(User.class)
 *     .named("users")
 *     .keyedBy(User::id)
 *     .fetchAllWith(users)
 *     .fetchByKeyWith(users)
 *     .build();
 * }</pre>
 *
 * @param <T> the type of records decoded from the responses
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpFetcher<T> implements CollectionFetcher<T>, KeyFetcher<T>,
    PageFetcher<T> {

  /** Logger for this class. */
  private static final Logger log = LoggerFactory.getLogger(HttpFetcher.class);

  /** HTTP 404 Not Found status code. */
  private static final int HTTP_NOT_FOUND = 404;

  /** The configuration for this fetcher. */
  private final HttpFetchConfig config;

  /** The HTTP client used for every request. */
  private final HttpClient client;

  /** The JSON mapper. */
  private final ObjectMapper mapper;

  /** The type of a single record. */
  private final JavaType recordType;

  /** The type of a list of records. */
  private final JavaType listType;

  /**
   * Creates a new fetcher with its own HTTP client and a mapper that
   * ignores unknown JSON properties.
   *
   * @param config the configuration, never null
   * @param type   the record class, never null
   */
  public HttpFetcher(final HttpFetchConfig config, final Class<T> type) {
    this(config, type, HttpClient.newBuilder()
        .connectTimeout(Objects.requireNonNull(config,
            "config cannot be null").timeout())
        .build(), defaultMapper());
  }

  /**
   * Creates a new fetcher with the given client and mapper.
   *
   * @param config     the configuration, never null
   * @param type       the record class, never null
   * @param httpClient the HTTP client, never null
   * @param jsonMapper the JSON mapper, never null
   */
  public HttpFetcher(final HttpFetchConfig config, final Class<T> type,
      final HttpClient httpClient, final ObjectMapper jsonMapper) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    Objects.requireNonNull(type, "type cannot be null");
    this.client = Objects.requireNonNull(httpClient,
        "httpClient cannot be null");
    this.mapper = Objects.requireNonNull(jsonMapper,
        "jsonMapper cannot be null");
    this.recordType = mapper.getTypeFactory().constructType(type);
    this.listType = mapper.getTypeFactory()
        .constructCollectionType(List.class, type);
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<List<T>> fetchAll() {
    return get(URI.create(config.baseUrl() + config.path()), listType,
        null);
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<T> fetchByKey(final int key) {
    return get(URI.create(config.baseUrl() + config.path() + "/" + key),
        recordType, () -> new RecordNotFoundException(config.path(), key));
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<List<T>> fetchPage(final int start,
      final int limit) {
    final String query = encode(config.startParam()) + "=" + start
        + "&" + encode(config.limitParam()) + "=" + limit;
    return get(URI.create(config.baseUrl() + config.path() + "?" + query),
        listType, null);
  }

  /**
   * Sends a GET request and decodes the body.
   *
   * @param uri      the request URI, never null
   * @param type     the type to decode the body into, never null
   * @param notFound builds the failure for a 404, null to treat 404 like
   *                 any other error status
   * @param <R>      the decoded type
   * @return a future of the decoded body, never null
   */
  private <R> CompletableFuture<R> get(final URI uri, final JavaType type,
      final Supplier<FetchException> notFound) {
    final HttpRequest request = HttpRequest.newBuilder(uri)
        .timeout(config.timeout())
        .header("Accept", "application/json")
        .GET()
        .build();

    log.debug("GET {}", uri);

    return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
        .handle((response, error) -> {
          if (error != null) {
            final Throwable cause = Fetches.unwrap(error);
            throw new NetworkException(uri + ": " + cause, cause);
          }
          final int status = response.statusCode();
          if (status == HTTP_NOT_FOUND && notFound != null) {
            throw notFound.get();
          }
          if (status < 200 || status >= 300) {
            throw new ServerException("Failed to load " + uri, status);
          }
          return this.<R>decode(uri, status, response.body(), type);
        });
  }

  /**
   * Decodes a response body.
   *
   * @param uri    the request URI, for error messages
   * @param status the response status, for error messages
   * @param body   the response body, never null
   * @param type   the type to decode into, never null
   * @param <R>    the decoded type
   * @return the decoded value
   * @throws ServerException if the body is not valid JSON for the type
   */
  private <R> R decode(final URI uri, final int status, final String body,
      final JavaType type) {
    try {
      return mapper.readValue(body, type);
    } catch (final JsonProcessingException e) {
      throw new ServerException("Malformed response from " + uri, status, e);
    }
  }

  private static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }
}
