package org.waabox.cachito.fetch.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.cachito.CachedBoundedRepository;
import org.waabox.cachito.CachedPagedRepository;
import org.waabox.cachito.view.CollectionViewModel;
import org.waabox.cachito.view.PagedViewModel;
import org.waabox.cachito.view.RecordViewModel;
import org.waabox.cachito.view.ViewState;

/**
 * Integration tests wiring repositories and view models to
 * {@link HttpFetcher} against a real localhost HTTP server.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HttpRepositoryIntegrationTest {

  /** A photo as served by the test server. */
  public record Photo(int id, String title, String url) {}

  /** A user as served by the test server. */
  public record User(int id, String name, String email) {}

  /** The number of photos the server holds. */
  private static final int PHOTOS = 45;

  private static final List<User> USERS = List.of(
      new User(1, "John Doe", "john@example.com"),
      new User(2, "Jane Smith", "jane@example.com"));

  private final ObjectMapper mapper = new ObjectMapper();

  /** Counts the requests received, by path. */
  private final Map<String, AtomicInteger> requests = new HashMap<>();

  private HttpServer server;

  private String baseUrl;

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/photos", this::servePhotos);
    server.createContext("/users", this::serveUsers);
    server.start();
    baseUrl = "http://localhost:" + server.getAddress().getPort();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  private synchronized void count(final String path) {
    requests.computeIfAbsent(path, p -> new AtomicInteger()).incrementAndGet();
  }

  private synchronized int requestsTo(final String path) {
    final AtomicInteger counter = requests.get(path);
    return counter == null ? 0 : counter.get();
  }

  private void servePhotos(final HttpExchange exchange) throws IOException {
    count(exchange.getRequestURI().getPath());
    final Map<String, Integer> params = new HashMap<>();
    for (final String pair : exchange.getRequestURI().getQuery().split("&")) {
      final String[] parts = pair.split("=");
      params.put(parts[0], Integer.parseInt(parts[1]));
    }
    final int start = params.get("_start");
    final int end = Math.min(start + params.get("_limit"), PHOTOS);
    final List<Photo> page = new ArrayList<>();
    for (int i = start; i < end; i++) {
      page.add(new Photo(i + 1, "photo " + (i + 1),
          "https://example.com/" + (i + 1)));
    }
    reply(exchange, 200, mapper.writeValueAsBytes(page));
  }

  private void serveUsers(final HttpExchange exchange) throws IOException {
    final String path = exchange.getRequestURI().getPath();
    count(path);
    if (path.equals("/users")) {
      reply(exchange, 200, mapper.writeValueAsBytes(USERS));
      return;
    }
    final int key = Integer.parseInt(path.substring("/users/".length()));
    for (final User user : USERS) {
      if (user.id() == key) {
        reply(exchange, 200, mapper.writeValueAsBytes(user));
        return;
      }
    }
    reply(exchange, 404, "{}".getBytes(StandardCharsets.UTF_8));
  }

  private static void reply(final HttpExchange exchange, final int status,
      final byte[] body) throws IOException {
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, body.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(body);
    }
  }

  @Test
  void whenScrolling_givenFortyFivePhotos_shouldStopAfterThirdPage() {
    // Arrange
    final HttpFetcher<Photo> fetcher = new HttpFetcher<>(
        HttpFetchConfig.create(baseUrl, "/photos"), Photo.class);
    final CachedPagedRepository<Photo> repository =
        CachedPagedRepository.of(Photo.class)
            .named("photos")
            .fetchPagesWith(fetcher)
            .capacity(PHOTOS)
            .build();
    final PagedViewModel<Photo> viewModel = new PagedViewModel<>(repository);

    // Act
    viewModel.loadInitial().join();
    viewModel.loadMore().join();
    viewModel.loadMore().join();
    viewModel.loadMore().join();

    // Assert
    assertEquals(ViewState.success(), viewModel.state());
    assertEquals(PHOTOS, viewModel.records().size());
    assertEquals(new Photo(45, "photo 45", "https://example.com/45"),
        viewModel.records().get(44));
    assertFalse(viewModel.hasMore());
    assertEquals(3, requestsTo("/photos"));
  }

  @Test
  void whenBrowsingUsers_givenCollectionLoaded_shouldServeDetailFromCache() {
    // Arrange
    final HttpFetcher<User> fetcher = new HttpFetcher<>(
        HttpFetchConfig.create(baseUrl, "/users"), User.class);
    final CachedBoundedRepository<User> repository =
        CachedBoundedRepository.of(User.class)
            .named("users")
            .keyedBy(User::id)
            .fetchAllWith(fetcher)
            .fetchByKeyWith(fetcher)
            .build();
    final CollectionViewModel<User> list =
        new CollectionViewModel<>(repository, User::name, User::email);
    final RecordViewModel<User> detail = new RecordViewModel<>(repository);

    // Act
    list.load().join();
    detail.load(2).join();

    // Assert
    assertEquals(USERS, list.records());
    assertEquals(List.of(USERS.get(0)), list.search("john"));
    assertEquals(USERS.get(1), detail.record().orElseThrow());
    assertEquals(1, requestsTo("/users"));
    assertEquals(0, requestsTo("/users/2"));
  }

  @Test
  void whenShowingDetail_givenUnknownUser_shouldEnterError() {
    final HttpFetcher<User> fetcher = new HttpFetcher<>(
        HttpFetchConfig.create(baseUrl, "/users"), User.class);
    final CachedBoundedRepository<User> repository =
        CachedBoundedRepository.of(User.class)
            .named("users")
            .keyedBy(User::id)
            .fetchAllWith(fetcher)
            .fetchByKeyWith(fetcher)
            .build();
    final RecordViewModel<User> detail = new RecordViewModel<>(repository);

    detail.load(99).join();

    assertTrue(detail.hasError());
    assertTrue(detail.record().isEmpty());
    assertEquals(1, requestsTo("/users/99"));
  }
}
