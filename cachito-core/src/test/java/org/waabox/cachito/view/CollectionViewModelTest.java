package org.waabox.cachito.view;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.waabox.cachito.BoundedRepository;
import org.waabox.cachito.CachedBoundedRepository;
import org.waabox.cachito.NetworkException;

/**
 * Tests for {@link CollectionViewModel}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CollectionViewModelTest {

  /** A user domain object used for testing. */
  record User(int id, String name, String email) {}

  private static final User JOHN =
      new User(1, "John Doe", "john@example.com");

  private static final User JANE =
      new User(2, "Jane Smith", "jane@example.com");

  @SuppressWarnings("unchecked")
  private static BoundedRepository<User> repositoryMock() {
    return createMock(BoundedRepository.class);
  }

  private static CollectionViewModel<User> viewModel(
      final BoundedRepository<User> repository) {
    return new CollectionViewModel<>(repository, User::name, User::email);
  }

  @Test
  void whenCreating_shouldBeIdleWithoutData() {
    final CollectionViewModel<User> viewModel = viewModel(repositoryMock());

    assertEquals(ViewState.idle(), viewModel.state());
    assertTrue(viewModel.records().isEmpty());
    assertFalse(viewModel.hasData());
    assertFalse(viewModel.isLoading());
    assertFalse(viewModel.hasError());
  }

  @Test
  void whenLoading_givenRecords_shouldNotifyLoadingThenSuccess() {
    final BoundedRepository<User> repository = repositoryMock();
    expect(repository.getAll())
        .andReturn(CompletableFuture.completedFuture(List.of(JOHN, JANE)));
    replay(repository);

    final CollectionViewModel<User> viewModel = viewModel(repository);
    final List<ViewState> states = new ArrayList<>();
    viewModel.subscribe(states::add);

    viewModel.load().join();

    assertEquals(List.of(ViewState.loading(), ViewState.success()), states);
    assertEquals(List.of(JOHN, JANE), viewModel.records());
    assertTrue(viewModel.hasData());
    assertEquals(Optional.empty(), viewModel.errorMessage());

    verify(repository);
  }

  @Test
  void whenLoading_givenFailure_shouldEnterErrorWithEmptyRecords() {
    final BoundedRepository<User> repository = repositoryMock();
    expect(repository.getAll())
        .andReturn(CompletableFuture.completedFuture(List.of(JOHN)));
    expect(repository.getAll())
        .andReturn(CompletableFuture.failedFuture(
            new NetworkException("connection refused")));
    replay(repository);

    final CollectionViewModel<User> viewModel = viewModel(repository);
    viewModel.load().join();

    final List<ViewState> states = new ArrayList<>();
    viewModel.subscribe(states::add);

    assertDoesNotThrow(() -> viewModel.load().join());

    assertEquals(2, states.size());
    assertEquals(ViewState.Kind.ERROR, states.get(1).kind());
    assertTrue(viewModel.hasError());
    assertEquals(Optional.of("Network error: connection refused"),
        viewModel.errorMessage());
    assertTrue(viewModel.records().isEmpty());
    assertFalse(viewModel.hasData());

    verify(repository);
  }

  @Test
  void whenLoading_givenRepositoryThrowsSynchronously_shouldEnterError() {
    final BoundedRepository<User> repository = repositoryMock();
    expect(repository.getAll()).andThrow(new IllegalStateException("broken"));
    replay(repository);

    final CollectionViewModel<User> viewModel = viewModel(repository);

    viewModel.load().join();

    assertEquals(ViewState.error("broken"), viewModel.state());
    verify(repository);
  }

  @Test
  void whenNotified_givenSuccess_shouldAlreadyExposeNewRecords() {
    final BoundedRepository<User> repository = repositoryMock();
    expect(repository.getAll())
        .andReturn(CompletableFuture.completedFuture(List.of(JOHN, JANE)));
    replay(repository);

    final CollectionViewModel<User> viewModel = viewModel(repository);
    final AtomicInteger seenOnSuccess = new AtomicInteger(-1);
    viewModel.subscribe(state -> {
      if (state.is(ViewState.Kind.SUCCESS)) {
        seenOnSuccess.set(viewModel.records().size());
      }
    });

    viewModel.load().join();

    assertEquals(2, seenOnSuccess.get());
  }

  @Test
  void whenRefreshing_givenCachedData_shouldFetchExactlyOnceMore() {
    final AtomicInteger fetches = new AtomicInteger();
    final CachedBoundedRepository<User> repository =
        CachedBoundedRepository.of(User.class)
            .named("users")
            .keyedBy(User::id)
            .fetchAllWith(() -> {
              fetches.incrementAndGet();
              return CompletableFuture.completedFuture(List.of(JOHN, JANE));
            })
            .build();

    final CollectionViewModel<User> viewModel = viewModel(repository);

    viewModel.load().join();
    viewModel.load().join();
    assertEquals(1, fetches.get());

    viewModel.refresh().join();

    assertEquals(2, fetches.get());
    assertEquals(ViewState.success(), viewModel.state());
    assertEquals(List.of(JOHN, JANE), viewModel.records());
  }

  @Test
  void whenRefreshing_shouldInvalidateBeforeLoading() {
    final BoundedRepository<User> repository = repositoryMock();
    repository.invalidate();
    expectLastCall().once();
    expect(repository.getAll())
        .andReturn(CompletableFuture.completedFuture(List.of(JOHN)));
    replay(repository);

    final CollectionViewModel<User> viewModel = viewModel(repository);

    viewModel.refresh().join();

    assertEquals(List.of(JOHN), viewModel.records());
    verify(repository);
  }

  @Test
  void whenSearching_givenJohn_shouldReturnOnlyJohnDoe() {
    final CollectionViewModel<User> viewModel = loaded();

    assertEquals(List.of(JOHN), viewModel.search("john"));
  }

  @Test
  void whenSearching_givenUpperCaseQuery_shouldIgnoreCase() {
    final CollectionViewModel<User> viewModel = loaded();

    assertEquals(List.of(JANE), viewModel.search("SMITH"));
  }

  @Test
  void whenSearching_givenSecondaryFieldMatch_shouldReturnRecord() {
    final CollectionViewModel<User> viewModel = loaded();

    assertEquals(List.of(JANE), viewModel.search("jane@"));
    assertEquals(List.of(JOHN, JANE), viewModel.search("example.com"));
  }

  @Test
  void whenSearching_givenEmptyQuery_shouldReturnEverything() {
    final CollectionViewModel<User> viewModel = loaded();

    assertSame(viewModel.records(), viewModel.search(""));
  }

  @Test
  void whenSearching_givenNoMatch_shouldReturnEmpty() {
    final CollectionViewModel<User> viewModel = loaded();

    assertTrue(viewModel.search("nobody").isEmpty());
  }

  @Test
  void whenSearching_givenNullField_shouldNotMatchOnIt() {
    final User anonymous = new User(3, "Anonymous", null);
    final BoundedRepository<User> repository = repositoryMock();
    expect(repository.getAll()).andReturn(
        CompletableFuture.completedFuture(List.of(JOHN, anonymous)));
    replay(repository);

    final CollectionViewModel<User> viewModel = viewModel(repository);
    viewModel.load().join();

    assertEquals(List.of(anonymous), viewModel.search("anon"));
  }

  @Test
  void whenSearching_shouldNotNotifyNorChangeState() {
    final CollectionViewModel<User> viewModel = loaded();
    final ViewStateListener listener = createMock(ViewStateListener.class);
    replay(listener);
    viewModel.subscribe(listener);

    viewModel.search("john");

    assertEquals(ViewState.success(), viewModel.state());
    verify(listener);
  }

  @Test
  void whenLoading_givenOlderLoadCompletesLast_shouldKeepNewerResult() {
    final CompletableFuture<List<User>> slow = new CompletableFuture<>();

    final BoundedRepository<User> repository = repositoryMock();
    expect(repository.getAll()).andReturn(slow);
    expect(repository.getAll())
        .andReturn(CompletableFuture.completedFuture(List.of(JANE)));
    replay(repository);

    final CollectionViewModel<User> viewModel = viewModel(repository);
    final CompletableFuture<Void> first = viewModel.load();
    viewModel.load().join();

    final List<ViewState> states = new ArrayList<>();
    viewModel.subscribe(states::add);

    slow.complete(List.of(JOHN));
    first.join();

    assertTrue(states.isEmpty());
    assertEquals(List.of(JANE), viewModel.records());
    assertEquals(ViewState.success(), viewModel.state());
  }

  @Test
  void whenUnsubscribing_givenListener_shouldStopNotifyingIt() {
    final BoundedRepository<User> repository = repositoryMock();
    expect(repository.getAll())
        .andReturn(CompletableFuture.completedFuture(List.of(JOHN)));
    replay(repository);

    final CollectionViewModel<User> viewModel = viewModel(repository);
    final ViewStateListener listener = createMock(ViewStateListener.class);
    replay(listener);

    viewModel.subscribe(listener);
    viewModel.unsubscribe(listener);
    viewModel.load().join();

    verify(listener);
  }

  @Test
  void whenLoading_givenMutableListFromRepository_shouldKeepOwnCopy() {
    final List<User> source = new ArrayList<>(List.of(JOHN, JANE));
    final BoundedRepository<User> repository = repositoryMock();
    expect(repository.getAll())
        .andReturn(CompletableFuture.completedFuture(source));
    replay(repository);

    final CollectionViewModel<User> viewModel = viewModel(repository);
    viewModel.load().join();

    source.clear();

    assertEquals(List.of(JOHN, JANE), viewModel.records());
    assertEquals(List.of(JOHN), viewModel.search("john"));
    verify(repository);
  }

  @Test
  void whenLoading_givenRepositoryCompletesWithNull_shouldEnterError() {
    final BoundedRepository<User> repository = repositoryMock();
    expect(repository.getAll())
        .andReturn(CompletableFuture.completedFuture(null));
    replay(repository);

    final CollectionViewModel<User> viewModel = viewModel(repository);

    assertDoesNotThrow(() -> viewModel.load().join());

    assertTrue(viewModel.hasError());
    assertFalse(viewModel.hasData());
    assertTrue(viewModel.records().isEmpty());
    verify(repository);
  }

  private CollectionViewModel<User> loaded() {
    final BoundedRepository<User> repository = repositoryMock();
    expect(repository.getAll())
        .andReturn(CompletableFuture.completedFuture(List.of(JOHN, JANE)));
    replay(repository);

    final CollectionViewModel<User> viewModel = viewModel(repository);
    viewModel.load().join();
    return viewModel;
  }
}
