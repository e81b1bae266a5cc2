package org.waabox.cachito.view;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.cachito.Fetches;
import org.waabox.cachito.PagedRepository;

/**
 * View model for a dataset loaded page by page, as in an infinite scroll.
 *
 * <p>Transitions: {@code IDLE -> LOADING -> SUCCESS | ERROR},
 * {@code SUCCESS -> LOADING_MORE -> SUCCESS | ERROR}, and back to LOADING
 * on {@link #loadInitial()} or {@link #refresh()}.
 *
 * <p>{@link #loadMore()} is a no-op while a load is in flight or once the
 * repository has no more records; redundant scroll triggers are therefore
 * harmless. A failed {@link #loadMore()} keeps every page loaded before
 * it.
 *
 * @param <T> the type of records shown
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class PagedViewModel<T> extends ObservableViewModel {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PagedViewModel.class);

  /** The default number of records per page. */
  public static final int DEFAULT_PAGE_SIZE = 20;

  /** The data source, shared and read-only from this view model. */
  private final PagedRepository<T> repository;

  /** The number of records requested per page. */
  private final int pageSize;

  /** The records loaded so far, in page order. */
  private volatile List<T> records = List.of();

  /** The index of the next page to request. */
  private volatile int currentPage;

  /**
   * Creates a new view model with {@value #DEFAULT_PAGE_SIZE} records per
   * page.
   *
   * @param theRepository the data source, never null
   */
  public PagedViewModel(final PagedRepository<T> theRepository) {
    this(theRepository, DEFAULT_PAGE_SIZE);
  }

  /**
   * Creates a new view model.
   *
   * @param theRepository the data source, never null
   * @param thePageSize   the records per page, must be greater than zero
   *
   * @throws IllegalArgumentException if thePageSize is not positive
   */
  public PagedViewModel(final PagedRepository<T> theRepository,
      final int thePageSize) {
    repository = Objects.requireNonNull(theRepository,
        "repository must not be null");
    if (thePageSize <= 0) {
      throw new IllegalArgumentException(
          "pageSize must be greater than 0, got: " + thePageSize);
    }
    pageSize = thePageSize;
  }

  /**
   * Discards the shown records and loads the first page.
   *
   * <p>Supersedes any load still in flight.
   *
   * @return a future completing once the outcome has been applied, never
   *         completing exceptionally
   */
  public CompletableFuture<Void> loadInitial() {
    final long generation = nextGeneration();
    currentPage = 0;
    records = List.of();
    transitionTo(ViewState.loading());

    return Fetches.invoke(() -> repository.getPage(0, pageSize))
        .handle((page, error) -> {
          if (!isCurrent(generation)) {
            return null;
          }
          final Throwable failure = error != null ? error
              : page == null ? new IllegalStateException(
                  "Repository completed without a page") : null;
          if (failure != null) {
            final String message = ErrorMessages.describe(failure);
            log.warn("Loading the first page failed: {}", message);
            transitionTo(ViewState.error(message));
          } else {
            records = List.copyOf(page);
            currentPage = 1;
            transitionTo(ViewState.success());
          }
          return null;
        });
  }

  /**
   * Loads the next page and appends it to the shown records.
   *
   * <p>Returns immediately, without any state change or notification, if
   * a load is already in flight or if the repository has no more records.
   * An empty page still ends in SUCCESS.
   *
   * @return a future completing once the outcome has been applied, never
   *         completing exceptionally
   */
  public CompletableFuture<Void> loadMore() {
    final ViewState current = state();
    if (current.is(ViewState.Kind.LOADING_MORE)
        || current.is(ViewState.Kind.LOADING)
        || !repository.hasMore()) {
      return CompletableFuture.completedFuture(null);
    }

    final long generation = currentGeneration();
    final int requestedPage = currentPage;
    transitionTo(ViewState.loadingMore());

    return Fetches.invoke(() -> repository.getPage(requestedPage, pageSize))
        .handle((page, error) -> {
          if (!isCurrent(generation)) {
            return null;
          }
          final Throwable failure = error != null ? error
              : page == null ? new IllegalStateException(
                  "Repository completed without a page") : null;
          if (failure != null) {
            final String message = ErrorMessages.describe(failure);
            log.warn("Loading page {} failed: {}", requestedPage, message);
            transitionTo(ViewState.error(message));
          } else {
            final List<T> merged = new ArrayList<>(records);
            merged.addAll(page);
            records = Collections.unmodifiableList(merged);
            currentPage = requestedPage + 1;
            transitionTo(ViewState.success());
          }
          return null;
        });
  }

  /**
   * Clears the repository's cache and loads the first page again.
   *
   * @return a future completing once the outcome has been applied, never
   *         completing exceptionally
   */
  public CompletableFuture<Void> refresh() {
    repository.clearCache();
    return loadInitial();
  }

  /**
   * Returns the records loaded so far.
   *
   * @return an unmodifiable list, never null
   */
  public List<T> records() {
    return records;
  }

  /**
   * Returns whether the repository can still provide more records.
   *
   * @return true while the dataset is not fully loaded
   */
  public boolean hasMore() {
    return repository.hasMore();
  }

  /**
   * Returns the number of records the repository holds.
   *
   * @return the loaded length, never negative
   */
  public int totalLoaded() {
    return repository.totalLoaded();
  }

  /**
   * Returns the index of the next page {@link #loadMore()} will request.
   *
   * @return the page cursor, never negative
   */
  public int currentPage() {
    return currentPage;
  }

  /**
   * Returns the number of records requested per page.
   *
   * @return the page size, always greater than zero
   */
  public int pageSize() {
    return pageSize;
  }
}
