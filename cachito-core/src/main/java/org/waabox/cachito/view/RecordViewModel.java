package org.waabox.cachito.view;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.cachito.BoundedRepository;
import org.waabox.cachito.Fetches;

/**
 * View model for a single record looked up by key, as in a detail screen.
 *
 * <p>Transitions: {@code IDLE -> LOADING -> SUCCESS | ERROR}, and back to
 * LOADING on every {@link #load(int)}.
 *
 * @param <T> the type of the record shown
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RecordViewModel<T> extends ObservableViewModel {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(RecordViewModel.class);

  /** The data source, shared and read-only from this view model. */
  private final BoundedRepository<T> repository;

  /** The record shown, null if none. */
  private volatile T record;

  /**
   * Creates a new view model in the IDLE state.
   *
   * @param theRepository the data source, never null
   */
  public RecordViewModel(final BoundedRepository<T> theRepository) {
    repository = Objects.requireNonNull(theRepository,
        "repository must not be null");
  }

  /**
   * Loads the record with the given key.
   *
   * <p>On failure the shown record is cleared.
   *
   * @param key the record key
   *
   * @return a future completing once the outcome has been applied, never
   *         completing exceptionally
   */
  public CompletableFuture<Void> load(final int key) {
    final long generation = nextGeneration();
    transitionTo(ViewState.loading());

    return Fetches.invoke(() -> repository.getByKey(key))
        .handle((found, error) -> {
          if (!isCurrent(generation)) {
            return null;
          }
          if (error != null) {
            final String message = ErrorMessages.describe(error);
            log.warn("Loading record {} failed: {}", key, message);
            record = null;
            transitionTo(ViewState.error(message));
          } else {
            record = found;
            transitionTo(ViewState.success());
          }
          return null;
        });
  }

  /**
   * Returns the record shown.
   *
   * @return the record, or empty before a successful load or after a
   *         failed one
   */
  public Optional<T> record() {
    return Optional.ofNullable(record);
  }
}
