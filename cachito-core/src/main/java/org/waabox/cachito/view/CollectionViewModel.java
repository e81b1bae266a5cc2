package org.waabox.cachito.view;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.cachito.BoundedRepository;
import org.waabox.cachito.Fetches;

/**
 * View model for a bounded dataset shown as one list.
 *
 * <p>Transitions: {@code IDLE -> LOADING -> SUCCESS | ERROR}, and
 * {@code SUCCESS | ERROR -> LOADING} on {@link #refresh()}. Each call to
 * {@link #load()} notifies twice: on entering LOADING and on entering the
 * outcome. Failures never escape: the returned futures always complete
 * normally.
 *
 * <pre>{@code
 * CollectionViewModel<User> users = new CollectionViewModel<>(repository,
 *     User::name, User::email);
 * users.subscribe(state -> render(users));
 * users.load();
 * }</pre>
 *
 * @param <T> the type of records shown
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CollectionViewModel<T> extends ObservableViewModel {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CollectionViewModel.class);

  /** The data source, shared and read-only from this view model. */
  private final BoundedRepository<T> repository;

  /** The first text field matched by {@link #search(String)}. */
  private final Function<T, String> primaryText;

  /** The second text field matched by {@link #search(String)}. */
  private final Function<T, String> secondaryText;

  /** The records currently shown. */
  private volatile List<T> records = List.of();

  /**
   * Creates a new view model in the IDLE state.
   *
   * @param theRepository    the data source, never null
   * @param thePrimaryText   the first searchable text field, never null
   * @param theSecondaryText the second searchable text field, never null
   */
  public CollectionViewModel(final BoundedRepository<T> theRepository,
      final Function<T, String> thePrimaryText,
      final Function<T, String> theSecondaryText) {
    repository = Objects.requireNonNull(theRepository,
        "repository must not be null");
    primaryText = Objects.requireNonNull(thePrimaryText,
        "primaryText must not be null");
    secondaryText = Objects.requireNonNull(theSecondaryText,
        "secondaryText must not be null");
  }

  /**
   * Loads the whole collection, from the repository's cache if it holds
   * one.
   *
   * <p>On failure the records are cleared and the state becomes ERROR.
   *
   * @return a future completing once the outcome has been applied, never
   *         completing exceptionally
   */
  public CompletableFuture<Void> load() {
    final long generation = nextGeneration();
    transitionTo(ViewState.loading());

    return Fetches.invoke(repository::getAll)
        .handle((loaded, error) -> {
          if (!isCurrent(generation)) {
            return null;
          }
          final Throwable failure = error != null ? error
              : loaded == null ? new IllegalStateException(
                  "Repository completed without records") : null;
          if (failure != null) {
            final String message = ErrorMessages.describe(failure);
            log.warn("Loading the collection failed: {}", message);
            records = List.of();
            transitionTo(ViewState.error(message));
          } else {
            records = List.copyOf(loaded);
            transitionTo(ViewState.success());
          }
          return null;
        });
  }

  /**
   * Invalidates the repository's cache and loads again, so the source is
   * always queried.
   *
   * @return a future completing once the outcome has been applied, never
   *         completing exceptionally
   */
  public CompletableFuture<Void> refresh() {
    repository.invalidate();
    return load();
  }

  /**
   * Filters the current records with a case-insensitive substring match
   * on the two text fields.
   *
   * <p>Pure: neither changes the state nor notifies. A record whose field
   * is null does not match on that field.
   *
   * @param query the text to look for, never null; empty returns every
   *              current record
   *
   * @return the matching records in their current order, never null
   */
  public List<T> search(final String query) {
    Objects.requireNonNull(query, "query must not be null");
    final List<T> current = records;
    if (query.isEmpty()) {
      return current;
    }
    final String needle = query.toLowerCase(Locale.ROOT);
    return current.stream()
        .filter(record -> contains(primaryText.apply(record), needle)
            || contains(secondaryText.apply(record), needle))
        .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Returns the records currently shown.
   *
   * @return an unmodifiable list, never null
   */
  public List<T> records() {
    return records;
  }

  /**
   * Returns whether there is anything to show. Derived from the records,
   * not from the state.
   *
   * @return true if at least one record is held
   */
  public boolean hasData() {
    return !records.isEmpty();
  }

  private static boolean contains(final String text, final String needle) {
    return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
  }
}
