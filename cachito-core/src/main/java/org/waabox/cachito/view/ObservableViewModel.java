package org.waabox.cachito.view;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for view models: owns the {@link ViewState}, the subscriber
 * list and the generation counter used to discard superseded results.
 *
 * <p>A view model is driven by a single UI context that calls its public
 * methods one at a time. Results may complete on a fetcher thread, so the
 * state is kept in volatile fields.
 *
 * <p>Every operation that restarts loading takes a new generation. A
 * result whose generation is no longer current is dropped without any
 * state change or notification.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public abstract class ObservableViewModel {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ObservableViewModel.class);

  /** The registered listeners. */
  private final List<ViewStateListener> listeners =
      new CopyOnWriteArrayList<>();

  /** The generation of the operation whose result is expected. */
  private final AtomicLong generation = new AtomicLong(0);

  /** The current state. */
  private volatile ViewState state = ViewState.idle();

  /**
   * Registers a listener for every later transition.
   *
   * @param listener the listener, never null
   *
   * @throws NullPointerException if listener is null
   */
  public void subscribe(final ViewStateListener listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    listeners.add(listener);
  }

  /**
   * Removes a listener. Unknown listeners are ignored.
   *
   * @param listener the listener, never null
   *
   * @throws NullPointerException if listener is null
   */
  public void unsubscribe(final ViewStateListener listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    listeners.remove(listener);
  }

  /**
   * Returns the current state.
   *
   * @return the state, never null
   */
  public ViewState state() {
    return state;
  }

  /**
   * Returns the message of the last failure, while in the error state.
   *
   * @return the message, or empty if not in the error state
   */
  public Optional<String> errorMessage() {
    return Optional.ofNullable(state.errorMessage());
  }

  /** @return true while a first or fresh load is in flight */
  public boolean isLoading() {
    return state.is(ViewState.Kind.LOADING);
  }

  /** @return true if the last request failed */
  public boolean hasError() {
    return state.is(ViewState.Kind.ERROR);
  }

  /**
   * Enters a new state and notifies every listener once.
   *
   * <p>Subclasses update their own fields before calling this method. A
   * listener that throws is logged and skipped.
   *
   * @param newState the state to enter, never null
   */
  protected final void transitionTo(final ViewState newState) {
    Objects.requireNonNull(newState, "newState must not be null");
    state = newState;
    for (final ViewStateListener listener : listeners) {
      try {
        listener.onStateChanged(newState);
      } catch (final RuntimeException e) {
        log.warn("{}: listener failed on transition to {}",
            getClass().getSimpleName(), newState.kind(), e);
      }
    }
  }

  /**
   * Starts a new generation, superseding any result still in flight.
   *
   * @return the new generation
   */
  protected final long nextGeneration() {
    return generation.incrementAndGet();
  }

  /**
   * Returns the current generation without advancing it.
   *
   * @return the current generation
   */
  protected final long currentGeneration() {
    return generation.get();
  }

  /**
   * Checks whether a result tagged with the given generation may still be
   * applied.
   *
   * @param tag the generation the operation started with
   *
   * @return true if no newer operation has started since
   */
  protected final boolean isCurrent(final long tag) {
    final boolean current = generation.get() == tag;
    if (!current) {
      log.debug("{}: dropping result of superseded generation {}",
          getClass().getSimpleName(), tag);
    }
    return current;
  }
}
