package org.waabox.cachito.view;

import java.util.Objects;

/**
 * The observable state of a view model.
 *
 * <p>Exactly one {@link Kind} is active at a time. The error message is
 * only present for {@link Kind#ERROR}.
 *
 * @param kind         the active state, never null
 * @param errorMessage the human-readable failure, non-null only for
 *                     {@link Kind#ERROR}
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ViewState(Kind kind, String errorMessage) {

  /** The states a view model can be in. */
  public enum Kind {
    /** Nothing requested yet. */
    IDLE,
    /** A first or fresh load is in flight. */
    LOADING,
    /** An additional page is in flight; loaded records stay visible. */
    LOADING_MORE,
    /** The last request completed. */
    SUCCESS,
    /** The last request failed. */
    ERROR
  }

  private static final ViewState IDLE = new ViewState(Kind.IDLE, null);

  private static final ViewState LOADING = new ViewState(Kind.LOADING, null);

  private static final ViewState LOADING_MORE =
      new ViewState(Kind.LOADING_MORE, null);

  private static final ViewState SUCCESS = new ViewState(Kind.SUCCESS, null);

  /**
   * Validates the state.
   *
   * @throws NullPointerException     if kind is null, or if kind is ERROR
   *                                  and errorMessage is null
   * @throws IllegalArgumentException if errorMessage is set for a kind
   *                                  other than ERROR
   */
  public ViewState {
    Objects.requireNonNull(kind, "kind must not be null");
    if (kind == Kind.ERROR) {
      Objects.requireNonNull(errorMessage, "errorMessage must not be null");
    } else if (errorMessage != null) {
      throw new IllegalArgumentException(
          "errorMessage is only allowed for ERROR, got: " + kind);
    }
  }

  /** @return the idle state, never null */
  public static ViewState idle() {
    return IDLE;
  }

  /** @return the loading state, never null */
  public static ViewState loading() {
    return LOADING;
  }

  /** @return the loading-more state, never null */
  public static ViewState loadingMore() {
    return LOADING_MORE;
  }

  /** @return the success state, never null */
  public static ViewState success() {
    return SUCCESS;
  }

  /**
   * Creates an error state.
   *
   * @param message the human-readable failure, never null
   *
   * @return a new error state, never null
   */
  public static ViewState error(final String message) {
    return new ViewState(Kind.ERROR, message);
  }

  /**
   * Checks whether this state is of the given kind.
   *
   * @param other the kind to compare against, never null
   *
   * @return true if this state's kind is {@code other}
   */
  public boolean is(final Kind other) {
    return kind == other;
  }
}
