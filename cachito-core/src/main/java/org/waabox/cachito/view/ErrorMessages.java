package org.waabox.cachito.view;

import java.util.Objects;

import org.waabox.cachito.Fetches;

/**
 * Turns failures into messages a user can read.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ErrorMessages {

  /** Private constructor to prevent instantiation. */
  private ErrorMessages() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Describes a failure, looking through asynchronous wrappers.
   *
   * @param error the failure, never null
   *
   * @return the cause's message, or its type name if it has none, never
   *         null
   */
  public static String describe(final Throwable error) {
    Objects.requireNonNull(error, "error must not be null");
    final Throwable cause = Fetches.unwrap(error);
    final String message = cause.getMessage();
    if (message == null || message.isBlank()) {
      return cause.getClass().getSimpleName();
    }
    return message;
  }
}
