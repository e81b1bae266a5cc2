package org.waabox.cachito;

/**
 * Thrown when the remote source could not be reached or the connection
 * failed before a response was received.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NetworkException extends FetchException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public NetworkException(final String message) {
    super("Network error: " + message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public NetworkException(final String message, final Throwable cause) {
    super("Network error: " + message, cause);
  }
}
