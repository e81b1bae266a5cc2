package org.waabox.cachito;

/**
 * Base exception for failures reported by a fetch port.
 *
 * <p>This is an unchecked exception. Fetchers complete their futures
 * exceptionally with one of its subclasses; repositories propagate it
 * untouched and view models turn it into an error state.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class FetchException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public FetchException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public FetchException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
