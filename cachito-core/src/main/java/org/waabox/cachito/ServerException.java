package org.waabox.cachito;

/**
 * Thrown when the remote source answered with an unexpected status or a
 * body that could not be decoded.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ServerException extends FetchException {

  private static final long serialVersionUID = 1L;

  /** The status code reported by the server. */
  private final int statusCode;

  /**
   * Creates a new exception for the given status code.
   *
   * @param message    what was being fetched, never null
   * @param statusCode the status code returned by the server
   */
  public ServerException(final String message, final int statusCode) {
    super(message + " (status: " + statusCode + ")");
    this.statusCode = statusCode;
  }

  /**
   * Creates a new exception for the given status code and cause.
   *
   * @param message    what was being fetched, never null
   * @param statusCode the status code returned by the server
   * @param cause      the underlying cause, never null
   */
  public ServerException(final String message, final int statusCode,
      final Throwable cause) {
    super(message + " (status: " + statusCode + ")", cause);
    this.statusCode = statusCode;
  }

  /**
   * Returns the status code reported by the server.
   *
   * @return the status code
   */
  public int statusCode() {
    return statusCode;
  }
}
