package org.waabox.cachito;

/**
 * Thrown when a record is requested by key and the source reports that no
 * such key exists.
 *
 * <p>Only the failing key is affected; records cached under other keys
 * remain available.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RecordNotFoundException extends FetchException {

  private static final long serialVersionUID = 1L;

  /** The key that was not found. */
  private final int key;

  /**
   * Creates a new exception indicating that the given key does not exist
   * in the named repository.
   *
   * @param repositoryName the name of the repository, never null
   * @param key            the key that was not found
   */
  public RecordNotFoundException(final String repositoryName,
      final int key) {
    super("Record " + key + " not found in '" + repositoryName + "'");
    this.key = key;
  }

  /**
   * Returns the key that was not found.
   *
   * @return the missing key
   */
  public int key() {
    return key;
  }
}
