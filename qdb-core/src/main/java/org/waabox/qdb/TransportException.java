package org.waabox.qdb;

/**
 * Thrown when the remote database service cannot be reached, rejects a
 * request, fails to authenticate the client, or answers with a payload
 * that cannot be decoded.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TransportException extends QdbException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public TransportException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public TransportException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
