package org.waabox.qdb;

/**
 * Base exception for all qdb-related errors.
 *
 * <p>This is an unchecked exception. Callers that need to react to a
 * specific failure catch one of its subclasses: {@link TransportException},
 * {@link FieldTypeException} or {@link NotificationException}.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class QdbException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public QdbException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public QdbException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
