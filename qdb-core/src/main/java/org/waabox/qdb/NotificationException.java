package org.waabox.qdb;

/**
 * Thrown when the local notification registry and the remote service
 * disagree about the active subscriptions: a notification arrives for a
 * token nobody registered, or a token is unsubscribed that is not known.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NotificationException extends QdbException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public NotificationException(final String message) {
    super(message);
  }
}
