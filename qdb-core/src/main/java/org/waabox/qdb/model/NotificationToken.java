package org.waabox.qdb.model;

import java.util.Objects;

/**
 * The handle the remote service assigns to one accepted notification
 * subscription.
 *
 * @param value the opaque token text, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record NotificationToken(String value) {

  /**
   * Validates the token text.
   *
   * @param value the token text, never null
   */
  public NotificationToken {
    Objects.requireNonNull(value, "value cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return value;
  }
}
