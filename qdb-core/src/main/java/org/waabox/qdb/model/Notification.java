package org.waabox.qdb.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A change event delivered by the remote service for an active
 * subscription.
 *
 * @param token    the subscription that fired, never null
 * @param current  the field after the change, never null
 * @param previous the field before the change, never null
 * @param context  the context fields requested by the subscription,
 *                 never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Notification(
    NotificationToken token,
    Field current,
    Field previous,
    List<Field> context
) {

  /**
   * Validates the components and freezes the context list.
   *
   * @param token    the subscription token, never null
   * @param current  the current field, never null
   * @param previous the previous field, never null
   * @param context  the context fields, never null
   */
  public Notification {
    Objects.requireNonNull(token, "token cannot be null");
    Objects.requireNonNull(current, "current cannot be null");
    Objects.requireNonNull(previous, "previous cannot be null");
    Objects.requireNonNull(context, "context cannot be null");
    context = List.copyOf(context);
  }

  /**
   * Creates a deep copy, so each listener can mutate its fields freely.
   *
   * @return a new notification, never null
   */
  public Notification copy() {
    final List<Field> contextCopy = new ArrayList<>(context.size());
    for (final Field field : context) {
      contextCopy.add(field.copy());
    }
    return new Notification(token, current.copy(), previous.copy(),
        contextCopy);
  }
}
