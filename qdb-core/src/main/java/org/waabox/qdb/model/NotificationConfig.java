package org.waabox.qdb.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The filter describing which field changes a subscriber is interested in.
 *
 * <p>Two configurations are equal when all their components are equal, so
 * a configuration can be used as a map key to deduplicate subscriptions.
 *
 * <p>A configuration targets either one entity ({@code entityId}) or every
 * entity of a type ({@code entityType}); the unused one is empty.
 *
 * @param entityId       the watched entity id, never null, may be empty
 * @param entityType     the watched entity type, never null, may be empty
 * @param field          the watched field name, never null
 * @param notifyOnChange true to fire only when the value changes, false
 *                       to fire on every write
 * @param context        the names of fields delivered alongside the
 *                       change, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record NotificationConfig(
    String entityId,
    String entityType,
    String field,
    boolean notifyOnChange,
    List<String> context
) {

  /**
   * Validates the components and freezes the context list.
   *
   * @param entityId       the watched entity id, never null
   * @param entityType     the watched entity type, never null
   * @param field          the watched field, never null
   * @param notifyOnChange whether to fire on changes only
   * @param context        the context field names, never null
   */
  public NotificationConfig {
    Objects.requireNonNull(entityId, "entityId cannot be null");
    Objects.requireNonNull(entityType, "entityType cannot be null");
    Objects.requireNonNull(field, "field cannot be null");
    Objects.requireNonNull(context, "context cannot be null");
    if (entityId.isEmpty() && entityType.isEmpty()) {
      throw new IllegalArgumentException(
          "Either entityId or entityType must be set");
    }
    if (field.isBlank()) {
      throw new IllegalArgumentException("field cannot be blank");
    }
    context = List.copyOf(context);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * A fluent builder for {@link NotificationConfig}.
   *
   * <p>Defaults: no entity id, no entity type, notify on change only,
   * no context fields.
   */
  public static final class Builder {

    private String entityId = "";

    private String entityType = "";

    private String field;

    private boolean notifyOnChange = true;

    private final List<String> context = new ArrayList<>();

    private Builder() {
    }

    /**
     * Watches a single entity.
     *
     * @param theEntityId the entity id, never null
     * @return this builder for chaining, never null
     */
    public Builder entityId(final String theEntityId) {
      entityId = Objects.requireNonNull(theEntityId,
          "entityId cannot be null");
      return this;
    }

    /**
     * Watches every entity of a type.
     *
     * @param theEntityType the entity type, never null
     * @return this builder for chaining, never null
     */
    public Builder entityType(final String theEntityType) {
      entityType = Objects.requireNonNull(theEntityType,
          "entityType cannot be null");
      return this;
    }

    /**
     * Sets the watched field.
     *
     * @param theField the field name, never null
     * @return this builder for chaining, never null
     */
    public Builder field(final String theField) {
      field = Objects.requireNonNull(theField, "field cannot be null");
      return this;
    }

    /**
     * Sets whether only value changes fire a notification.
     *
     * @param theNotifyOnChange false to fire on every write
     * @return this builder for chaining, never null
     */
    public Builder notifyOnChange(final boolean theNotifyOnChange) {
      notifyOnChange = theNotifyOnChange;
      return this;
    }

    /**
     * Adds a field delivered alongside every notification.
     *
     * @param fieldName the context field name, never null
     * @return this builder for chaining, never null
     */
    public Builder context(final String fieldName) {
      context.add(Objects.requireNonNull(fieldName,
          "fieldName cannot be null"));
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new configuration, never null
     *
     * @throws NullPointerException     if no field was set
     * @throws IllegalArgumentException if neither entity id nor entity
     *                                  type was set
     */
    public NotificationConfig build() {
      Objects.requireNonNull(field, "field must be set");
      return new NotificationConfig(entityId, entityType, field,
          notifyOnChange, context);
    }
  }
}
