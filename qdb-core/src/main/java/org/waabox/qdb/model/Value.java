package org.waabox.qdb.model;

import java.time.Instant;
import java.util.Objects;

import org.waabox.qdb.FieldTypeException;

/**
 * A tagged value held by a {@link Field}.
 *
 * <p>A value always holds exactly one {@link ValueType variant}. Reading it
 * as another variant, or updating it in place with content of another
 * variant, fails with a {@link FieldTypeException}; nothing is ever
 * coerced. The {@code set*} methods replace both variant and content.
 *
 * <p>Instances are mutable and not thread-safe. Use {@link #copy()} to hand
 * a value to another owner.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Value {

  /** The held variant, never null. */
  private ValueType type;

  /** The held content, null only for {@link ValueType#UNSPECIFIED}. */
  private Object content;

  /**
   * Creates a value with the given variant and content.
   *
   * @param theType    the variant, never null
   * @param theContent the content matching the variant
   */
  private Value(final ValueType theType, final Object theContent) {
    type = theType;
    content = theContent;
  }

  /**
   * Creates an unspecified value.
   *
   * @return a new unspecified value, never null
   */
  public static Value unspecified() {
    return new Value(ValueType.UNSPECIFIED, null);
  }

  /**
   * Creates a string value.
   *
   * @param value the content, never null
   * @return a new value, never null
   */
  public static Value ofString(final String value) {
    return new Value(ValueType.STRING, requireContent(value));
  }

  /**
   * Creates an integer value.
   *
   * @param value the content
   * @return a new value, never null
   */
  public static Value ofInteger(final long value) {
    return new Value(ValueType.INTEGER, value);
  }

  /**
   * Creates a float value.
   *
   * @param value the content
   * @return a new value, never null
   */
  public static Value ofFloat(final double value) {
    return new Value(ValueType.FLOAT, value);
  }

  /**
   * Creates a boolean value.
   *
   * @param value the content
   * @return a new value, never null
   */
  public static Value ofBoolean(final boolean value) {
    return new Value(ValueType.BOOLEAN, value);
  }

  /**
   * Creates an entity reference value.
   *
   * @param entityId the referenced entity id, never null
   * @return a new value, never null
   */
  public static Value ofEntityReference(final String entityId) {
    return new Value(ValueType.ENTITY_REFERENCE, requireContent(entityId));
  }

  /**
   * Creates a timestamp value.
   *
   * @param value the content, never null
   * @return a new value, never null
   */
  public static Value ofTimestamp(final Instant value) {
    return new Value(ValueType.TIMESTAMP, requireContent(value));
  }

  /**
   * Creates a connection state value.
   *
   * @param value the state name, never null
   * @return a new value, never null
   */
  public static Value ofConnectionState(final String value) {
    return new Value(ValueType.CONNECTION_STATE, requireContent(value));
  }

  /**
   * Creates a garage door state value.
   *
   * @param value the state name, never null
   * @return a new value, never null
   */
  public static Value ofGarageDoorState(final String value) {
    return new Value(ValueType.GARAGE_DOOR_STATE, requireContent(value));
  }

  /**
   * Returns the variant this value holds.
   *
   * @return the variant, never null
   */
  public ValueType type() {
    return type;
  }

  /** @return true if no variant has been assigned. */
  public boolean isUnspecified() {
    return type == ValueType.UNSPECIFIED;
  }

  /** @return true if this value holds a string. */
  public boolean isString() {
    return type == ValueType.STRING;
  }

  /** @return true if this value holds an integer. */
  public boolean isInteger() {
    return type == ValueType.INTEGER;
  }

  /** @return true if this value holds a float. */
  public boolean isFloat() {
    return type == ValueType.FLOAT;
  }

  /** @return true if this value holds a boolean. */
  public boolean isBoolean() {
    return type == ValueType.BOOLEAN;
  }

  /** @return true if this value holds an entity reference. */
  public boolean isEntityReference() {
    return type == ValueType.ENTITY_REFERENCE;
  }

  /** @return true if this value holds a timestamp. */
  public boolean isTimestamp() {
    return type == ValueType.TIMESTAMP;
  }

  /** @return true if this value holds a connection state. */
  public boolean isConnectionState() {
    return type == ValueType.CONNECTION_STATE;
  }

  /** @return true if this value holds a garage door state. */
  public boolean isGarageDoorState() {
    return type == ValueType.GARAGE_DOOR_STATE;
  }

  /**
   * Reads this value as a string.
   *
   * @return the content, never null
   * @throws FieldTypeException if the value is not a string
   */
  public String asString() {
    return (String) require(ValueType.STRING);
  }

  /**
   * Reads this value as an integer.
   *
   * @return the content
   * @throws FieldTypeException if the value is not an integer
   */
  public long asInteger() {
    return (Long) require(ValueType.INTEGER);
  }

  /**
   * Reads this value as a float.
   *
   * @return the content
   * @throws FieldTypeException if the value is not a float
   */
  public double asFloat() {
    return (Double) require(ValueType.FLOAT);
  }

  /**
   * Reads this value as a boolean.
   *
   * @return the content
   * @throws FieldTypeException if the value is not a boolean
   */
  public boolean asBoolean() {
    return (Boolean) require(ValueType.BOOLEAN);
  }

  /**
   * Reads this value as an entity reference.
   *
   * @return the referenced entity id, never null
   * @throws FieldTypeException if the value is not an entity reference
   */
  public String asEntityReference() {
    return (String) require(ValueType.ENTITY_REFERENCE);
  }

  /**
   * Reads this value as a timestamp.
   *
   * @return the content, never null
   * @throws FieldTypeException if the value is not a timestamp
   */
  public Instant asTimestamp() {
    return (Instant) require(ValueType.TIMESTAMP);
  }

  /**
   * Reads this value as a connection state.
   *
   * @return the state name, never null
   * @throws FieldTypeException if the value is not a connection state
   */
  public String asConnectionState() {
    return (String) require(ValueType.CONNECTION_STATE);
  }

  /**
   * Reads this value as a garage door state.
   *
   * @return the state name, never null
   * @throws FieldTypeException if the value is not a garage door state
   */
  public String asGarageDoorState() {
    return (String) require(ValueType.GARAGE_DOOR_STATE);
  }

  /**
   * Updates the content of a string value.
   *
   * @param value the new content, never null
   * @throws FieldTypeException if the value is not a string
   */
  public void updateString(final String value) {
    update(ValueType.STRING, requireContent(value));
  }

  /**
   * Updates the content of an integer value.
   *
   * @param value the new content
   * @throws FieldTypeException if the value is not an integer
   */
  public void updateInteger(final long value) {
    update(ValueType.INTEGER, value);
  }

  /**
   * Updates the content of a float value.
   *
   * @param value the new content
   * @throws FieldTypeException if the value is not a float
   */
  public void updateFloat(final double value) {
    update(ValueType.FLOAT, value);
  }

  /**
   * Updates the content of a boolean value.
   *
   * @param value the new content
   * @throws FieldTypeException if the value is not a boolean
   */
  public void updateBoolean(final boolean value) {
    update(ValueType.BOOLEAN, value);
  }

  /**
   * Updates the content of an entity reference value.
   *
   * @param entityId the new referenced entity id, never null
   * @throws FieldTypeException if the value is not an entity reference
   */
  public void updateEntityReference(final String entityId) {
    update(ValueType.ENTITY_REFERENCE, requireContent(entityId));
  }

  /**
   * Updates the content of a timestamp value.
   *
   * @param value the new content, never null
   * @throws FieldTypeException if the value is not a timestamp
   */
  public void updateTimestamp(final Instant value) {
    update(ValueType.TIMESTAMP, requireContent(value));
  }

  /**
   * Updates the content of a connection state value.
   *
   * @param value the new state name, never null
   * @throws FieldTypeException if the value is not a connection state
   */
  public void updateConnectionState(final String value) {
    update(ValueType.CONNECTION_STATE, requireContent(value));
  }

  /**
   * Updates the content of a garage door state value.
   *
   * @param value the new state name, never null
   * @throws FieldTypeException if the value is not a garage door state
   */
  public void updateGarageDoorState(final String value) {
    update(ValueType.GARAGE_DOOR_STATE, requireContent(value));
  }

  /** @param value the new string content, never null. */
  public void setString(final String value) {
    assign(ValueType.STRING, requireContent(value));
  }

  /** @param value the new integer content. */
  public void setInteger(final long value) {
    assign(ValueType.INTEGER, value);
  }

  /** @param value the new float content. */
  public void setFloat(final double value) {
    assign(ValueType.FLOAT, value);
  }

  /** @param value the new boolean content. */
  public void setBoolean(final boolean value) {
    assign(ValueType.BOOLEAN, value);
  }

  /** @param entityId the new referenced entity id, never null. */
  public void setEntityReference(final String entityId) {
    assign(ValueType.ENTITY_REFERENCE, requireContent(entityId));
  }

  /** @param value the new timestamp content, never null. */
  public void setTimestamp(final Instant value) {
    assign(ValueType.TIMESTAMP, requireContent(value));
  }

  /** @param value the new connection state, never null. */
  public void setConnectionState(final String value) {
    assign(ValueType.CONNECTION_STATE, requireContent(value));
  }

  /** @param value the new garage door state, never null. */
  public void setGarageDoorState(final String value) {
    assign(ValueType.GARAGE_DOOR_STATE, requireContent(value));
  }

  /** Resets this value to {@link ValueType#UNSPECIFIED}. */
  public void setUnspecified() {
    assign(ValueType.UNSPECIFIED, null);
  }

  /**
   * Creates an independent copy of this value.
   *
   * <p>All supported contents are immutable, so a shallow copy suffices.
   *
   * @return a new value with the same variant and content, never null
   */
  public Value copy() {
    return new Value(type, content);
  }

  /**
   * Returns the raw content, for codecs that need to switch on the
   * variant.
   *
   * @return the content, null for unspecified values
   */
  public Object content() {
    return content;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Value)) {
      return false;
    }
    final Value that = (Value) other;
    return type == that.type && Objects.equals(content, that.content);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(type, content);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return type == ValueType.UNSPECIFIED
        ? "Value{unspecified}"
        : "Value{" + type + "=" + content + "}";
  }

  private Object require(final ValueType expected) {
    if (type != expected) {
      throw new FieldTypeException(expected, type);
    }
    return content;
  }

  private void update(final ValueType expected, final Object newContent) {
    require(expected);
    content = newContent;
  }

  private void assign(final ValueType newType, final Object newContent) {
    type = newType;
    content = newContent;
  }

  private static <T> T requireContent(final T value) {
    return Objects.requireNonNull(value, "value cannot be null");
  }
}
