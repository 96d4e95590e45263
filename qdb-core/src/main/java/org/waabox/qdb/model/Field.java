package org.waabox.qdb.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A named, timestamped value attached to an entity.
 *
 * <p>A field is addressed by its entity id and name. Its value, write time
 * and writer are filled in by a read, by a notification, or set by the
 * caller before a write.
 *
 * <p>Instances are mutable and not thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Field {

  /** The owning entity id, never null. */
  private String entityId;

  /** The field name, never null. */
  private String name;

  /** The field value, never null. */
  private Value value;

  /** When the value was last written, never null. */
  private Instant writeTime;

  /** Who last wrote the value, never null, may be empty. */
  private String writerId;

  /**
   * Creates a field with all its attributes.
   *
   * @param theEntityId  the owning entity id, never null
   * @param theName      the field name, never null
   * @param theValue     the value, never null
   * @param theWriteTime the last write time, never null
   * @param theWriterId  the last writer, never null
   */
  public Field(final String theEntityId, final String theName,
      final Value theValue, final Instant theWriteTime,
      final String theWriterId) {
    entityId = Objects.requireNonNull(theEntityId, "entityId cannot be null");
    name = Objects.requireNonNull(theName, "name cannot be null");
    value = Objects.requireNonNull(theValue, "value cannot be null");
    writeTime = Objects.requireNonNull(theWriteTime,
        "writeTime cannot be null");
    writerId = Objects.requireNonNull(theWriterId, "writerId cannot be null");
  }

  /**
   * Creates a field with an unspecified value, ready to be read.
   *
   * @param entityId the owning entity id, never null
   * @param name     the field name, never null
   *
   * @return a new field, never null
   */
  public static Field of(final String entityId, final String name) {
    return new Field(entityId, name, Value.unspecified(), Instant.now(), "");
  }

  /**
   * Creates a field holding the given value, ready to be written.
   *
   * @param entityId the owning entity id, never null
   * @param name     the field name, never null
   * @param value    the value, never null
   *
   * @return a new field, never null
   */
  public static Field of(final String entityId, final String name,
      final Value value) {
    return new Field(entityId, name, value, Instant.now(), "");
  }

  public String entityId() {
    return entityId;
  }

  public String name() {
    return name;
  }

  /**
   * Returns the live value of this field.
   *
   * <p>Mutating the returned value mutates this field.
   *
   * @return the value, never null
   */
  public Value value() {
    return value;
  }

  public Instant writeTime() {
    return writeTime;
  }

  public String writerId() {
    return writerId;
  }

  public void updateEntityId(final String theEntityId) {
    entityId = Objects.requireNonNull(theEntityId, "entityId cannot be null");
  }

  public void updateName(final String theName) {
    name = Objects.requireNonNull(theName, "name cannot be null");
  }

  public void updateValue(final Value theValue) {
    value = Objects.requireNonNull(theValue, "value cannot be null");
  }

  public void updateWriteTime(final Instant theWriteTime) {
    writeTime = Objects.requireNonNull(theWriteTime,
        "writeTime cannot be null");
  }

  public void updateWriterId(final String theWriterId) {
    writerId = Objects.requireNonNull(theWriterId, "writerId cannot be null");
  }

  /**
   * Replaces the value with a string.
   *
   * @param content the string, never null
   * @return this field for chaining, never null
   */
  public Field setStringValue(final String content) {
    value = Value.ofString(content);
    return this;
  }

  /**
   * Replaces the value with an integer.
   *
   * @param content the integer
   * @return this field for chaining, never null
   */
  public Field setIntegerValue(final long content) {
    value = Value.ofInteger(content);
    return this;
  }

  /**
   * Replaces the value with a float.
   *
   * @param content the float
   * @return this field for chaining, never null
   */
  public Field setFloatValue(final double content) {
    value = Value.ofFloat(content);
    return this;
  }

  /**
   * Replaces the value with a boolean.
   *
   * @param content the boolean
   * @return this field for chaining, never null
   */
  public Field setBooleanValue(final boolean content) {
    value = Value.ofBoolean(content);
    return this;
  }

  /**
   * Replaces the value with an entity reference.
   *
   * @param entityReference the referenced entity id, never null
   * @return this field for chaining, never null
   */
  public Field setEntityReferenceValue(final String entityReference) {
    value = Value.ofEntityReference(entityReference);
    return this;
  }

  /**
   * Replaces the value with a timestamp.
   *
   * @param content the timestamp, never null
   * @return this field for chaining, never null
   */
  public Field setTimestampValue(final Instant content) {
    value = Value.ofTimestamp(content);
    return this;
  }

  /**
   * Replaces the value with a connection state.
   *
   * @param content the state, never null
   * @return this field for chaining, never null
   */
  public Field setConnectionStateValue(final String content) {
    value = Value.ofConnectionState(content);
    return this;
  }

  /**
   * Replaces the value with a garage door state.
   *
   * @param content the state, never null
   * @return this field for chaining, never null
   */
  public Field setGarageDoorStateValue(final String content) {
    value = Value.ofGarageDoorState(content);
    return this;
  }

  /**
   * Clears the value.
   *
   * @return this field for chaining, never null
   */
  public Field setUnspecifiedValue() {
    value = Value.unspecified();
    return this;
  }

  /**
   * Creates an independent copy of this field, including its value.
   *
   * @return a new field, never null
   */
  public Field copy() {
    return new Field(entityId, name, value.copy(), writeTime, writerId);
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Field)) {
      return false;
    }
    final Field that = (Field) other;
    return entityId.equals(that.entityId)
        && name.equals(that.name)
        && value.equals(that.value)
        && writeTime.equals(that.writeTime)
        && writerId.equals(that.writerId);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(entityId, name, value, writeTime, writerId);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "Field{" + entityId + "." + name + "=" + value
        + ", writeTime=" + writeTime + ", writerId='" + writerId + "'}";
  }
}
