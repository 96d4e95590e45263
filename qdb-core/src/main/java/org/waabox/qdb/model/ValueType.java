package org.waabox.qdb.model;

import java.util.Objects;

/**
 * The variants a {@link Value} can hold.
 *
 * <p>Each variant carries the tag used to identify it on the wire. Tags
 * are stable: a value encoded with a tag is decoded back into the same
 * variant.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ValueType {

  /** No value has been read or written yet. */
  UNSPECIFIED("", "unspecified"),

  /** A text value. */
  STRING("type.googleapis.com/qdb.String", "a string"),

  /** A 64 bit signed integer. */
  INTEGER("type.googleapis.com/qdb.Int", "an integer"),

  /** A 64 bit floating point number. */
  FLOAT("type.googleapis.com/qdb.Float", "a float"),

  /** A boolean flag. */
  BOOLEAN("type.googleapis.com/qdb.Bool", "a boolean"),

  /** The id of another entity. */
  ENTITY_REFERENCE("type.googleapis.com/qdb.EntityReference",
      "an entity reference"),

  /** A point in time. */
  TIMESTAMP("type.googleapis.com/qdb.Timestamp", "a timestamp"),

  /** The state of a device connection. */
  CONNECTION_STATE("type.googleapis.com/qdb.ConnectionState",
      "a connection state"),

  /** The state of a garage door. */
  GARAGE_DOOR_STATE("type.googleapis.com/qdb.GarageDoorState",
      "a garage door state");

  /** The wire tag, never null. */
  private final String wireTag;

  /** The name used in error messages, never null. */
  private final String displayName;

  ValueType(final String theWireTag, final String theDisplayName) {
    wireTag = theWireTag;
    displayName = theDisplayName;
  }

  /**
   * Returns the tag that identifies this variant on the wire.
   *
   * @return the wire tag, empty for {@link #UNSPECIFIED}, never null
   */
  public String wireTag() {
    return wireTag;
  }

  /**
   * Returns a human readable name of this variant.
   *
   * @return the display name, never null
   */
  public String displayName() {
    return displayName;
  }

  /**
   * Resolves the variant identified by the given wire tag.
   *
   * @param tag the wire tag, never null
   *
   * @return the matching variant, never null
   *
   * @throws IllegalArgumentException if no variant uses the tag
   */
  public static ValueType fromWireTag(final String tag) {
    Objects.requireNonNull(tag, "tag cannot be null");
    for (final ValueType type : values()) {
      if (type.wireTag.equals(tag)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown value type tag: " + tag);
  }
}
