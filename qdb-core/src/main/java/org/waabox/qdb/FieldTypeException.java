package org.waabox.qdb;

import java.util.Objects;

import org.waabox.qdb.model.ValueType;

/**
 * Thrown when a value is read or updated as a variant it does not hold.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FieldTypeException extends QdbException {

  private static final long serialVersionUID = 1L;

  /** The variant the caller asked for, never null. */
  private final ValueType expected;

  /** The variant the value actually holds, never null. */
  private final ValueType actual;

  /**
   * Creates a new exception for a variant mismatch.
   *
   * @param theExpected the requested variant, cannot be null.
   * @param theActual   the held variant, cannot be null.
   */
  public FieldTypeException(final ValueType theExpected,
      final ValueType theActual) {
    super("Value is not " + Objects.requireNonNull(theExpected, "expected")
        .displayName() + ", it holds "
        + Objects.requireNonNull(theActual, "actual").displayName());
    expected = theExpected;
    actual = theActual;
  }

  /**
   * Returns the variant the caller asked for.
   *
   * @return the expected variant, never null
   */
  public ValueType expected() {
    return expected;
  }

  /**
   * Returns the variant the value holds.
   *
   * @return the actual variant, never null
   */
  public ValueType actual() {
    return actual;
  }
}
