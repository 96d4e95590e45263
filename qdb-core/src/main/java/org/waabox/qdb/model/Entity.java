package org.waabox.qdb.model;

import java.util.Objects;

/**
 * A named, typed object of the remote database.
 *
 * <p>The id never changes. Type and name are whatever the service
 * reported when the entity was fetched; fetch the entity again to see
 * updates.
 *
 * @param id   the entity id, never null
 * @param type the entity type, never null
 * @param name the entity name, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Entity(String id, String type, String name) {

  /**
   * Validates the components.
   *
   * @param id   the entity id, never null
   * @param type the entity type, never null
   * @param name the entity name, never null
   */
  public Entity {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(type, "type cannot be null");
    Objects.requireNonNull(name, "name cannot be null");
  }

  /**
   * Creates an unspecified field of this entity.
   *
   * @param fieldName the field name, never null
   *
   * @return a new field addressed at this entity, never null
   */
  public Field field(final String fieldName) {
    return Field.of(id, fieldName);
  }
}
