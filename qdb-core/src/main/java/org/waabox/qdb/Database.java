package org.waabox.qdb;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

import org.waabox.qdb.client.DatabaseClient;
import org.waabox.qdb.event.Receiver;
import org.waabox.qdb.metrics.NoopQdbMetrics;
import org.waabox.qdb.metrics.QdbMetrics;
import org.waabox.qdb.model.Entity;
import org.waabox.qdb.model.Field;
import org.waabox.qdb.model.Notification;
import org.waabox.qdb.model.NotificationConfig;
import org.waabox.qdb.model.NotificationToken;
import org.waabox.qdb.notification.NotificationRegistry;

/**
 * The application facing view of the remote database.
 *
 * <p>Combines a {@link DatabaseClient transport} with the
 * {@link NotificationRegistry} that deduplicates its subscriptions.
 * Reads and writes go straight to the transport; subscriptions go through
 * the registry.
 *
 * <p>Usage example:
 * <pre>{@code
 * Database database = new Database(new RestDatabaseClient(config));
 *
 * Receiver<Notification> doors = database.subscribe(
 *     NotificationConfig.builder()
 *         .entityType("GarageDoor")
 *         .field("DoorState")
 *         .build());
 *
 * List<Entity> open = database.find("GarageDoor", List.of("DoorState"),
 *     fields -> "OPEN".equals(
 *         fields.get("DoorState").value().asGarageDoorState()));
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Database {

  /** The transport, never null. */
  private final DatabaseClient client;

  /** The subscription registry, never null. */
  private final NotificationRegistry notifications;

  /**
   * Creates a database without metrics.
   *
   * @param theClient the transport, never null
   */
  public Database(final DatabaseClient theClient) {
    this(theClient, new NoopQdbMetrics());
  }

  /**
   * Creates a database.
   *
   * @param theClient  the transport, never null
   * @param theMetrics the metrics reporter, never null
   */
  public Database(final DatabaseClient theClient,
      final QdbMetrics theMetrics) {
    client = Objects.requireNonNull(theClient, "client cannot be null");
    notifications = new NotificationRegistry(theClient, theMetrics);
  }

  /**
   * Opens a session with the service.
   *
   * @throws TransportException if the service cannot be reached
   */
  public void connect() {
    client.connect();
  }

  /**
   * Returns whether a session is open.
   *
   * @return true if connected
   */
  public boolean connected() {
    return client.connected();
  }

  /**
   * Drops the current session.
   *
   * @return true if a session was open
   */
  public boolean disconnect() {
    return client.disconnect();
  }

  /**
   * Fetches one entity.
   *
   * @param entityId the entity id, never null
   * @return the entity, never null
   */
  public Entity getEntity(final String entityId) {
    Objects.requireNonNull(entityId, "entityId cannot be null");
    return client.getEntity(entityId);
  }

  /**
   * Fetches every entity of a type.
   *
   * @param entityType the entity type, never null
   * @return the entities, never null
   */
  public List<Entity> getEntities(final String entityType) {
    Objects.requireNonNull(entityType, "entityType cannot be null");
    return client.getEntities(entityType);
  }

  /**
   * Finds the entities of a type whose fields satisfy a predicate.
   *
   * <p>Reads the named fields of every entity of the type, one read per
   * entity, and tests the predicate against a map of field name to field.
   *
   * @param entityType the entity type, never null
   * @param fieldNames the fields the predicate needs, never null
   * @param predicate  the condition, never null
   *
   * @return the matching entities in service order, never null
   *
   * @throws TransportException if any fetch or read fails
   */
  public List<Entity> find(final String entityType,
      final List<String> fieldNames,
      final Predicate<Map<String, Field>> predicate) {
    Objects.requireNonNull(entityType, "entityType cannot be null");
    Objects.requireNonNull(fieldNames, "fieldNames cannot be null");
    Objects.requireNonNull(predicate, "predicate cannot be null");

    final List<Entity> result = new ArrayList<>();

    for (final Entity entity : client.getEntities(entityType)) {
      final List<Field> requests = new ArrayList<>(fieldNames.size());
      for (final String fieldName : fieldNames) {
        requests.add(entity.field(fieldName));
      }

      client.read(requests);

      final Map<String, Field> fields = new LinkedHashMap<>();
      for (final Field field : requests) {
        fields.put(field.name(), field);
      }

      if (predicate.test(fields)) {
        result.add(entity);
      }
    }
    return result;
  }

  /**
   * Reads fields in place.
   *
   * @param fields the fields to read, never null
   */
  public void read(final List<Field> fields) {
    Objects.requireNonNull(fields, "fields cannot be null");
    client.read(fields);
  }

  /**
   * Writes fields.
   *
   * @param fields the fields to write, never null
   */
  public void write(final List<Field> fields) {
    Objects.requireNonNull(fields, "fields cannot be null");
    client.write(fields);
  }

  /**
   * Opens a listener for the notifications matching a configuration.
   *
   * @param config the filter, never null
   * @return the receiver, never null
   *
   * @see NotificationRegistry#subscribe(NotificationConfig)
   */
  public Receiver<Notification> subscribe(final NotificationConfig config) {
    return notifications.subscribe(config);
  }

  /**
   * Cancels a subscription.
   *
   * @param token the subscription token, never null
   *
   * @see NotificationRegistry#unsubscribe(NotificationToken)
   */
  public void unsubscribe(final NotificationToken token) {
    notifications.unsubscribe(token);
  }

  /**
   * Polls and dispatches pending notifications.
   *
   * @see NotificationRegistry#dispatch()
   */
  public void processNotifications() {
    notifications.dispatch();
  }

  /**
   * Forgets every subscription without contacting the service.
   *
   * @see NotificationRegistry#clear()
   */
  public void clearNotifications() {
    notifications.clear();
  }

  /**
   * Returns the subscription registry.
   *
   * @return the registry, never null
   */
  public NotificationRegistry notifications() {
    return notifications;
  }
}
