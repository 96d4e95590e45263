package org.waabox.qdb.client;

import java.util.List;

import org.waabox.qdb.TransportException;
import org.waabox.qdb.model.Entity;
import org.waabox.qdb.model.Field;
import org.waabox.qdb.model.Notification;
import org.waabox.qdb.model.NotificationConfig;
import org.waabox.qdb.model.NotificationToken;

/**
 * The transport to the remote entity/field database.
 *
 * <p>Implementations talk to the service (e.g. over REST) and translate
 * every network, authentication or decoding failure into a
 * {@link TransportException}.
 *
 * <p>Calls are blocking and are expected to be issued from a single
 * thread, the one running the {@link org.waabox.qdb.Application}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface DatabaseClient {

  /**
   * Opens a session with the service.
   *
   * @throws TransportException if the service cannot be reached or refuses
   *                            the session
   */
  void connect();

  /**
   * Returns whether a session is currently open.
   *
   * @return true if connected
   */
  boolean connected();

  /**
   * Drops the current session, if any.
   *
   * @return true if a session was open
   */
  boolean disconnect();

  /**
   * Fetches one entity.
   *
   * @param entityId the entity id, never null
   *
   * @return the entity, never null
   */
  Entity getEntity(String entityId);

  /**
   * Fetches every entity of a type.
   *
   * @param entityType the entity type, never null
   *
   * @return the entities, never null
   */
  List<Entity> getEntities(String entityType);

  /**
   * Reads the given fields, filling in value, write time and writer in
   * place.
   *
   * @param fields the fields to read, never null
   */
  void read(List<Field> fields);

  /**
   * Writes the given fields.
   *
   * @param fields the fields to write, never null
   */
  void write(List<Field> fields);

  /**
   * Asks the service to start notifying changes matching a filter.
   *
   * @param config the filter, never null
   *
   * @return the token the service assigned, never null
   */
  NotificationToken registerNotification(NotificationConfig config);

  /**
   * Cancels a subscription.
   *
   * @param token the subscription token, never null
   */
  void unregisterNotification(NotificationToken token);

  /**
   * Fetches the notifications fired since the previous call.
   *
   * @return the pending notifications, never null, may be empty
   */
  List<Notification> getNotifications();
}
