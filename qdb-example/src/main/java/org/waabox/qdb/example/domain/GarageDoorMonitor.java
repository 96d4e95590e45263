package org.waabox.qdb.example.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.qdb.ApplicationContext;
import org.waabox.qdb.Database;
import org.waabox.qdb.QdbException;
import org.waabox.qdb.event.Receiver;
import org.waabox.qdb.model.Entity;
import org.waabox.qdb.model.Field;
import org.waabox.qdb.model.Notification;
import org.waabox.qdb.model.NotificationConfig;
import org.waabox.qdb.worker.Worker;

/**
 * Worker that keeps track of the state of every garage door.
 *
 * <p>Each time the connection supervisor reports a (re)connection, the
 * monitor subscribes to the door state field of every entity of the
 * garage door type. Subscriptions are lost with the connection, so the
 * old receivers are closed and new ones opened on every reconnect.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class GarageDoorMonitor implements Worker {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(GarageDoorMonitor.class);

  /** The connection status events of the supervisor, never null. */
  private final Receiver<Boolean> connectionStatus;

  /** The entity type of the doors, never null. */
  private final String entityType;

  /** The field holding the door state, never null. */
  private final String stateField;

  /** The open subscriptions, one per door. */
  private final List<Receiver<Notification>> subscriptions = new ArrayList<>();

  /** The last known state per door id. */
  private final Map<String, String> doorStates = new LinkedHashMap<>();

  /** Whether the doors need to be subscribed to on the next tick. */
  private boolean subscribePending = false;

  /**
   * Creates a new monitor.
   *
   * @param theConnectionStatus the supervisor connection events, never
   *        null
   * @param theEntityType the entity type of the doors, never null
   * @param theStateField the field holding the door state, never null
   */
  public GarageDoorMonitor(final Receiver<Boolean> theConnectionStatus,
      final String theEntityType, final String theStateField) {
    connectionStatus = Objects.requireNonNull(theConnectionStatus,
        "connectionStatus cannot be null");
    entityType = Objects.requireNonNull(theEntityType,
        "entityType cannot be null");
    stateField = Objects.requireNonNull(theStateField,
        "stateField cannot be null");
  }

  @Override
  public void initialize(final ApplicationContext ctx) {
    log.info("Monitoring {}.{}", entityType, stateField);
  }

  @Override
  public void doWork(final ApplicationContext ctx) {
    final Database database = ctx.database();
    if (subscribePending && database.connected()) {
      subscribe(database);
    }
    for (final Receiver<Notification> subscription : subscriptions) {
      for (final Notification notification : subscription.drain()) {
        onChange(notification.current());
      }
    }
  }

  @Override
  public void deinitialize(final ApplicationContext ctx) {
    closeSubscriptions();
    connectionStatus.close();
  }

  @Override
  public void processEvents() {
    for (final Boolean connected : connectionStatus.drain()) {
      if (connected) {
        subscribePending = true;
      } else {
        subscribePending = false;
        closeSubscriptions();
      }
    }
  }

  /**
   * Returns the last known state of every door.
   *
   * @return an unmodifiable view keyed by door id, never null
   */
  public Map<String, String> doorStates() {
    return Collections.unmodifiableMap(doorStates);
  }

  /**
   * Returns the number of open subscriptions.
   *
   * @return the subscription count
   */
  public int subscriptionCount() {
    return subscriptions.size();
  }

  private void subscribe(final Database database) {
    closeSubscriptions();
    try {
      final List<Entity> doors = database.getEntities(entityType);
      for (final Entity door : doors) {
        subscriptions.add(database.subscribe(NotificationConfig.builder()
            .entityId(door.id())
            .field(stateField)
            .build()));
      }
      subscribePending = false;
      log.info("Subscribed to {} garage door(s)", doors.size());
    } catch (final QdbException e) {
      closeSubscriptions();
      log.warn("Failed to subscribe to garage doors, retrying next tick", e);
    }
  }

  private void onChange(final Field current) {
    if (!current.value().isGarageDoorState()) {
      log.warn("Ignoring {} of {}: not a garage door state",
          current.name(), current.entityId());
      return;
    }
    final String state = current.value().asGarageDoorState();
    final String previous = doorStates.put(current.entityId(), state);
    log.info("Garage door {} is now {} (was {})", current.entityId(), state,
        previous == null ? "unknown" : previous);
  }

  private void closeSubscriptions() {
    subscriptions.forEach(Receiver::close);
    subscriptions.clear();
  }
}
