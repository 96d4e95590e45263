package org.waabox.qdb.worker;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.qdb.ApplicationContext;
import org.waabox.qdb.Database;
import org.waabox.qdb.TransportException;
import org.waabox.qdb.event.Emitter;
import org.waabox.qdb.event.Receiver;
import org.waabox.qdb.metrics.NoopQdbMetrics;
import org.waabox.qdb.metrics.QdbMetrics;

/**
 * Keeps the database session alive and pumps its notifications.
 *
 * <p>On every tick the worker does exactly one of:
 * <ul>
 *   <li>if the network is down, marks the session as lost (keeping the
 *       subscriptions, since only the path to the service is gone);</li>
 *   <li>if the database dropped the session, forgets every subscription
 *       and tries to reconnect;</li>
 *   <li>otherwise polls notifications and hands them to their
 *       listeners, first reporting the session as connected again if a
 *       network outage had marked it lost.</li>
 * </ul>
 *
 * <p>Every transition of the session is published on
 * {@link #connectionStatus()}. Listeners that need subscriptions should
 * re-subscribe whenever they see {@code true}.
 *
 * <p>The network status comes from an optional receiver, typically the one
 * of a {@link NetworkWorker}, drained in {@link #processEvents()}. Without
 * one the network is considered reachable.
 *
 * <p>A failed connection attempt is logged and retried on the next tick.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DatabaseWorker implements Worker {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(DatabaseWorker.class);

  /** Publishes every change of the session state. */
  private final Emitter<Boolean> connectionStatus = new Emitter<>();

  /** The metrics reporter, never null. */
  private final QdbMetrics metrics;

  /** The network status events, null until {@link #listenTo} is called. */
  private Receiver<Boolean> networkEvents;

  /** Whether the worker last saw the session as established. */
  private boolean databaseConnected = false;

  /** Whether the network was last reported as reachable. */
  private boolean networkConnected = true;

  /** Creates a worker without metrics. */
  public DatabaseWorker() {
    this(new NoopQdbMetrics());
  }

  /**
   * Creates a worker.
   *
   * @param theMetrics the metrics reporter, never null
   */
  public DatabaseWorker(final QdbMetrics theMetrics) {
    metrics = Objects.requireNonNull(theMetrics, "metrics cannot be null");
  }

  /**
   * Returns the emitter of session state changes.
   *
   * @return the emitter, never null
   */
  public Emitter<Boolean> connectionStatus() {
    return connectionStatus;
  }

  /**
   * Sets the source of network status events.
   *
   * @param theNetworkEvents the receiver, never null
   */
  public void listenTo(final Receiver<Boolean> theNetworkEvents) {
    networkEvents = Objects.requireNonNull(theNetworkEvents,
        "networkEvents cannot be null");
  }

  /**
   * Returns whether the worker sees the session as established.
   *
   * @return true if connected
   */
  public boolean isConnected() {
    return databaseConnected;
  }

  /**
   * Returns whether the network was last reported as reachable.
   *
   * @return true if reachable
   */
  public boolean isNetworkConnected() {
    return networkConnected;
  }

  /** {@inheritDoc} */
  @Override
  public void initialize(final ApplicationContext ctx) {
    log.info("Initializing database worker");
  }

  /** {@inheritDoc} */
  @Override
  public void doWork(final ApplicationContext ctx) {
    final Database database = ctx.database();

    if (!networkConnected) {
      if (databaseConnected) {
        log.warn("Network connection loss has disrupted database connection");
        changeState(false);
      }
      return;
    }

    if (!database.connected()) {
      if (databaseConnected) {
        log.warn("Disconnected from database");
        database.clearNotifications();
        changeState(false);
      }

      log.debug("Attempting to connect to the database...");

      database.disconnect();
      try {
        database.connect();
      } catch (final TransportException e) {
        log.warn("Failed to connect to the database: {}", e.getMessage());
        metrics.connectionAttemptFailed(e);
        return;
      }

      if (database.connected()) {
        log.info("Connected to the database");
        changeState(true);
      }
      return;
    }

    if (!databaseConnected) {
      log.info("Network restored, database session still valid");
      changeState(true);
    }

    database.processNotifications();
  }

  /** {@inheritDoc} */
  @Override
  public void deinitialize(final ApplicationContext ctx) {
    log.info("Deinitializing database worker");
  }

  /** Applies the latest network status, if any arrived. */
  @Override
  public void processEvents() {
    if (networkEvents == null) {
      return;
    }
    for (final Boolean connected : networkEvents.drain()) {
      networkConnected = connected;
    }
  }

  private void changeState(final boolean connected) {
    databaseConnected = connected;
    metrics.connectionChanged(connected);
    connectionStatus.emit(connected);
  }
}
