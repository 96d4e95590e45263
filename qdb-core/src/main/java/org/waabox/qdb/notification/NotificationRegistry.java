package org.waabox.qdb.notification;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.qdb.NotificationException;
import org.waabox.qdb.TransportException;
import org.waabox.qdb.client.DatabaseClient;
import org.waabox.qdb.event.Emitter;
import org.waabox.qdb.event.Receiver;
import org.waabox.qdb.metrics.NoopQdbMetrics;
import org.waabox.qdb.metrics.QdbMetrics;
import org.waabox.qdb.model.Notification;
import org.waabox.qdb.model.NotificationConfig;
import org.waabox.qdb.model.NotificationToken;

/**
 * Keeps one remote subscription per distinct {@link NotificationConfig}
 * and fans its notifications out to any number of local listeners.
 *
 * <p>The registry tracks three mappings that are kept consistent with
 * each other:
 * <ul>
 *   <li>the set of registered configurations,</li>
 *   <li>the token the service assigned to each configuration,</li>
 *   <li>the {@link Emitter} holding the listeners of each token.</li>
 * </ul>
 *
 * <p>Subscribing twice with equal configurations registers with the
 * service once; both callers get their own {@link Receiver} on the same
 * emitter. Closing a receiver detaches only that listener. Once a token
 * has no listener left, the next {@link #dispatch()} unregisters it from
 * the service.
 *
 * <p>Thread safety: every access to the mappings holds a single lock, so
 * receivers may be closed from any thread. Transport calls are made while
 * holding the lock and are expected to come from the scheduler thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NotificationRegistry {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(NotificationRegistry.class);

  /** The transport, never null. */
  private final DatabaseClient client;

  /** The metrics reporter, never null. */
  private final QdbMetrics metrics;

  /** Guards the three mappings below. */
  private final ReentrantLock lock = new ReentrantLock();

  /** The configurations with an active remote subscription. */
  private final Set<NotificationConfig> registeredConfigs = new HashSet<>();

  /** The token of each registered configuration. */
  private final Map<NotificationConfig, NotificationToken> configToToken =
      new HashMap<>();

  /** The listeners of each token. */
  private final Map<NotificationToken, Emitter<Notification>> tokenToEmitter =
      new HashMap<>();

  /**
   * Creates a registry without metrics.
   *
   * @param theClient the transport, never null
   */
  public NotificationRegistry(final DatabaseClient theClient) {
    this(theClient, new NoopQdbMetrics());
  }

  /**
   * Creates a registry.
   *
   * @param theClient  the transport, never null
   * @param theMetrics the metrics reporter, never null
   */
  public NotificationRegistry(final DatabaseClient theClient,
      final QdbMetrics theMetrics) {
    client = Objects.requireNonNull(theClient, "client cannot be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics cannot be null");
  }

  /**
   * Opens a listener for the notifications matching a configuration.
   *
   * <p>If an equal configuration is already registered, the listener is
   * attached to its token and the service is not contacted. Otherwise the
   * configuration is registered with the service first. If that fails the
   * registry is left untouched.
   *
   * @param config the filter, never null
   *
   * @return the receiver of the new listener, never null
   *
   * @throws TransportException    if the service rejects the registration
   * @throws NotificationException if the registry is found inconsistent
   */
  public Receiver<Notification> subscribe(final NotificationConfig config) {
    Objects.requireNonNull(config, "config cannot be null");

    lock.lock();
    try {
      if (registeredConfigs.contains(config)) {
        final NotificationToken token = configToToken.get(config);
        if (token == null) {
          throw new NotificationException(
              "Inconsistent notification state during registration: no"
                  + " token for " + config);
        }
        final Emitter<Notification> emitter = tokenToEmitter.get(token);
        if (emitter == null) {
          throw new NotificationException(
              "Inconsistent notification state during registration: no"
                  + " listeners for token " + token);
        }
        log.debug("Attached listener to existing token {}", token);
        return emitter.connect();
      }

      final NotificationToken token = client.registerNotification(config);

      final Emitter<Notification> emitter = tokenToEmitter.computeIfAbsent(
          token, t -> new Emitter<>(Notification::copy));
      registeredConfigs.add(config);
      configToToken.put(config, token);

      log.info("Registered notification {} for {}.{}", token,
          config.entityId().isEmpty()
              ? config.entityType() : config.entityId(),
          config.field());

      return emitter.connect();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Cancels a subscription with the service and drops every listener and
   * configuration bound to its token.
   *
   * <p>If the service call fails, nothing is removed.
   *
   * @param token the subscription token, never null
   *
   * @throws NotificationException if the token is not registered
   * @throws TransportException    if the service call fails
   */
  public void unsubscribe(final NotificationToken token) {
    Objects.requireNonNull(token, "token cannot be null");

    lock.lock();
    try {
      if (!tokenToEmitter.containsKey(token)) {
        throw new NotificationException(
            "Token not found during unregistration: " + token);
      }

      client.unregisterNotification(token);
      forget(token);

      log.info("Unregistered notification {}", token);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Polls the service for notifications and hands each one to the
   * listeners of its token.
   *
   * <p>Before polling, tokens whose listeners have all been closed are
   * unregistered from the service. A failure there is logged and retried
   * on the next dispatch.
   *
   * <p>A notification for an unknown token does not stop the batch: the
   * remaining notifications are still delivered, then a single
   * {@link NotificationException} names every unknown token.
   *
   * @throws TransportException    if polling the service fails
   * @throws NotificationException if the batch held unknown tokens
   */
  public void dispatch() {
    lock.lock();
    try {
      releaseIdleTokens();

      final List<Notification> notifications = client.getNotifications();

      final Set<NotificationToken> unknown = new LinkedHashSet<>();
      int delivered = 0;
      int unknownCount = 0;

      for (final Notification notification : notifications) {
        final Emitter<Notification> emitter =
            tokenToEmitter.get(notification.token());
        if (emitter == null) {
          log.warn("Cannot process notification: no listeners exist for"
              + " token {}", notification.token());
          unknown.add(notification.token());
          unknownCount++;
          continue;
        }
        emitter.emit(notification);
        delivered++;
      }

      metrics.notificationsDispatched(delivered, unknownCount);

      if (!unknown.isEmpty()) {
        throw new NotificationException(
            "Received notifications for unknown tokens: " + unknown);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Forgets every subscription without contacting the service.
   *
   * <p>Used after the connection to the service was lost, when its
   * subscriptions can no longer be trusted. Open receivers stop getting
   * events; callers subscribe again after reconnecting.
   */
  public void clear() {
    lock.lock();
    try {
      for (final Emitter<Notification> emitter : tokenToEmitter.values()) {
        emitter.clear();
      }
      registeredConfigs.clear();
      configToToken.clear();
      tokenToEmitter.clear();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the token registered for a configuration.
   *
   * @param config the filter, never null
   *
   * @return the token, or empty if the configuration is not registered
   */
  public Optional<NotificationToken> tokenFor(
      final NotificationConfig config) {
    Objects.requireNonNull(config, "config cannot be null");
    lock.lock();
    try {
      return Optional.ofNullable(configToToken.get(config));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of open listeners of a token.
   *
   * @param token the subscription token, never null
   *
   * @return the listener count, zero for unknown tokens
   */
  public int listenerCount(final NotificationToken token) {
    Objects.requireNonNull(token, "token cannot be null");
    lock.lock();
    try {
      final Emitter<Notification> emitter = tokenToEmitter.get(token);
      return emitter == null ? 0 : emitter.listenerCount();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of registered tokens.
   *
   * @return the token count
   */
  public int size() {
    lock.lock();
    try {
      return tokenToEmitter.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns whether no subscription is registered.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return size() == 0;
  }

  /** Unregisters every token without listeners. Runs under the lock. */
  private void releaseIdleTokens() {
    final List<NotificationToken> idle = new ArrayList<>();
    for (final Map.Entry<NotificationToken, Emitter<Notification>> entry
        : tokenToEmitter.entrySet()) {
      if (entry.getValue().listenerCount() == 0) {
        idle.add(entry.getKey());
      }
    }

    for (final NotificationToken token : idle) {
      try {
        client.unregisterNotification(token);
        forget(token);
        log.info("Released notification {}: no listeners left", token);
      } catch (final TransportException e) {
        log.warn("Failed to release idle notification {}: {}", token,
            e.getMessage());
      }
    }
  }

  /**
   * Drops a token and every configuration bound to it. Runs under the
   * lock.
   *
   * @param token the token, never null
   */
  private void forget(final NotificationToken token) {
    final Emitter<Notification> emitter = tokenToEmitter.remove(token);
    if (emitter != null) {
      emitter.clear();
    }
    final Iterator<Map.Entry<NotificationConfig, NotificationToken>> it =
        configToToken.entrySet().iterator();
    while (it.hasNext()) {
      if (it.next().getValue().equals(token)) {
        it.remove();
      }
    }
    registeredConfigs.retainAll(configToToken.keySet());
  }
}
