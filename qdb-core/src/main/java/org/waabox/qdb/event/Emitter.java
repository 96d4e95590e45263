package org.waabox.qdb.event;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Fans out events to any number of listeners.
 *
 * <p>Each call to {@link #connect()} opens a new {@link Receiver}. Every
 * {@link #emit(Object)} delivers the event to all open receivers. A
 * receiver that refuses a delivery because it was closed is removed as a
 * side effect; {@link #disconnect(ListenerId)} removes one right away.
 *
 * <p>When built with a copier, each receiver gets its own copy of the
 * event, so listeners never share mutable state.
 *
 * <p>Ordering: the order in which receivers are served within one
 * {@code emit} is unspecified. A single receiver sees events in emission
 * order.
 *
 * <p>Thread safety: this class is thread-safe.
 *
 * @param <T> the event type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Emitter<T> {

  /** The open receivers, keyed by listener id. */
  private final Map<ListenerId, Receiver<T>> receivers =
      new ConcurrentHashMap<>();

  /** Issues listener ids for this emitter only. */
  private final AtomicLong sequence = new AtomicLong();

  /** Produces the instance handed to each receiver, never null. */
  private final UnaryOperator<T> copier;

  /** Creates an emitter that hands the same instance to every receiver. */
  public Emitter() {
    this(UnaryOperator.identity());
  }

  /**
   * Creates an emitter that hands each receiver its own copy.
   *
   * @param theCopier creates the per-receiver copy, never null
   */
  public Emitter(final UnaryOperator<T> theCopier) {
    copier = Objects.requireNonNull(theCopier, "copier cannot be null");
  }

  /**
   * Opens a new listener.
   *
   * @return the receiver of the new listener, never null
   */
  public Receiver<T> connect() {
    final ListenerId id = new ListenerId(sequence.getAndIncrement());
    final Receiver<T> receiver = new Receiver<>(id, this::disconnect);
    receivers.put(id, receiver);
    return receiver;
  }

  /**
   * Removes a listener. Does nothing if it was already removed.
   *
   * @param id the listener id, never null
   */
  public void disconnect(final ListenerId id) {
    Objects.requireNonNull(id, "id cannot be null");
    receivers.remove(id);
  }

  /**
   * Delivers an event to every open listener, dropping closed ones.
   *
   * @param event the event, never null
   */
  public void emit(final T event) {
    Objects.requireNonNull(event, "event cannot be null");
    receivers.values().removeIf(
        receiver -> !receiver.deliver(copier.apply(event)));
  }

  /**
   * Returns the number of listeners still attached.
   *
   * <p>Receivers closed since the last emission are not counted.
   *
   * @return the listener count
   */
  public int listenerCount() {
    receivers.values().removeIf(Receiver::isClosed);
    return receivers.size();
  }

  /** Removes every listener. */
  public void clear() {
    receivers.clear();
  }
}
