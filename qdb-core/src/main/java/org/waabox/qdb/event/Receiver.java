package org.waabox.qdb.event;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * The receiving end of one {@link Emitter} listener.
 *
 * <p>Events are buffered in an unbounded FIFO queue until the owner polls
 * them. There is no backpressure: a receiver that is never drained keeps
 * growing.
 *
 * <p>Closing a receiver detaches it from its emitter. A closed receiver
 * refuses any further delivery and drops whatever it had buffered.
 *
 * <p>Thread safety: deliveries and polls may happen on different threads.
 *
 * @param <T> the event type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Receiver<T> implements AutoCloseable {

  /** The id assigned by the emitter, never null. */
  private final ListenerId id;

  /** The buffered events. */
  private final BlockingQueue<T> queue = new LinkedBlockingQueue<>();

  /** Detaches this receiver from its emitter, never null. */
  private final Consumer<ListenerId> detach;

  /** Whether {@link #close()} was called. */
  private volatile boolean closed = false;

  /**
   * Creates a receiver.
   *
   * @param theId     the listener id, never null
   * @param theDetach the callback that removes the listener from its
   *                  emitter, never null
   */
  Receiver(final ListenerId theId, final Consumer<ListenerId> theDetach) {
    id = Objects.requireNonNull(theId, "id cannot be null");
    detach = Objects.requireNonNull(theDetach, "detach cannot be null");
  }

  /**
   * Returns the id of this listener within its emitter.
   *
   * @return the id, never null
   */
  public ListenerId id() {
    return id;
  }

  /**
   * Buffers an event.
   *
   * @param event the event, never null
   *
   * @return false if this receiver is closed and the event was refused
   */
  boolean deliver(final T event) {
    if (closed) {
      return false;
    }
    return queue.offer(event);
  }

  /**
   * Takes the oldest buffered event without waiting.
   *
   * @return the event, or empty if nothing is buffered
   */
  public Optional<T> poll() {
    return Optional.ofNullable(queue.poll());
  }

  /**
   * Takes the oldest buffered event, waiting up to the given timeout.
   *
   * @param timeout the maximum wait, never null
   *
   * @return the event, or empty if the timeout elapsed
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional<T> poll(final Duration timeout)
      throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout cannot be null");
    return Optional.ofNullable(
        queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  /**
   * Takes the oldest buffered event, waiting until one arrives.
   *
   * @return the event, never null
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public T take() throws InterruptedException {
    return queue.take();
  }

  /**
   * Takes every buffered event, oldest first.
   *
   * @return the events, never null, may be empty
   */
  public List<T> drain() {
    final List<T> events = new ArrayList<>();
    queue.drainTo(events);
    return events;
  }

  /**
   * Returns whether this receiver has been closed.
   *
   * @return true once {@link #close()} has been called
   */
  public boolean isClosed() {
    return closed;
  }

  /**
   * Detaches this receiver from its emitter and drops buffered events.
   *
   * <p>Calling this method more than once has no further effect.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    queue.clear();
    detach.accept(id);
  }
}
