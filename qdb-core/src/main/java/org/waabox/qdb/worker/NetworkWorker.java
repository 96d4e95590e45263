package org.waabox.qdb.worker;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.qdb.ApplicationContext;
import org.waabox.qdb.event.Emitter;

/**
 * Watches network reachability and publishes its changes.
 *
 * <p>Each tick asks the {@link ReachabilityProbe}; the result is emitted on
 * {@link #networkStatus()} on the first tick and then only when it
 * changes. Wire it to a {@link DatabaseWorker} with:
 * <pre>{@code
 * databaseWorker.listenTo(networkWorker.networkStatus().connect());
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NetworkWorker implements Worker {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(NetworkWorker.class);

  /** Publishes reachability changes. */
  private final Emitter<Boolean> networkStatus = new Emitter<>();

  /** The probe, never null. */
  private final ReachabilityProbe probe;

  /** The last reported status, null before the first tick. */
  private Boolean reachable;

  /**
   * Creates a worker.
   *
   * @param theProbe the reachability probe, never null
   */
  public NetworkWorker(final ReachabilityProbe theProbe) {
    probe = Objects.requireNonNull(theProbe, "probe cannot be null");
  }

  /**
   * Returns the emitter of reachability changes.
   *
   * @return the emitter, never null
   */
  public Emitter<Boolean> networkStatus() {
    return networkStatus;
  }

  /**
   * Returns the last observed reachability.
   *
   * @return true if the last probe succeeded, false before the first tick
   */
  public boolean isReachable() {
    return Boolean.TRUE.equals(reachable);
  }

  /** {@inheritDoc} */
  @Override
  public void initialize(final ApplicationContext ctx) {
    log.info("Initializing network worker");
  }

  /** {@inheritDoc} */
  @Override
  public void doWork(final ApplicationContext ctx) {
    final boolean current = probe.isReachable();
    if (reachable != null && reachable == current) {
      return;
    }
    if (current) {
      log.info("Network is reachable");
    } else {
      log.warn("Network is unreachable");
    }
    reachable = current;
    networkStatus.emit(current);
  }

  /** {@inheritDoc} */
  @Override
  public void deinitialize(final ApplicationContext ctx) {
    log.info("Deinitializing network worker");
  }
}
