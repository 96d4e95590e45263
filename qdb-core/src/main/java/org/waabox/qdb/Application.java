package org.waabox.qdb;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.qdb.metrics.NoopQdbMetrics;
import org.waabox.qdb.metrics.QdbMetrics;
import org.waabox.qdb.worker.Worker;

/**
 * The fixed-interval loop that drives every registered {@link Worker}.
 *
 * <p>{@link #run()} initializes all workers, then ticks them in
 * registration order once per loop interval until {@link #requestQuit()}
 * is called, and finally deinitializes them. A tick that finishes early
 * sleeps for the rest of the interval; a slow one simply makes the tick
 * longer.
 *
 * <p>A worker failure is logged and reported to the metrics, never
 * propagated: the other workers of the same tick still run, and so does
 * the next tick.
 *
 * <p>Instances are created through the fluent {@link Builder} starting with
 * {@link #builder()}.
 *
 * <p>Usage example:
 * <pre>{@code
 * Application app = Application.builder()
 *     .database(database)
 *     .loopInterval(Duration.ofMillis(500))
 *     .build();
 *
 * app.addWorker(new NetworkWorker(probe));
 * app.addWorker(new DatabaseWorker());
 * app.run();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Application {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Application.class);

  /** The context shared with the workers. */
  private final ApplicationContext context;

  /** The tick length. */
  private final Duration loopInterval;

  /** The metrics reporter. */
  private final QdbMetrics metrics;

  /** The workers, in registration order. */
  private final List<Worker> workers = new CopyOnWriteArrayList<>();

  /** Whether {@link #run()} has been called. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /**
   * Creates a new application.
   *
   * @param theDatabase     the database, never null
   * @param theLoopInterval the tick length, never null
   * @param theMetrics      the metrics reporter, never null
   */
  private Application(final Database theDatabase,
      final Duration theLoopInterval, final QdbMetrics theMetrics) {
    context = new ApplicationContext(theDatabase);
    loopInterval = theLoopInterval;
    metrics = theMetrics;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Adds a worker to the end of the tick order.
   *
   * @param worker the worker, never null
   *
   * @throws IllegalStateException if the loop is already running
   */
  public void addWorker(final Worker worker) {
    Objects.requireNonNull(worker, "worker must not be null");
    if (started.get()) {
      throw new IllegalStateException(
          "Cannot add workers after run() has been called");
    }
    workers.add(worker);
  }

  /**
   * Runs the loop on the calling thread until quit is requested.
   *
   * @throws IllegalStateException if called more than once
   */
  public void run() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Application has already been run");
    }
    initializeWorkers();
    loop();
    deinitializeWorkers();
  }

  /**
   * Asks the loop to stop once the current tick completes.
   *
   * <p>Safe to call from any thread. An in-flight transport call is not
   * interrupted.
   */
  public void requestQuit() {
    context.requestQuit();
  }

  /**
   * Returns whether quit has been requested.
   *
   * @return true once quit was requested
   */
  public boolean quitRequested() {
    return context.quitRequested();
  }

  /**
   * Returns the context shared with the workers.
   *
   * @return the context, never null
   */
  public ApplicationContext context() {
    return context;
  }

  /**
   * Returns the registered workers in tick order.
   *
   * @return an unmodifiable view of the workers, never null
   */
  public List<Worker> workers() {
    return Collections.unmodifiableList(workers);
  }

  /**
   * Returns the tick length.
   *
   * @return the loop interval, never null
   */
  public Duration loopInterval() {
    return loopInterval;
  }

  private void initializeWorkers() {
    log.info("Initializing application with {} worker(s)", workers.size());
    for (final Worker worker : workers) {
      try {
        worker.initialize(context);
      } catch (final Exception e) {
        log.error("Error while initializing worker '{}': {}", worker.name(),
            e.getMessage(), e);
      }
    }
  }

  private void loop() {
    log.info("Application has started, ticking every {} ms",
        loopInterval.toMillis());

    do {
      final long tickStart = System.nanoTime();

      for (final Worker worker : workers) {
        final long workerStart = System.nanoTime();
        try {
          worker.doWork(context);
        } catch (final Exception e) {
          log.error("Error while executing worker '{}': {}", worker.name(),
              e.getMessage(), e);
          metrics.workerFailed(worker.name(), e);
        }

        if (log.isTraceEnabled()) {
          log.trace("Worker '{}' took {} ms to complete tick", worker.name(),
              (System.nanoTime() - workerStart) / 1_000_000);
        }

        processEvents();
      }

      if (!context.quitRequested()) {
        idle(tickStart);
      }
    } while (!context.quitRequested());
  }

  /** Lets every worker consume the events emitted so far. */
  private void processEvents() {
    for (final Worker worker : workers) {
      try {
        worker.processEvents();
      } catch (final Exception e) {
        log.error("Error while processing events of worker '{}': {}",
            worker.name(), e.getMessage(), e);
        metrics.workerFailed(worker.name(), e);
      }
    }
  }

  /**
   * Sleeps for the remainder of the tick. An interrupt requests quit.
   *
   * @param tickStart the tick start, from {@link System#nanoTime()}
   */
  private void idle(final long tickStart) {
    final long elapsedMillis = (System.nanoTime() - tickStart) / 1_000_000;
    final long sleepMillis = loopInterval.toMillis() - elapsedMillis;
    if (sleepMillis <= 0) {
      return;
    }
    log.trace("Idle for {} ms", sleepMillis);
    try {
      Thread.sleep(sleepMillis);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Application interrupted, requesting quit");
      context.requestQuit();
    }
  }

  private void deinitializeWorkers() {
    log.info("Deinitializing application");
    for (final Worker worker : workers) {
      try {
        worker.deinitialize(context);
      } catch (final Exception e) {
        log.error("Error while deinitializing worker '{}': {}",
            worker.name(), e.getMessage(), e);
      }
    }
    log.info("Shutting down now");
  }

  /**
   * A fluent builder for constructing {@link Application} instances.
   *
   * <p>Defaults:
   * <ul>
   *   <li>loopInterval: 500 ms</li>
   *   <li>metrics: {@link NoopQdbMetrics}</li>
   * </ul>
   * The database has no default.
   */
  public static final class Builder {

    /** The default tick length. */
    private static final Duration DEFAULT_LOOP_INTERVAL =
        Duration.ofMillis(500);

    /** The database. */
    private Database database;

    /** The optional tick length. */
    private Duration loopInterval;

    /** The optional metrics reporter. */
    private QdbMetrics metrics;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the database shared with the workers.
     *
     * @param theDatabase the database, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder database(final Database theDatabase) {
      Objects.requireNonNull(theDatabase, "database must not be null");
      this.database = theDatabase;
      return this;
    }

    /**
     * Sets the tick length.
     *
     * @param theLoopInterval the interval, never null, must be positive
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if the interval is zero or negative
     */
    public Builder loopInterval(final Duration theLoopInterval) {
      Objects.requireNonNull(theLoopInterval,
          "loopInterval must not be null");
      if (theLoopInterval.isZero() || theLoopInterval.isNegative()) {
        throw new IllegalArgumentException(
            "loopInterval must be positive, got: " + theLoopInterval);
      }
      this.loopInterval = theLoopInterval;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metrics(final QdbMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Builds the application.
     *
     * @return a new application, never null
     *
     * @throws IllegalStateException if no database was set
     */
    public Application build() {
      if (database == null) {
        throw new IllegalStateException("database must be set");
      }
      final Duration resolvedInterval = loopInterval != null
          ? loopInterval : DEFAULT_LOOP_INTERVAL;
      final QdbMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopQdbMetrics();
      return new Application(database, resolvedInterval, resolvedMetrics);
    }
  }
}
