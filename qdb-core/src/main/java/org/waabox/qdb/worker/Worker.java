package org.waabox.qdb.worker;

import org.waabox.qdb.ApplicationContext;

/**
 * A unit of work driven by the {@link org.waabox.qdb.Application} loop.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #initialize(ApplicationContext)} once, before the loop</li>
 *   <li>{@link #doWork(ApplicationContext)} once per tick, in registration
 *       order, followed by {@link #processEvents()} on every worker</li>
 *   <li>{@link #deinitialize(ApplicationContext)} once, after the loop</li>
 * </ol>
 *
 * <p>All calls happen on the scheduler thread, one worker at a time. An
 * exception thrown by any of them is logged by the scheduler and never
 * stops the loop.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface Worker {

  /**
   * Returns the name used in log messages.
   *
   * @return the worker name, never null
   */
  default String name() {
    return getClass().getSimpleName();
  }

  /**
   * Prepares the worker before the first tick.
   *
   * @param ctx the application context, never null
   */
  void initialize(ApplicationContext ctx);

  /**
   * Performs one tick of work.
   *
   * @param ctx the application context, never null
   */
  void doWork(ApplicationContext ctx);

  /**
   * Releases resources after the last tick.
   *
   * @param ctx the application context, never null
   */
  void deinitialize(ApplicationContext ctx);

  /**
   * Consumes events other workers emitted during the tick.
   *
   * <p>The default implementation does nothing.
   */
  default void processEvents() {
  }
}
