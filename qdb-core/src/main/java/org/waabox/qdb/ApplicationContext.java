package org.waabox.qdb;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * What the {@link Application} shares with its workers: the database and
 * the quit flag.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ApplicationContext {

  /** The database, never null. */
  private final Database database;

  /** Set once the loop must stop. */
  private final AtomicBoolean quit = new AtomicBoolean(false);

  /**
   * Creates a context.
   *
   * @param theDatabase the database, never null
   */
  public ApplicationContext(final Database theDatabase) {
    database = Objects.requireNonNull(theDatabase, "database cannot be null");
  }

  /**
   * Returns the database shared by every worker.
   *
   * @return the database, never null
   */
  public Database database() {
    return database;
  }

  /**
   * Asks the loop to stop after the current tick. Safe from any thread.
   */
  public void requestQuit() {
    quit.set(true);
  }

  /**
   * Returns whether the loop was asked to stop.
   *
   * @return true once {@link #requestQuit()} was called
   */
  public boolean quitRequested() {
    return quit.get();
  }
}
