package org.waabox.qdb.metrics;

/**
 * An abstraction for recording operational metrics of the qdb client.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or Prometheus. Use {@link NoopQdbMetrics} when metrics
 * collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface QdbMetrics {

  /**
   * Records a change of the database connection status.
   *
   * @param connected the new status
   */
  void connectionChanged(boolean connected);

  /**
   * Records a failed attempt to connect to the database.
   *
   * @param cause the failure, never null
   */
  void connectionAttemptFailed(Throwable cause);

  /**
   * Records a batch of notifications handed to listeners.
   *
   * @param delivered the number of notifications delivered
   * @param unknown   the number of notifications for unknown tokens
   */
  void notificationsDispatched(int delivered, int unknown);

  /**
   * Records a worker failure during a tick.
   *
   * @param workerName the failing worker, never null
   * @param cause      the failure, never null
   */
  void workerFailed(String workerName, Throwable cause);
}
