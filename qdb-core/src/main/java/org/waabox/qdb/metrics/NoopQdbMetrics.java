package org.waabox.qdb.metrics;

/**
 * A no-operation implementation of {@link QdbMetrics}.
 *
 * <p>Use this implementation when metrics collection is not required or
 * during testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopQdbMetrics implements QdbMetrics {

  /** {@inheritDoc} */
  @Override
  public void connectionChanged(final boolean connected) {
  }

  /** {@inheritDoc} */
  @Override
  public void connectionAttemptFailed(final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void notificationsDispatched(final int delivered,
      final int unknown) {
  }

  /** {@inheritDoc} */
  @Override
  public void workerFailed(final String workerName, final Throwable cause) {
  }
}
