package org.waabox.qdb.worker;

/**
 * Tells whether the service can be reached over the network.
 *
 * <p>Implementations must not throw: an unreachable service is reported
 * as {@code false}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ReachabilityProbe {

  /**
   * Probes the network.
   *
   * @return true if the service is reachable
   */
  boolean isReachable();
}
