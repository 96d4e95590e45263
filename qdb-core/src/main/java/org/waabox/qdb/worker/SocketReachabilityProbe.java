package org.waabox.qdb.worker;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ReachabilityProbe} that opens a TCP connection to a host.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SocketReachabilityProbe implements ReachabilityProbe {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SocketReachabilityProbe.class);

  /** The host to reach, never null. */
  private final String host;

  /** The port to reach. */
  private final int port;

  /** The connect timeout in milliseconds. */
  private final int timeoutMillis;

  /**
   * Creates a probe.
   *
   * @param theHost    the host, never null
   * @param thePort    the port, between 1 and 65535
   * @param theTimeout the connect timeout, never null, must be positive
   */
  public SocketReachabilityProbe(final String theHost, final int thePort,
      final Duration theTimeout) {
    Objects.requireNonNull(theHost, "host cannot be null");
    Objects.requireNonNull(theTimeout, "timeout cannot be null");
    if (thePort < 1 || thePort > 65535) {
      throw new IllegalArgumentException("Invalid port: " + thePort);
    }
    if (theTimeout.isZero() || theTimeout.isNegative()) {
      throw new IllegalArgumentException(
          "timeout must be positive, got: " + theTimeout);
    }
    host = theHost;
    port = thePort;
    timeoutMillis = (int) theTimeout.toMillis();
  }

  /**
   * Creates a probe for the host and port of a service URL.
   *
   * <p>Without an explicit port, 443 is used for https and 80 otherwise.
   *
   * @param url     the service URL, never null
   * @param timeout the connect timeout, never null
   *
   * @return the probe, never null
   */
  public static SocketReachabilityProbe forUrl(final String url,
      final Duration timeout) {
    Objects.requireNonNull(url, "url cannot be null");
    final URI uri = URI.create(url);
    if (uri.getHost() == null) {
      throw new IllegalArgumentException("url has no host: " + url);
    }
    int port = uri.getPort();
    if (port == -1) {
      port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }
    return new SocketReachabilityProbe(uri.getHost(), port, timeout);
  }

  /** {@inheritDoc} */
  @Override
  public boolean isReachable() {
    try (Socket socket = new Socket()) {
      socket.connect(new InetSocketAddress(host, port), timeoutMillis);
      return true;
    } catch (final IOException e) {
      log.debug("{}:{} is not reachable: {}", host, port, e.getMessage());
      return false;
    }
  }

  /**
   * Returns the probed host.
   *
   * @return the host, never null
   */
  public String host() {
    return host;
  }

  /**
   * Returns the probed port.
   *
   * @return the port
   */
  public int port() {
    return port;
  }
}
