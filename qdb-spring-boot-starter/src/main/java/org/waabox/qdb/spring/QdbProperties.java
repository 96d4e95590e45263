package org.waabox.qdb.spring;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for qdb, mapped from the {@code qdb.*} prefix
 * in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code qdb.url} - the web runtime base URL.</li>
 *   <li>{@code qdb.loop-interval} - the scheduler tick length.</li>
 *   <li>{@code qdb.request-timeout} - the timeout of one HTTP exchange.</li>
 *   <li>{@code qdb.auth-attempts} - how many times a request is sent
 *       while the service rejects the client identity.</li>
 *   <li>{@code qdb.auto-start} - whether the scheduler starts with the
 *       application context.</li>
 *   <li>{@code qdb.network-probe.enabled} and
 *       {@code qdb.network-probe.timeout} - the optional TCP
 *       reachability monitor.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "qdb")
public class QdbProperties {

  /** The web runtime base URL. */
  private String url = "http://localhost:8080";

  /** The scheduler tick length. */
  private Duration loopInterval = Duration.ofMillis(500);

  /** The timeout of one HTTP exchange. */
  private Duration requestTimeout = Duration.ofSeconds(5);

  /** The number of attempts of an unauthenticated request. */
  private int authAttempts = 3;

  /** Whether the scheduler starts with the context. */
  private boolean autoStart = true;

  /** The reachability monitor settings. */
  private final NetworkProbe networkProbe = new NetworkProbe();

  public String getUrl() {
    return url;
  }

  public void setUrl(final String url) {
    this.url = url;
  }

  public Duration getLoopInterval() {
    return loopInterval;
  }

  public void setLoopInterval(final Duration loopInterval) {
    this.loopInterval = loopInterval;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public void setRequestTimeout(final Duration requestTimeout) {
    this.requestTimeout = requestTimeout;
  }

  public int getAuthAttempts() {
    return authAttempts;
  }

  public void setAuthAttempts(final int authAttempts) {
    this.authAttempts = authAttempts;
  }

  public boolean isAutoStart() {
    return autoStart;
  }

  public void setAutoStart(final boolean autoStart) {
    this.autoStart = autoStart;
  }

  public NetworkProbe getNetworkProbe() {
    return networkProbe;
  }

  /** Settings of the TCP reachability monitor. */
  public static class NetworkProbe {

    /** Whether a NetworkWorker watches the service host. */
    private boolean enabled = false;

    /** The TCP connect timeout of one probe. */
    private Duration timeout = Duration.ofSeconds(1);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(final boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(final Duration timeout) {
      this.timeout = timeout;
    }
  }
}
