package org.waabox.qdb.client.rest;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

import org.waabox.qdb.RetryPolicy;

/**
 * Configuration holder for the REST transport.
 *
 * <p>Holds the service base URL, the timeout applied to every HTTP
 * exchange, and the {@link RetryPolicy} used when the service answers a
 * request as unauthenticated.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RestClientConfig {

  /** The default timeout of one HTTP exchange. */
  private static final Duration DEFAULT_REQUEST_TIMEOUT =
      Duration.ofSeconds(5);

  /** The service base URL without a trailing slash. */
  private final String baseUrl;

  /** The timeout of one HTTP exchange. */
  private final Duration requestTimeout;

  /** The authentication retry policy. */
  private final RetryPolicy retryPolicy;

  /** Private constructor; use the static factory methods instead. */
  private RestClientConfig(final String baseUrl,
      final Duration requestTimeout, final RetryPolicy retryPolicy) {
    this.baseUrl = baseUrl;
    this.requestTimeout = requestTimeout;
    this.retryPolicy = retryPolicy;
  }

  /**
   * Creates a configuration with a 5 second timeout and the default
   * retry policy.
   *
   * @param baseUrl the service base URL, never null
   * @return a new {@link RestClientConfig} instance, never null
   */
  public static RestClientConfig create(final String baseUrl) {
    return create(baseUrl, DEFAULT_REQUEST_TIMEOUT,
        RetryPolicy.defaultPolicy());
  }

  /**
   * Creates a configuration.
   *
   * @param baseUrl        the service base URL, never null
   * @param requestTimeout the timeout of one HTTP exchange, never null,
   *                       must be positive
   * @param retryPolicy    the authentication retry policy, never null
   * @return a new {@link RestClientConfig} instance, never null
   *
   * @throws IllegalArgumentException if the URL is not an absolute http
   *                                  or https URL, or the timeout is not
   *                                  positive
   */
  public static RestClientConfig create(final String baseUrl,
      final Duration requestTimeout, final RetryPolicy retryPolicy) {
    Objects.requireNonNull(baseUrl, "baseUrl cannot be null");
    Objects.requireNonNull(requestTimeout, "requestTimeout cannot be null");
    Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");

    final URI uri = URI.create(baseUrl);
    if (!"http".equalsIgnoreCase(uri.getScheme())
        && !"https".equalsIgnoreCase(uri.getScheme())) {
      throw new IllegalArgumentException(
          "baseUrl must be an http or https URL, got: " + baseUrl);
    }
    if (requestTimeout.isZero() || requestTimeout.isNegative()) {
      throw new IllegalArgumentException(
          "requestTimeout must be positive, got: " + requestTimeout);
    }

    String normalized = baseUrl;
    while (normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return new RestClientConfig(normalized, requestTimeout, retryPolicy);
  }

  /**
   * Returns the service base URL.
   *
   * @return the URL without a trailing slash, never null
   */
  public String baseUrl() {
    return baseUrl;
  }

  /**
   * Returns the timeout of one HTTP exchange.
   *
   * @return the timeout, never null
   */
  public Duration requestTimeout() {
    return requestTimeout;
  }

  /**
   * Returns the authentication retry policy.
   *
   * @return the retry policy, never null
   */
  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }
}
