package org.waabox.qdb.client.rest;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.qdb.TransportException;
import org.waabox.qdb.client.DatabaseClient;
import org.waabox.qdb.model.Entity;
import org.waabox.qdb.model.Field;
import org.waabox.qdb.model.Notification;
import org.waabox.qdb.model.NotificationConfig;
import org.waabox.qdb.model.NotificationToken;

/**
 * {@link DatabaseClient} speaking JSON over HTTP to the qdb web runtime.
 *
 * <p>Uses {@code java.net.http.HttpClient} for the exchanges and
 * {@link ProtocolCodec} for the documents. The client identity obtained
 * from {@code GET {base}/make-client-id} is kept as a request template:
 * every call posts a copy of it to {@code {base}/api} with the request in
 * its {@code payload} member.
 *
 * <p>When the service answers that the identity is not authenticated, the
 * client authenticates again and resends, as many times as the
 * {@link org.waabox.qdb.RetryPolicy} allows.
 *
 * <p>Typical usage:
 * <pre>{@code
 * RestDatabaseClient client = new RestDatabaseClient(
 *     RestClientConfig.create("http://localhost:8080"));
 * Database database = new Database(client);
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RestDatabaseClient implements DatabaseClient {

  /** Logger for this class. */
  private static final Logger log =
      LoggerFactory.getLogger(RestDatabaseClient.class);

  /** HTTP 200 OK status code. */
  private static final int HTTP_OK = 200;

  /** The configuration, never null. */
  private final RestClientConfig config;

  /** The HTTP client, never null. */
  private final HttpClient httpClient;

  /** The client identity, null while not authenticated. */
  private volatile ObjectNode requestTemplate;

  /** False once an exchange failed at the network level. */
  private volatile boolean reachable = false;

  /**
   * Creates a new client with the given configuration.
   *
   * @param theConfig the REST configuration, never null
   */
  public RestDatabaseClient(final RestClientConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
    httpClient = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(config.requestTimeout())
        .build();
  }

  /** {@inheritDoc} */
  @Override
  public void connect() {
    authenticate();
  }

  /** {@inheritDoc} */
  @Override
  public boolean connected() {
    return requestTemplate != null && reachable;
  }

  /** {@inheritDoc} */
  @Override
  public boolean disconnect() {
    final boolean wasConnected = requestTemplate != null;
    requestTemplate = null;
    return wasConnected;
  }

  /** {@inheritDoc} */
  @Override
  public Entity getEntity(final String entityId) {
    Objects.requireNonNull(entityId, "entityId cannot be null");

    final ObjectNode payload = ProtocolCodec.payload("GetEntity");
    payload.put("entityId", entityId);

    final JsonNode response = send(payload);
    return ProtocolCodec.decodeEntity(
        ProtocolCodec.payloadMember(response, "entity"));
  }

  /** {@inheritDoc} */
  @Override
  public List<Entity> getEntities(final String entityType) {
    Objects.requireNonNull(entityType, "entityType cannot be null");

    final ObjectNode payload = ProtocolCodec.payload("GetEntities");
    payload.put("entityType", entityType);

    final JsonNode response = send(payload);
    final List<Entity> entities = new ArrayList<>();
    for (final JsonNode entity
        : ProtocolCodec.payloadArray(response, "entity")) {
      entities.add(ProtocolCodec.decodeEntity(entity));
    }
    return entities;
  }

  /**
   * {@inheritDoc}
   *
   * <p>The service answers one response per request, in request order.
   */
  @Override
  public void read(final List<Field> fields) {
    Objects.requireNonNull(fields, "fields cannot be null");
    if (fields.isEmpty()) {
      return;
    }

    final JsonNode response = send(databaseRequest("READ", fields, false));
    final ArrayNode responses = ProtocolCodec.payloadArray(response,
        "response");
    if (responses.size() != fields.size()) {
      throw new TransportException("Invalid response from server: expected "
          + fields.size() + " field responses, got " + responses.size());
    }
    for (int i = 0; i < fields.size(); i++) {
      ProtocolCodec.applyField(responses.get(i), fields.get(i));
    }
  }

  /** {@inheritDoc} */
  @Override
  public void write(final List<Field> fields) {
    Objects.requireNonNull(fields, "fields cannot be null");
    if (fields.isEmpty()) {
      return;
    }
    send(databaseRequest("WRITE", fields, true));
  }

  /** {@inheritDoc} */
  @Override
  public NotificationToken registerNotification(
      final NotificationConfig config) {
    Objects.requireNonNull(config, "config cannot be null");

    final ObjectNode payload = ProtocolCodec.payload("RegisterNotification");
    payload.putArray("requests").add(ProtocolCodec.encodeConfig(config));

    final ArrayNode tokens = ProtocolCodec.payloadArray(send(payload),
        "tokens");
    if (tokens.size() != 1 || !tokens.get(0).isTextual()) {
      throw new TransportException(
          "Invalid response from server: expected one token, got " + tokens);
    }
    return new NotificationToken(tokens.get(0).asText());
  }

  /** {@inheritDoc} */
  @Override
  public void unregisterNotification(final NotificationToken token) {
    Objects.requireNonNull(token, "token cannot be null");

    final ObjectNode payload =
        ProtocolCodec.payload("UnregisterNotification");
    payload.putArray("tokens").add(token.value());

    send(payload);
  }

  /** {@inheritDoc} */
  @Override
  public List<Notification> getNotifications() {
    final JsonNode response = send(
        ProtocolCodec.payload("GetNotifications"));

    final List<Notification> notifications = new ArrayList<>();
    for (final JsonNode notification
        : ProtocolCodec.payloadArray(response, "notifications")) {
      notifications.add(ProtocolCodec.decodeNotification(notification));
    }
    return notifications;
  }

  /**
   * Returns the configuration of this client.
   *
   * @return the configuration, never null
   */
  public RestClientConfig config() {
    return config;
  }

  /** Fetches a fresh client identity and keeps it as request template. */
  private void authenticate() {
    final HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(config.baseUrl() + "/make-client-id"))
        .timeout(config.requestTimeout())
        .GET()
        .build();

    final JsonNode identity = exchange(request);
    if (!identity.isObject()) {
      throw new TransportException(
          "Invalid response from server: client id is not an object");
    }
    requestTemplate = (ObjectNode) identity;
    log.debug("Authenticated against {}", config.baseUrl());
  }

  /**
   * Posts a payload, authenticating again while the service rejects the
   * client identity.
   *
   * @param payload the request payload, never null
   * @return the authenticated response, never null
   *
   * @throws TransportException if every attempt was rejected or an
   *                            exchange failed
   */
  private JsonNode send(final ObjectNode payload) {
    final int attempts = config.retryPolicy().maxAttempts();

    for (int attempt = 1; attempt <= attempts; attempt++) {
      ObjectNode template = requestTemplate;
      if (template == null) {
        authenticate();
        template = requestTemplate;
      }

      final ObjectNode body = template.deepCopy();
      body.set("payload", payload);

      final HttpRequest request = HttpRequest.newBuilder()
          .uri(URI.create(config.baseUrl() + "/api"))
          .timeout(config.requestTimeout())
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
          .build();

      final JsonNode response = exchange(request);
      if (ProtocolCodec.isAuthenticated(response)) {
        return response;
      }

      log.debug("Request rejected as unauthenticated, attempt {} of {}",
          attempt, attempts);
      requestTemplate = null;
      if (attempt < attempts) {
        pause(config.retryPolicy().backoff());
      }
    }

    throw new TransportException("Failed to authenticate");
  }

  /**
   * Performs one HTTP exchange and parses its JSON body.
   *
   * @param request the request, never null
   * @return the parsed body, never null
   *
   * @throws TransportException if the service cannot be reached, answers
   *                            with a non 200 status, or sends no JSON
   */
  private JsonNode exchange(final HttpRequest request) {
    final HttpResponse<String> response;
    try {
      response = httpClient.send(request,
          HttpResponse.BodyHandlers.ofString());
    } catch (final IOException e) {
      reachable = false;
      throw new TransportException("Failed to reach " + request.uri(), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException(
          "Interrupted while calling " + request.uri(), e);
    }
    reachable = true;

    if (response.statusCode() != HTTP_OK) {
      throw new TransportException(request.uri() + " responded with status "
          + response.statusCode());
    }
    return ProtocolCodec.parse(response.body());
  }

  private ObjectNode databaseRequest(final String requestType,
      final List<Field> fields, final boolean withValues) {
    final ObjectNode payload = ProtocolCodec.payload("Database");
    payload.put("requestType", requestType);
    final ArrayNode requests = payload.putArray("requests");
    for (final Field field : fields) {
      requests.add(ProtocolCodec.encodeFieldRequest(field, withValues));
    }
    return payload;
  }

  private static void pause(final Duration backoff) {
    if (backoff.isZero()) {
      return;
    }
    try {
      Thread.sleep(backoff.toMillis());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException("Interrupted while waiting to retry", e);
    }
  }
}
