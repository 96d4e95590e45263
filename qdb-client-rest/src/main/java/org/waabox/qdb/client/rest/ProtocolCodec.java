package org.waabox.qdb.client.rest;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.qdb.TransportException;
import org.waabox.qdb.model.Entity;
import org.waabox.qdb.model.Field;
import org.waabox.qdb.model.Notification;
import org.waabox.qdb.model.NotificationConfig;
import org.waabox.qdb.model.NotificationToken;
import org.waabox.qdb.model.Value;
import org.waabox.qdb.model.ValueType;

/**
 * Static utility class translating between the model and the JSON
 * documents of the qdb web runtime.
 *
 * <p>Uses Jackson's tree model ({@link JsonNode}). Shapes:
 * <ul>
 *   <li>value: {@code {"@type": <wire tag>, "raw": <json>}}; timestamps
 *       travel as ISO-8601 strings;</li>
 *   <li>field: {@code {"id", "field", "value", "writeTime",
 *       "writerId"}};</li>
 *   <li>entity: {@code {"id", "type", "name"}};</li>
 *   <li>notification config: {@code {"id", "type", "field",
 *       "notifyOnChange", "context": [names]}};</li>
 *   <li>notification: {@code {"token", "current", "previous",
 *       "context": [fields]}}.</li>
 * </ul>
 *
 * <p>Every decoding failure is reported as a {@link TransportException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ProtocolCodec {

  /** The payload type prefix of every runtime request. */
  static final String REQUEST_TYPE_PREFIX =
      "type.googleapis.com/qdb.WebRuntime";

  /** The status the service reports for an authenticated client. */
  private static final String AUTHENTICATED = "AUTHENTICATED";

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private ProtocolCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Parses a response body.
   *
   * @param body the body text, never null
   * @return the parsed document, never null
   *
   * @throws TransportException if the body is not JSON
   */
  public static JsonNode parse(final String body) {
    Objects.requireNonNull(body, "body cannot be null");
    try {
      final JsonNode node = MAPPER.readTree(body);
      if (node == null || node.isMissingNode()) {
        throw new TransportException("Invalid response from server: empty");
      }
      return node;
    } catch (final TransportException e) {
      throw e;
    } catch (final Exception e) {
      throw new TransportException(
          "Invalid response from server: not JSON", e);
    }
  }

  /**
   * Creates the payload of a runtime request.
   *
   * @param requestName the request name, e.g. {@code GetEntity}
   * @return a payload carrying its {@code @type}, never null
   */
  public static ObjectNode payload(final String requestName) {
    final ObjectNode payload = MAPPER.createObjectNode();
    payload.put("@type", REQUEST_TYPE_PREFIX + requestName + "Request");
    return payload;
  }

  /**
   * Tells whether the service accepted the client identity of a request.
   *
   * @param response the response document, never null
   * @return true if {@code header.authenticationStatus} is
   *     {@code AUTHENTICATED}
   */
  public static boolean isAuthenticated(final JsonNode response) {
    return AUTHENTICATED.equals(
        response.path("header").path("authenticationStatus").asText(""));
  }

  /**
   * Returns a member of the response payload.
   *
   * @param response the response document, never null
   * @param member   the payload member name, never null
   * @return the member, never null
   *
   * @throws TransportException if the payload or the member is missing
   */
  public static JsonNode payloadMember(final JsonNode response,
      final String member) {
    final JsonNode payload = response.get("payload");
    if (payload == null || !payload.isObject()) {
      throw new TransportException("Invalid response from server: no payload");
    }
    return require(payload, member);
  }

  /**
   * Returns an array member of the response payload.
   *
   * @param response the response document, never null
   * @param member   the payload member name, never null
   * @return the array, never null
   *
   * @throws TransportException if the member is missing or not an array
   */
  public static ArrayNode payloadArray(final JsonNode response,
      final String member) {
    final JsonNode node = payloadMember(response, member);
    if (!node.isArray()) {
      throw new TransportException("Invalid response from server: "
          + member + " is not an array");
    }
    return (ArrayNode) node;
  }

  /**
   * Encodes a value.
   *
   * @param value the value, never null
   * @return the JSON value, never null
   */
  public static ObjectNode encodeValue(final Value value) {
    Objects.requireNonNull(value, "value cannot be null");
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("@type", value.type().wireTag());
    switch (value.type()) {
      case UNSPECIFIED -> { }
      case INTEGER -> node.put("raw", value.asInteger());
      case FLOAT -> node.put("raw", value.asFloat());
      case BOOLEAN -> node.put("raw", value.asBoolean());
      case TIMESTAMP -> node.put("raw", value.asTimestamp().toString());
      default -> node.put("raw", (String) value.content());
    }
    return node;
  }

  /**
   * Decodes a value. A missing, null or untyped node is unspecified.
   *
   * @param node the JSON value, may be null
   * @return the value, never null
   *
   * @throws TransportException if the tag is unknown or the raw content
   *                            does not fit it
   */
  public static Value decodeValue(final JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return Value.unspecified();
    }
    if (!node.isObject()) {
      throw new TransportException(
          "Invalid response from server: value is not an object");
    }
    final String tag = node.path("@type").asText("");

    final ValueType type;
    try {
      type = ValueType.fromWireTag(tag);
    } catch (final IllegalArgumentException e) {
      throw new TransportException(
          "Invalid response from server: unknown value type " + tag, e);
    }
    if (type == ValueType.UNSPECIFIED) {
      return Value.unspecified();
    }

    final JsonNode raw = require(node, "raw");
    return switch (type) {
      case STRING -> Value.ofString(text(raw, tag));
      case INTEGER -> Value.ofInteger(integer(raw, tag));
      case FLOAT -> Value.ofFloat(number(raw, tag));
      case BOOLEAN -> Value.ofBoolean(bool(raw, tag));
      case ENTITY_REFERENCE -> Value.ofEntityReference(text(raw, tag));
      case TIMESTAMP -> Value.ofTimestamp(instant(raw));
      case CONNECTION_STATE -> Value.ofConnectionState(text(raw, tag));
      case GARAGE_DOOR_STATE -> Value.ofGarageDoorState(text(raw, tag));
      default -> Value.unspecified();
    };
  }

  /**
   * Encodes the address of a field, and its value when writing.
   *
   * @param field     the field, never null
   * @param withValue true to include the value
   * @return the JSON request, never null
   */
  public static ObjectNode encodeFieldRequest(final Field field,
      final boolean withValue) {
    Objects.requireNonNull(field, "field cannot be null");
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("id", field.entityId());
    node.put("field", field.name());
    if (withValue) {
      node.set("value", encodeValue(field.value()));
    }
    return node;
  }

  /**
   * Copies the value, write time and writer of a field response into a
   * field.
   *
   * @param node   the field response, never null
   * @param target the field to fill in, never null
   *
   * @throws TransportException if the response is malformed
   */
  public static void applyField(final JsonNode node, final Field target) {
    Objects.requireNonNull(target, "target cannot be null");
    if (node == null || !node.isObject()) {
      throw new TransportException(
          "Invalid response from server: field is not an object");
    }
    target.updateValue(decodeValue(node.get("value")));
    final JsonNode writeTime = node.get("writeTime");
    if (writeTime != null && !writeTime.isNull()) {
      target.updateWriteTime(instant(writeTime));
    }
    target.updateWriterId(node.path("writerId").asText(""));
  }

  /**
   * Decodes a field.
   *
   * @param node the field JSON, never null
   * @return the field, never null
   *
   * @throws TransportException if the JSON is malformed
   */
  public static Field decodeField(final JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new TransportException(
          "Invalid response from server: field is not an object");
    }
    final Field field = Field.of(require(node, "id").asText(),
        require(node, "field").asText());
    applyField(node, field);
    return field;
  }

  /**
   * Decodes an entity.
   *
   * @param node the entity JSON, never null
   * @return the entity, never null
   *
   * @throws TransportException if the JSON is malformed
   */
  public static Entity decodeEntity(final JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new TransportException(
          "Invalid response from server: entity is not an object");
    }
    return new Entity(require(node, "id").asText(),
        require(node, "type").asText(),
        require(node, "name").asText());
  }

  /**
   * Encodes a notification configuration.
   *
   * @param config the configuration, never null
   * @return the JSON request, never null
   */
  public static ObjectNode encodeConfig(final NotificationConfig config) {
    Objects.requireNonNull(config, "config cannot be null");
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("id", config.entityId());
    node.put("type", config.entityType());
    node.put("field", config.field());
    node.put("notifyOnChange", config.notifyOnChange());
    final ArrayNode context = node.putArray("context");
    config.context().forEach(context::add);
    return node;
  }

  /**
   * Decodes a notification.
   *
   * @param node the notification JSON, never null
   * @return the notification, never null
   *
   * @throws TransportException if the JSON is malformed
   */
  public static Notification decodeNotification(final JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new TransportException(
          "Invalid response from server: notification is not an object");
    }
    final NotificationToken token =
        new NotificationToken(require(node, "token").asText());
    final Field current = decodeField(require(node, "current"));
    final Field previous = decodeField(require(node, "previous"));

    final List<Field> context = new ArrayList<>();
    final JsonNode contextNode = node.get("context");
    if (contextNode != null && contextNode.isArray()) {
      for (final JsonNode field : contextNode) {
        context.add(decodeField(field));
      }
    }
    return new Notification(token, current, previous, context);
  }

  /** Returns a member or throws if missing. */
  private static JsonNode require(final JsonNode node, final String key) {
    final JsonNode value = node.get(key);
    if (value == null || value.isNull()) {
      throw new TransportException(
          "Invalid response from server: no " + key + " key");
    }
    return value;
  }

  private static String text(final JsonNode raw, final String tag) {
    if (!raw.isTextual()) {
      throw mismatch(raw, tag);
    }
    return raw.asText();
  }

  private static long integer(final JsonNode raw, final String tag) {
    if (raw.isIntegralNumber()) {
      return raw.asLong();
    }
    if (raw.isTextual()) {
      try {
        return Long.parseLong(raw.asText());
      } catch (final NumberFormatException e) {
        throw mismatch(raw, tag);
      }
    }
    throw mismatch(raw, tag);
  }

  private static double number(final JsonNode raw, final String tag) {
    if (!raw.isNumber()) {
      throw mismatch(raw, tag);
    }
    return raw.asDouble();
  }

  private static boolean bool(final JsonNode raw, final String tag) {
    if (!raw.isBoolean()) {
      throw mismatch(raw, tag);
    }
    return raw.asBoolean();
  }

  private static Instant instant(final JsonNode raw) {
    try {
      return Instant.parse(raw.asText());
    } catch (final DateTimeParseException e) {
      throw new TransportException(
          "Invalid response from server: bad timestamp " + raw, e);
    }
  }

  private static TransportException mismatch(final JsonNode raw,
      final String tag) {
    return new TransportException("Invalid response from server: " + raw
        + " does not fit " + tag);
  }
}
