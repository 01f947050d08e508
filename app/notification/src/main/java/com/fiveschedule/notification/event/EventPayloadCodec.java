/*
 * Where: event bus wire format
 * What: converts EventPayload to and from a JSON object with an ISO-8601 timestamp
 * Why: the transport carries opaque bytes; both sides need one stable shape
 */
package com.fiveschedule.notification.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ObjectMapper is the shared Spring-managed instance")
public class EventPayloadCodec {

  static final String FIELD_EVENT_TYPE = "event_type";
  static final String FIELD_USER_ID = "user_id";
  static final String FIELD_DATA = "data";
  static final String FIELD_TIMESTAMP = "timestamp";

  private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public byte[] encode(EventPayload payload) throws MalformedEventException {
    ObjectNode root = objectMapper.createObjectNode();
    root.put(FIELD_EVENT_TYPE, payload.eventType().wireName());
    root.put(FIELD_USER_ID, payload.userId());
    root.set(FIELD_DATA, objectMapper.valueToTree(payload.data()));
    root.put(FIELD_TIMESTAMP, payload.timestamp().toString());
    try {
      return objectMapper.writeValueAsBytes(root);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw new MalformedEventException("event payload is not serializable type=" + payload.eventType(), ex);
    }
  }

  public EventPayload decode(byte[] body) throws MalformedEventException {
    if (body == null || body.length == 0) {
      throw new MalformedEventException("empty event body");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (IOException ex) {
      throw new MalformedEventException("event body is not json", ex);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedEventException("event body is not a json object");
    }
    String wireName = textField(root, FIELD_EVENT_TYPE);
    EventType eventType = EventType.fromWireName(wireName)
        .orElseThrow(() -> new MalformedEventException("unknown event type " + wireName));
    String userId = textField(root, FIELD_USER_ID);
    Instant timestamp;
    try {
      timestamp = Instant.parse(textField(root, FIELD_TIMESTAMP));
    } catch (DateTimeParseException ex) {
      throw new MalformedEventException("invalid event timestamp", ex);
    }
    JsonNode dataNode = root.get(FIELD_DATA);
    Map<String, Object> data;
    if (dataNode == null || dataNode.isNull()) {
      data = Map.of();
    } else if (dataNode.isObject()) {
      data = objectMapper.convertValue(dataNode, DATA_TYPE);
    } else {
      throw new MalformedEventException("event data must be an object");
    }
    return new EventPayload(eventType, userId, data, timestamp);
  }

  private String textField(JsonNode root, String field) throws MalformedEventException {
    JsonNode node = root.get(field);
    if (node == null || !node.isTextual() || node.asText().isBlank()) {
      throw new MalformedEventException("missing event field " + field);
    }
    return node.asText();
  }
}
