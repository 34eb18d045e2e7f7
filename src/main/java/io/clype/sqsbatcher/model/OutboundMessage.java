package io.clype.sqsbatcher.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message handed to the batcher by the caller.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * OutboundMessage message = new OutboundMessage(
 *     null,                                            // id - generated when null
 *     "{\"orderId\": 42}",                             // body
 *     Map.of("type", MessageAttribute.string("order")),
 *     EntryOptions.fifo("order-42", "order-42-created")
 * );
 * }</pre>
 *
 * @param id         batch entry id, or null to have one generated
 * @param body       message body
 * @param attributes message attributes in insertion order (max 10)
 * @param options    per-entry SQS fields
 */
public record OutboundMessage(
    String id,
    String body,
    Map<String, MessageAttribute> attributes,
    EntryOptions options
) {

    public OutboundMessage {
        Objects.requireNonNull(body, "body cannot be null");
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        options = options != null ? options : EntryOptions.none();
    }

    public static OutboundMessage of(String body) {
        return new OutboundMessage(null, body, null, null);
    }

    public static OutboundMessage of(String body, Map<String, MessageAttribute> attributes) {
        return new OutboundMessage(null, body, attributes, null);
    }
}
