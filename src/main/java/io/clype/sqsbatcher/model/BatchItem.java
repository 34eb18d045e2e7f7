package io.clype.sqsbatcher.model;

import java.util.Map;
import java.util.Objects;

/**
 * A message accepted into a buffer: its id is resolved and its size estimate fixed.
 *
 * @param id            entry id, unique within the pending batch
 * @param body          message body
 * @param attributes    message attributes
 * @param options       per-entry SQS fields
 * @param estimatedSize size estimate charged against the batch byte limit
 */
public record BatchItem(
    String id,
    String body,
    Map<String, MessageAttribute> attributes,
    EntryOptions options,
    long estimatedSize
) {

    public BatchItem {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(body, "body cannot be null");
        attributes = attributes != null ? attributes : Map.of();
        options = options != null ? options : EntryOptions.none();
    }
}
