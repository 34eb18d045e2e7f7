package io.clype.sqsbatcher.service;

import java.util.List;
import java.util.Map;

import io.clype.sqsbatcher.model.MessageAttribute;

import software.amazon.awssdk.core.SdkBytes;

/**
 * Approximates the wire size SQS charges a message against the batch payload limit.
 *
 * <p>The estimate is the UTF-8 size of the body plus, per attribute, the UTF-8 size of its
 * name, its data type label and its value, plus {@link #ATTRIBUTE_OVERHEAD_BYTES}. SQS remains
 * the authority on the real limit; a batch the estimate lets through can still be rejected.</p>
 */
public final class MessageSizeEstimator {

    /** SQS maximum message attributes per message. */
    public static final int MAX_ATTRIBUTES = 10;

    /** Approximate framing cost of one attribute on the wire. */
    public static final int ATTRIBUTE_OVERHEAD_BYTES = 50;

    private MessageSizeEstimator() {
    }

    /**
     * @throws IllegalArgumentException if there are more than {@value #MAX_ATTRIBUTES} attributes
     */
    public static void validateAttributeCount(Map<String, MessageAttribute> attributes) {
        if (attributes != null && attributes.size() > MAX_ATTRIBUTES) {
            throw new IllegalArgumentException(
                    "SQS allows a maximum of " + MAX_ATTRIBUTES + " message attributes, got " + attributes.size());
        }
    }

    public static long estimate(String body, Map<String, MessageAttribute> attributes) {
        long size = utf8Length(body);
        if (attributes == null) {
            return size;
        }
        for (Map.Entry<String, MessageAttribute> entry : attributes.entrySet()) {
            MessageAttribute attribute = entry.getValue();
            size += utf8Length(entry.getKey());
            size += utf8Length(attribute.dataType());
            size += valueLength(attribute);
            size += ATTRIBUTE_OVERHEAD_BYTES;
        }
        return size;
    }

    private static long valueLength(MessageAttribute attribute) {
        if (attribute.stringValue() != null) {
            return utf8Length(attribute.stringValue());
        }
        if (attribute.binaryValue() != null) {
            return attribute.binaryValue().asByteArrayUnsafe().length;
        }
        if (attribute.stringListValues() != null) {
            long size = 0;
            for (String value : attribute.stringListValues()) {
                size += utf8Length(value);
            }
            return size;
        }
        long size = 0;
        List<SdkBytes> values = attribute.binaryListValues();
        for (SdkBytes value : values) {
            size += value.asByteArrayUnsafe().length;
        }
        return size;
    }

    /**
     * Exact UTF-8 encoded size without allocating a byte array.
     * Surrogate pairs encode to 4 bytes; a lone surrogate is replaced by '?' when encoding.
     */
    static long utf8Length(String str) {
        if (str == null) {
            return 0;
        }
        int len = str.length();
        long size = 0;
        for (int i = 0; i < len; i++) {
            char c = str.charAt(i);
            if (c < 0x80) {
                size += 1;
            } else if (c < 0x800) {
                size += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < len && Character.isLowSurrogate(str.charAt(i + 1))) {
                size += 4;
                i++;
            } else if (Character.isSurrogate(c)) {
                size += 1;
            } else {
                size += 3;
            }
        }
        return size;
    }
}
