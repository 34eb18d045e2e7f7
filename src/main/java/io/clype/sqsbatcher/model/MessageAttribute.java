package io.clype.sqsbatcher.model;

import java.util.List;
import java.util.Objects;

import software.amazon.awssdk.core.SdkBytes;

/**
 * A typed SQS message attribute value.
 *
 * <p>Exactly one of the value fields is set. The {@code dataType} label is sent as-is
 * (e.g. {@code String}, {@code Number}, {@code Binary}, {@code String.custom}) and
 * counts toward the size estimate.</p>
 *
 * @param dataType         the declared SQS data type label
 * @param stringValue      textual value, or null
 * @param binaryValue      binary value, or null
 * @param stringListValues textual list value, or null
 * @param binaryListValues binary list value, or null
 */
public record MessageAttribute(
    String dataType,
    String stringValue,
    SdkBytes binaryValue,
    List<String> stringListValues,
    List<SdkBytes> binaryListValues
) {

    public MessageAttribute {
        Objects.requireNonNull(dataType, "dataType cannot be null");
        int populated = (stringValue != null ? 1 : 0)
                + (binaryValue != null ? 1 : 0)
                + (stringListValues != null ? 1 : 0)
                + (binaryListValues != null ? 1 : 0);
        if (populated != 1) {
            throw new IllegalArgumentException("Exactly one attribute value must be set, found " + populated);
        }
        stringListValues = stringListValues != null ? List.copyOf(stringListValues) : null;
        binaryListValues = binaryListValues != null ? List.copyOf(binaryListValues) : null;
    }

    public static MessageAttribute string(String value) {
        return new MessageAttribute("String", value, null, null, null);
    }

    public static MessageAttribute number(String value) {
        return new MessageAttribute("Number", value, null, null, null);
    }

    public static MessageAttribute binary(SdkBytes value) {
        return new MessageAttribute("Binary", null, value, null, null);
    }

    public static MessageAttribute stringList(String dataType, List<String> values) {
        return new MessageAttribute(dataType, null, null, values, null);
    }

    public static MessageAttribute binaryList(String dataType, List<SdkBytes> values) {
        return new MessageAttribute(dataType, null, null, null, values);
    }
}
