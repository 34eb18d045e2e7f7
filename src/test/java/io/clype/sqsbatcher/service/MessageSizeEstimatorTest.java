package io.clype.sqsbatcher.service;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.clype.sqsbatcher.model.MessageAttribute;

import software.amazon.awssdk.core.SdkBytes;

import static io.clype.sqsbatcher.service.MessageSizeEstimator.ATTRIBUTE_OVERHEAD_BYTES;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MessageSizeEstimatorTest {

    @Test
    void testBodyOnly() {
        assertEquals(5, MessageSizeEstimator.estimate("hello", Map.of()));
    }

    @Test
    void testNullAttributesCountsBodyOnly() {
        assertEquals(5, MessageSizeEstimator.estimate("hello", null));
    }

    @Test
    void testMultiByteBodyUsesUtf8Length() {
        String body = "héllo € 😀";
        assertEquals(body.getBytes(StandardCharsets.UTF_8).length, MessageSizeEstimator.estimate(body, Map.of()));
    }

    @Test
    void testStringAttribute() {
        long size = MessageSizeEstimator.estimate("hi", Map.of("a", MessageAttribute.string("b")));

        assertEquals(2 + 1 + "String".length() + 1 + ATTRIBUTE_OVERHEAD_BYTES, size);
    }

    @Test
    void testBinaryAttributeCountsRawBytes() {
        Map<String, MessageAttribute> attrs = Map.of("bin",
                MessageAttribute.binary(SdkBytes.fromByteArray(new byte[] {0x00, 0x01})));

        long size = MessageSizeEstimator.estimate("hi", attrs);

        assertEquals(2 + 3 + "Binary".length() + 2 + ATTRIBUTE_OVERHEAD_BYTES, size);
    }

    @Test
    void testStringListAttributeSumsElements() {
        Map<String, MessageAttribute> attrs = Map.of("tags",
                MessageAttribute.stringList("String", List.of("ab", "é")));

        long size = MessageSizeEstimator.estimate("", attrs);

        assertEquals(4 + "String".length() + 2 + 2 + ATTRIBUTE_OVERHEAD_BYTES, size);
    }

    @Test
    void testBinaryListAttributeSumsElements() {
        Map<String, MessageAttribute> attrs = Map.of("blobs", MessageAttribute.binaryList("Binary",
                List.of(SdkBytes.fromByteArray(new byte[3]), SdkBytes.fromByteArray(new byte[4]))));

        long size = MessageSizeEstimator.estimate("", attrs);

        assertEquals(5 + "Binary".length() + 7 + ATTRIBUTE_OVERHEAD_BYTES, size);
    }

    @Test
    void testOverheadChargedPerAttribute() {
        Map<String, MessageAttribute> attrs = new LinkedHashMap<>();
        attrs.put("x", MessageAttribute.number("1"));
        attrs.put("y", MessageAttribute.number("2"));

        long size = MessageSizeEstimator.estimate("", attrs);

        assertEquals(2 * (1 + "Number".length() + 1 + ATTRIBUTE_OVERHEAD_BYTES), size);
    }

    @Test
    void testTenAttributesAllowed() {
        assertDoesNotThrow(() -> MessageSizeEstimator.validateAttributeCount(attributes(10)));
    }

    @Test
    void testElevenAttributesRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> MessageSizeEstimator.validateAttributeCount(attributes(11)));
        assertEquals("SQS allows a maximum of 10 message attributes, got 11", ex.getMessage());
    }

    @Test
    void testUtf8LengthHandlesLoneSurrogate() {
        String lone = "a\uD83D";
        assertEquals(lone.getBytes(StandardCharsets.UTF_8).length, MessageSizeEstimator.utf8Length(lone));
    }

    static Map<String, MessageAttribute> attributes(int count) {
        Map<String, MessageAttribute> attrs = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            attrs.put("a" + i, MessageAttribute.string("x"));
        }
        return attrs;
    }
}
