package io.timecapsule4j.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapsuleCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    record Order(String id, int quantity, List<String> tags) {
    }

    @Test
    void decodeShouldRestoreEncodedCapsule() {
        CapsuleCodec<Order> codec = new CapsuleCodec<>(objectMapper, Order.class);
        TimeCapsule<Order> capsule = new TimeCapsule<>(new Order("A-1", 3, List.of("x", "y")), 1_700_000_000_000L);

        TimeCapsule<Order> decoded = codec.decode(codec.encode(capsule));

        assertEquals(capsule, decoded);
        assertEquals(0L, decoded.dugOutAt());
    }

    @Test
    void encodeShouldBeMemoizedPerInstance() {
        CapsuleCodec<String> codec = new CapsuleCodec<>(objectMapper, String.class);
        TimeCapsule<String> capsule = new TimeCapsule<>("hello", 42L);

        String first = codec.encode(capsule);
        String second = codec.encode(capsule);

        assertSame(first, second);
    }

    @Test
    void reencodingDecodedCapsuleShouldReturnOriginalString() {
        CapsuleCodec<Map<String, Object>> codec = new CapsuleCodec<>(objectMapper, new TypeReference<>() {
        });
        // hand-written envelope with unusual whitespace and key order
        String json = "{ \"buriedAt\" : 5, \"payload\" : { \"b\" : 1, \"a\" : 2 } }";
        String original = Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));

        TimeCapsule<Map<String, Object>> decoded = codec.decode(original);

        assertEquals(original, codec.encode(decoded));
        assertEquals(5L, decoded.buriedAt());
        assertEquals(2, decoded.payload().get("a"));
    }

    @Test
    void dugOutCopyShouldKeepMemberIdentity() {
        CapsuleCodec<String> codec = new CapsuleCodec<>(objectMapper, String.class);
        TimeCapsule<String> capsule = codec.decode(codec.encode(new TimeCapsule<>("hello", 10L)));

        TimeCapsule<String> dug = capsule.dugOut(99L);

        assertEquals(99L, dug.dugOutAt());
        assertTrue(dug.isDugOut());
        assertFalse(capsule.isDugOut());
        assertEquals(codec.encode(capsule), codec.encode(dug));
    }

    @Test
    void sameInstantDifferentBurialTimesShouldEncodeDifferently() {
        CapsuleCodec<String> codec = new CapsuleCodec<>(objectMapper, String.class);

        String a = codec.encode(new TimeCapsule<>("same", 1L));
        String b = codec.encode(new TimeCapsule<>("same", 2L));

        assertNotEquals(a, b);
    }

    @Test
    void mapPayloadsShouldEncodeIndependentlyOfInsertionOrder() {
        CapsuleCodec<Map<String, Integer>> codec = new CapsuleCodec<>(objectMapper, new TypeReference<>() {
        });
        Map<String, Integer> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", 2);
        Map<String, Integer> ba = new LinkedHashMap<>();
        ba.put("b", 2);
        ba.put("a", 1);

        assertEquals(codec.encode(new TimeCapsule<>(ab, 7L)), codec.encode(new TimeCapsule<>(ba, 7L)));
    }

    @Test
    void dugOutAtShouldNotBePersisted() {
        CapsuleCodec<String> codec = new CapsuleCodec<>(objectMapper, String.class);
        String encoded = codec.encode(new TimeCapsule<>("hello", 10L));

        String json = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);

        assertEquals("{\"payload\":\"hello\",\"buriedAt\":10}", json);
    }

    @Test
    void nullPayloadShouldRoundTrip() {
        CapsuleCodec<String> codec = new CapsuleCodec<>(objectMapper, String.class);
        TimeCapsule<String> decoded = codec.decode(codec.encode(new TimeCapsule<>(null, 3L)));

        assertNull(decoded.payload());
        assertEquals(3L, decoded.buriedAt());
    }

    @Test
    void envelopeWithoutBuriedAtShouldDecodeAsZero() {
        CapsuleCodec<String> codec = new CapsuleCodec<>(objectMapper, String.class);
        String legacy = Base64.getEncoder().encodeToString("{\"payload\":\"hello\"}".getBytes(StandardCharsets.UTF_8));

        TimeCapsule<String> decoded = codec.decode(legacy);

        assertEquals("hello", decoded.payload());
        assertEquals(0L, decoded.buriedAt());
    }

    @Test
    void decodeShouldRejectMalformedInput() {
        CapsuleCodec<Order> codec = new CapsuleCodec<>(objectMapper, Order.class);

        assertThrows(CapsuleDecodeException.class, () -> codec.decode(""));
        assertThrows(CapsuleDecodeException.class, () -> codec.decode("not base64 at all!"));
        assertThrows(CapsuleDecodeException.class, () -> codec.decode(base64("{broken json")));
        assertThrows(CapsuleDecodeException.class, () -> codec.decode(base64("[1,2,3]")));
        assertThrows(CapsuleDecodeException.class, () -> codec.decode(base64("{\"buriedAt\":1}")));
        assertThrows(CapsuleDecodeException.class, () -> codec.decode(base64("{\"payload\":null,\"buriedAt\":\"soon\"}")));
        assertThrows(CapsuleDecodeException.class, () -> codec.decode(base64("{\"payload\":{\"quantity\":\"many\"},\"buriedAt\":1}")));
    }

    private static String base64(String json) {
        return Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }
}
