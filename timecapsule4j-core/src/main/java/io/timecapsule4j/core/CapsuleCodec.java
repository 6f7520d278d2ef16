package io.timecapsule4j.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.Base64;
import java.util.Objects;

/**
 * Converts capsules to and from the printable string stored as a sorted-set member.
 *
 * <p>Wire form: standard Base64 of the JSON envelope
 * <pre>{@code {"payload": <payload>, "buriedAt": <epoch millis>}}</pre>
 * {@code dugOutAt} is never persisted. Map entries are written in key order so that equal payloads
 * produce equal envelopes.
 *
 * <p>Both directions memoize on the capsule: encoding caches the computed string, decoding caches
 * the input string. Re-encoding a decoded capsule therefore returns exactly the string it came from.
 *
 * @param <P> payload type
 */
public final class CapsuleCodec<P> {

    static final String PAYLOAD_FIELD = "payload";
    static final String BURIED_AT_FIELD = "buriedAt";

    private final ObjectMapper objectMapper;
    private final ObjectReader payloadReader;
    private final JavaType payloadType;

    public CapsuleCodec(ObjectMapper objectMapper, Class<P> payloadType) {
        this(objectMapper, Objects.requireNonNull(objectMapper, "objectMapper must not be null")
                .constructType(Objects.requireNonNull(payloadType, "payloadType must not be null")));
    }

    public CapsuleCodec(ObjectMapper objectMapper, TypeReference<P> payloadType) {
        this(objectMapper, Objects.requireNonNull(objectMapper, "objectMapper must not be null")
                .constructType(Objects.requireNonNull(payloadType, "payloadType must not be null")));
    }

    public CapsuleCodec(ObjectMapper objectMapper, JavaType payloadType) {
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType must not be null");
        this.objectMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.payloadReader = this.objectMapper.readerFor(payloadType);
    }

    public JavaType payloadType() {
        return payloadType;
    }

    /**
     * Returns the transport string of {@code capsule}, computing and caching it on first use.
     */
    public String encode(TimeCapsule<P> capsule) {
        Objects.requireNonNull(capsule, "capsule must not be null");

        String cached = capsule.cachedEncoding();
        if (cached != null) {
            return cached;
        }

        ObjectNode envelope = objectMapper.createObjectNode();
        JsonNode payloadNode = capsule.payload() == null
                ? NullNode.getInstance()
                : objectMapper.valueToTree(capsule.payload());
        envelope.set(PAYLOAD_FIELD, payloadNode);
        envelope.put(BURIED_AT_FIELD, capsule.buriedAt());

        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new TimeCapsuleException("Failed to serialize capsule payload of type " + payloadType, e);
        }

        String encoded = Base64.getEncoder().encodeToString(json);
        capsule.cacheEncoding(encoded);
        return encoded;
    }

    /**
     * Parses a transport string produced by {@link #encode(TimeCapsule)}.
     *
     * @throws CapsuleDecodeException if the framing, the envelope, or the payload is malformed
     */
    public TimeCapsule<P> decode(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            throw new CapsuleDecodeException("capsule string must not be empty");
        }

        byte[] json;
        try {
            json = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new CapsuleDecodeException("capsule string is not valid Base64", e);
        }

        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new CapsuleDecodeException("capsule envelope is not valid JSON", e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new CapsuleDecodeException("capsule envelope must be a JSON object");
        }
        if (!envelope.has(PAYLOAD_FIELD)) {
            throw new CapsuleDecodeException("capsule envelope has no '" + PAYLOAD_FIELD + "' field");
        }

        long buriedAt = 0L;
        JsonNode buriedAtNode = envelope.get(BURIED_AT_FIELD);
        if (buriedAtNode != null && !buriedAtNode.isNull()) {
            if (!buriedAtNode.canConvertToLong() || !buriedAtNode.isIntegralNumber()) {
                throw new CapsuleDecodeException("capsule envelope has a malformed '" + BURIED_AT_FIELD + "' field");
            }
            buriedAt = buriedAtNode.longValue();
        }

        P payload;
        JsonNode payloadNode = envelope.get(PAYLOAD_FIELD);
        try {
            payload = payloadNode.isNull() ? null : payloadReader.readValue(payloadNode);
        } catch (IOException | IllegalArgumentException e) {
            throw new CapsuleDecodeException("capsule payload cannot be read as " + payloadType, e);
        }

        return new TimeCapsule<>(payload, buriedAt, 0L, encoded);
    }
}
