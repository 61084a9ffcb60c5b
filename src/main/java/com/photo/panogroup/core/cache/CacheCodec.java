package com.photo.panogroup.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * 缓存载荷编解码（JSON 信封）
 * <p>
 * 格式：
 * <pre>
 * {
 *   "format": "pano-group-cache",
 *   "version": 1,
 *   "kind": "FEATURES" | "GRAPH",
 *   "payload": { ... }
 * }
 * </pre>
 * 格式名、版本或类型不一致的条目视为不可读，调用方按未命中处理，不会被误解析。
 */
public class CacheCodec {
    private static final Logger logger = LoggerFactory.getLogger(CacheCodec.class);

    public static final String FORMAT = "pano-group-cache";
    public static final int VERSION = 1;

    private final ObjectMapper objectMapper;

    public CacheCodec() {
        this(new ObjectMapper());
    }

    public CacheCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(PayloadKind kind, Object payload) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("format", FORMAT);
        envelope.put("version", VERSION);
        envelope.put("kind", kind.name());
        envelope.set("payload", objectMapper.valueToTree(payload));
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + kind + " cache payload", e);
        }
    }

    public <T> T decode(byte[] bytes, PayloadKind kind, Class<T> type) throws CacheReadException {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new CacheReadException("Malformed cache entry", e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new CacheReadException("Cache entry is not an envelope");
        }
        if (!FORMAT.equals(envelope.path("format").asText(null))) {
            throw new CacheReadException("Unknown cache format: " + envelope.path("format"));
        }
        int version = envelope.path("version").asInt(-1);
        if (version != VERSION) {
            throw new CacheReadException("Unsupported cache version " + version + " (expected " + VERSION + ")");
        }
        String storedKind = envelope.path("kind").asText(null);
        if (!kind.name().equals(storedKind)) {
            throw new CacheReadException("Cache entry holds " + storedKind + ", expected " + kind);
        }
        JsonNode payload = envelope.get("payload");
        if (payload == null || payload.isNull()) {
            throw new CacheReadException("Cache entry has no payload");
        }
        try {
            return objectMapper.treeToValue(payload, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CacheReadException("Cannot decode " + kind + " payload: " + e.getMessage(), e);
        }
    }

    /**
     * 读取并解码，任何失败都降级为未命中
     */
    public <T> Optional<T> read(CacheStore store, String key, PayloadKind kind, Class<T> type) {
        Optional<byte[]> bytes = store.get(key);
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(decode(bytes.get(), kind, type));
        } catch (CacheReadException e) {
            logger.debug("Ignoring unreadable {} cache entry {}: {}", kind, key, e.getMessage());
            return Optional.empty();
        }
    }

    public void write(CacheStore store, String key, PayloadKind kind, Object payload) {
        store.put(key, encode(kind, payload));
    }
}
