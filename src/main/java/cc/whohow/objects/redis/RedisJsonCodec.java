package cc.whohow.objects.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * JSON encoding of structure values. Field and structure names never pass through here.
 */
public class RedisJsonCodec<V> {
    private final ObjectReader reader;
    private final ObjectWriter writer;

    public RedisJsonCodec(ObjectMapper objectMapper, JavaType type) {
        this.reader = objectMapper.readerFor(type);
        this.writer = objectMapper.writerFor(type);
    }

    public byte[] encode(V value) {
        Objects.requireNonNull(value, "value");
        try {
            return writer.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    /**
     * @param key structure name, for error reporting
     * @param bytes raw reply, null when Redis had nothing
     * @return empty for a missing or blank reply, or for JSON {@code null} bound to a non-tree type
     * @throws RedisObjectsDataException if the reply is not valid JSON of this codec's type
     */
    public Optional<V> decode(String key, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(reader.readValue(bytes));
        } catch (IOException e) {
            throw new RedisObjectsDataException(key, new String(bytes, StandardCharsets.UTF_8), e);
        }
    }
}
