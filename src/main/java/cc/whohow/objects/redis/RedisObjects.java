package cc.whohow.objects.redis;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for structure accessors bound to one {@link Redis}. Creating an accessor does no I/O.
 */
public class RedisObjects {
    public static final long DEFAULT_TIMEOUT = 1;
    public static final double DEFAULT_PRIORITY = 0;

    protected final Redis redis;
    protected final ObjectMapper objectMapper;

    public RedisObjects(Redis redis, ObjectMapper objectMapper) {
        this.redis = redis;
        this.objectMapper = objectMapper;
    }

    public Redis getRedis() {
        return redis;
    }

    public RedisQueue<JsonNode> queue(String name) {
        return queue(name, JsonNode.class);
    }

    public <V> RedisQueue<V> queue(String name, Class<V> type) {
        return new RedisQueue<>(redis, name, codec(objectMapper.getTypeFactory().constructType(type)));
    }

    public <V> RedisQueue<V> queue(String name, TypeReference<V> type) {
        return new RedisQueue<>(redis, name, codec(objectMapper.getTypeFactory().constructType(type)));
    }

    public RedisPriorityQueue<JsonNode> priorityQueue(String name) {
        return priorityQueue(name, JsonNode.class);
    }

    public <V> RedisPriorityQueue<V> priorityQueue(String name, Class<V> type) {
        return new RedisPriorityQueue<>(redis, name, codec(objectMapper.getTypeFactory().constructType(type)));
    }

    public <V> RedisPriorityQueue<V> priorityQueue(String name, TypeReference<V> type) {
        return new RedisPriorityQueue<>(redis, name, codec(objectMapper.getTypeFactory().constructType(type)));
    }

    public RedisHash<JsonNode> hash(String name) {
        return hash(name, JsonNode.class);
    }

    public <V> RedisHash<V> hash(String name, Class<V> type) {
        return new RedisHash<>(redis, name, codec(objectMapper.getTypeFactory().constructType(type)));
    }

    public <V> RedisHash<V> hash(String name, TypeReference<V> type) {
        return new RedisHash<>(redis, name, codec(objectMapper.getTypeFactory().constructType(type)));
    }

    protected <V> RedisJsonCodec<V> codec(JavaType type) {
        return new RedisJsonCodec<>(objectMapper, type);
    }
}
