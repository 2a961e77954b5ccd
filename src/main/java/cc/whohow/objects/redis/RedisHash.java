package cc.whohow.objects.redis;

import io.lettuce.core.output.BooleanOutput;
import io.lettuce.core.output.IntegerOutput;
import io.lettuce.core.output.KeyListOutput;
import io.lettuce.core.output.MapOutput;
import io.lettuce.core.output.ValueListOutput;
import io.lettuce.core.output.ValueOutput;
import io.lettuce.core.protocol.CommandArgs;
import io.lettuce.core.protocol.CommandType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Field-level access to a Redis hash. An absent key reads as an empty hash.
 */
public class RedisHash<V> extends RedisObject<V> {
    private static final Logger LOG = LoggerFactory.getLogger(RedisHash.class);

    public RedisHash(Redis redis, String name, RedisJsonCodec<V> codec) {
        super(redis, name, codec);
    }

    /**
     * Write a field unconditionally.
     *
     * @return true if the field is new, false if an existing value was overwritten
     */
    public CompletableFuture<Boolean> set(String field, V value) {
        CommandArgs<byte[], byte[]> args = args().add(Objects.requireNonNull(field, "field")).add(codec.encode(value));
        LOG.trace("HSET {} {}", name, field);
        return execute(CommandType.HSET, args, new IntegerOutput<>(Redis.CODEC))
                .thenApply(RedisObject::positive);
    }

    /**
     * Write a field only if it is not already set.
     *
     * @return true if the value was written
     */
    public CompletableFuture<Boolean> add(String field, V value) {
        CommandArgs<byte[], byte[]> args = args().add(Objects.requireNonNull(field, "field")).add(codec.encode(value));
        LOG.trace("HSETNX {} {}", name, field);
        return execute(CommandType.HSETNX, args, new BooleanOutput<>(Redis.CODEC))
                .thenApply(Boolean.TRUE::equals);
    }

    public CompletableFuture<Optional<V>> get(String field) {
        CommandArgs<byte[], byte[]> args = args().add(Objects.requireNonNull(field, "field"));
        LOG.trace("HGET {} {}", name, field);
        return execute(CommandType.HGET, args, new ValueOutput<>(Redis.CODEC))
                .thenApply(this::decode);
    }

    /**
     * Read several fields in one round trip. Every requested field is present in the result, in request
     * order; fields without a value map to empty.
     */
    public CompletableFuture<Map<String, Optional<V>>> multiGet(Collection<String> fields) {
        List<String> requested = new ArrayList<>(new LinkedHashSet<>(fields));
        if (requested.isEmpty()) {
            return CompletableFuture.completedFuture(Collections.emptyMap());
        }
        CommandArgs<byte[], byte[]> args = args();
        for (String field : requested) {
            args.add(Objects.requireNonNull(field, "field"));
        }
        LOG.trace("HMGET {} {}", name, requested);
        return execute(CommandType.HMGET, args, new ValueListOutput<>(Redis.CODEC))
                .thenApply(values -> {
                    Map<String, Optional<V>> result = new LinkedHashMap<>();
                    for (int i = 0; i < requested.size(); i++) {
                        byte[] value = i < values.size() ? values.get(i) : null;
                        result.put(requested.get(i), decode(value));
                    }
                    return result;
                });
    }

    public CompletableFuture<Map<String, V>> getAll() {
        LOG.trace("HGETALL {}", name);
        return execute(CommandType.HGETALL, args(), new MapOutput<>(Redis.CODEC))
                .thenApply(entries -> {
                    Map<String, V> result = new LinkedHashMap<>();
                    for (Map.Entry<byte[], byte[]> entry : entries.entrySet()) {
                        decode(entry.getValue()).ifPresent(value ->
                                result.put(new String(entry.getKey(), StandardCharsets.UTF_8), value));
                    }
                    return result;
                });
    }

    public CompletableFuture<Set<String>> keys() {
        LOG.trace("HKEYS {}", name);
        return execute(CommandType.HKEYS, args(), new KeyListOutput<>(Redis.CODEC))
                .thenApply(keys -> {
                    Set<String> result = new LinkedHashSet<>();
                    for (byte[] field : keys) {
                        result.add(new String(field, StandardCharsets.UTF_8));
                    }
                    return result;
                });
    }

    public CompletableFuture<Long> size() {
        LOG.trace("HLEN {}", name);
        return execute(CommandType.HLEN, args(), new IntegerOutput<>(Redis.CODEC));
    }

    /**
     * @return true if the field existed
     */
    public CompletableFuture<Boolean> delete(String field) {
        CommandArgs<byte[], byte[]> args = args().add(Objects.requireNonNull(field, "field"));
        LOG.trace("HDEL {} {}", name, field);
        return execute(CommandType.HDEL, args, new IntegerOutput<>(Redis.CODEC))
                .thenApply(RedisObject::positive);
    }
}
