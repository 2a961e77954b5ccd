package cc.whohow.objects.redis;

import io.lettuce.core.KeyValue;
import io.lettuce.core.ScoredValue;
import io.lettuce.core.output.DoubleOutput;
import io.lettuce.core.output.IntegerOutput;
import io.lettuce.core.output.KeyValueScoredValueOutput;
import io.lettuce.core.output.ScoredValueOutput;
import io.lettuce.core.protocol.CommandArgs;
import io.lettuce.core.protocol.CommandType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Priority queue over a Redis sorted set. Members are the JSON encoding of values, so pushing an equal value
 * again moves it instead of adding a second entry. Equal priorities pop in reverse lexicographic order of
 * the encoded value.
 */
public class RedisPriorityQueue<V> extends RedisObject<V> {
    private static final Logger LOG = LoggerFactory.getLogger(RedisPriorityQueue.class);

    public RedisPriorityQueue(Redis redis, String name, RedisJsonCodec<V> codec) {
        super(redis, name, codec);
    }

    public CompletableFuture<Void> push(V value) {
        return push(value, RedisObjects.DEFAULT_PRIORITY);
    }

    /**
     * Insert the value, or reset its priority if it is already queued.
     */
    public CompletableFuture<Void> push(V value, double priority) {
        CommandArgs<byte[], byte[]> args = args().add(priority).add(codec.encode(value));
        LOG.trace("ZADD {} {}", name, priority);
        return execute(CommandType.ZADD, args, new IntegerOutput<>(Redis.CODEC))
                .thenApply(n -> null);
    }

    public CompletableFuture<Optional<V>> pop() {
        return pop(RedisObjects.DEFAULT_TIMEOUT);
    }

    /**
     * Wait for the highest priority item.
     *
     * @param timeout seconds to wait, 0 to wait forever
     * @return the item, or empty if the timeout elapsed first
     */
    public CompletableFuture<Optional<V>> pop(long timeout) {
        CommandArgs<byte[], byte[]> args = args().add(checkTimeout(timeout));
        LOG.trace("BZPOPMAX {} {}", name, timeout);
        return executeBlocking(CommandType.BZPOPMAX, args, new KeyValueScoredValueOutput<>(Redis.CODEC),
                this::decodeMessage);
    }

    public CompletableFuture<Optional<V>> popReady() {
        LOG.trace("ZPOPMAX {}", name);
        return execute(CommandType.ZPOPMAX, args(), new ScoredValueOutput<>(Redis.CODEC))
                .thenApply(this::decodeScoredValue);
    }

    public CompletableFuture<Optional<Double>> score(V value) {
        CommandArgs<byte[], byte[]> args = args().add(codec.encode(value));
        LOG.trace("ZSCORE {}", name);
        return execute(CommandType.ZSCORE, args, new DoubleOutput<>(Redis.CODEC))
                .thenApply(Optional::ofNullable);
    }

    /**
     * @return zero-based distance from the highest priority end, empty if the value is not queued
     */
    public CompletableFuture<Optional<Long>> rank(V value) {
        CommandArgs<byte[], byte[]> args = args().add(codec.encode(value));
        LOG.trace("ZREVRANK {}", name);
        return execute(CommandType.ZREVRANK, args, new IntegerOutput<>(Redis.CODEC))
                .thenApply(Optional::ofNullable);
    }

    public CompletableFuture<Long> length() {
        LOG.trace("ZCARD {}", name);
        return execute(CommandType.ZCARD, args(), new IntegerOutput<>(Redis.CODEC));
    }

    private Optional<V> decodeMessage(KeyValue<byte[], ScoredValue<byte[]>> message) {
        if (message == null || !message.hasValue()) {
            return Optional.empty();
        }
        return decodeScoredValue(message.getValue());
    }

    private Optional<V> decodeScoredValue(ScoredValue<byte[]> scoredValue) {
        if (scoredValue == null || !scoredValue.hasValue()) {
            return Optional.empty();
        }
        return decode(scoredValue.getValue());
    }
}
