package cc.whohow.objects.redis;

import io.lettuce.core.KeyValue;
import io.lettuce.core.output.IntegerOutput;
import io.lettuce.core.output.KeyValueOutput;
import io.lettuce.core.output.ValueOutput;
import io.lettuce.core.protocol.CommandArgs;
import io.lettuce.core.protocol.CommandType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * FIFO queue over a Redis list: LPUSH in, RPOP/BRPOP out.
 */
public class RedisQueue<V> extends RedisObject<V> {
    private static final Logger LOG = LoggerFactory.getLogger(RedisQueue.class);

    public RedisQueue(Redis redis, String name, RedisJsonCodec<V> codec) {
        super(redis, name, codec);
    }

    public CompletableFuture<Void> push(V value) {
        CommandArgs<byte[], byte[]> args = args().add(codec.encode(value));
        LOG.trace("LPUSH {}", name);
        return execute(CommandType.LPUSH, args, new IntegerOutput<>(Redis.CODEC))
                .thenApply(n -> null);
    }

    public CompletableFuture<Optional<V>> pop() {
        return pop(RedisObjects.DEFAULT_TIMEOUT);
    }

    /**
     * Wait for the oldest item.
     *
     * @param timeout seconds to wait, 0 to wait forever
     * @return the item, or empty if the timeout elapsed first
     */
    public CompletableFuture<Optional<V>> pop(long timeout) {
        CommandArgs<byte[], byte[]> args = args().add(checkTimeout(timeout));
        LOG.trace("BRPOP {} {}", name, timeout);
        return executeBlocking(CommandType.BRPOP, args, new KeyValueOutput<>(Redis.CODEC), this::decodeMessage);
    }

    /**
     * Take the oldest item without waiting.
     */
    public CompletableFuture<Optional<V>> popReady() {
        LOG.trace("RPOP {}", name);
        return execute(CommandType.RPOP, args(), new ValueOutput<>(Redis.CODEC))
                .thenApply(this::decode);
    }

    public CompletableFuture<Long> length() {
        LOG.trace("LLEN {}", name);
        return execute(CommandType.LLEN, args(), new IntegerOutput<>(Redis.CODEC));
    }

    private Optional<V> decodeMessage(KeyValue<byte[], byte[]> message) {
        if (message == null || !message.hasValue()) {
            return Optional.empty();
        }
        return decode(message.getValue());
    }
}
