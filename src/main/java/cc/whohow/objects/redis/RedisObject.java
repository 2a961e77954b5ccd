package cc.whohow.objects.redis;

import io.lettuce.core.output.CommandOutput;
import io.lettuce.core.output.IntegerOutput;
import io.lettuce.core.protocol.CommandArgs;
import io.lettuce.core.protocol.CommandType;
import io.lettuce.core.protocol.ProtocolKeyword;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * A stateless view of one Redis key. Nothing is cached locally; every call is one command.
 */
public abstract class RedisObject<V> {
    private static final Logger LOG = LoggerFactory.getLogger(RedisObject.class);

    protected final Redis redis;
    protected final String name;
    protected final RedisJsonCodec<V> codec;
    protected final byte[] key;

    protected RedisObject(Redis redis, String name, RedisJsonCodec<V> codec) {
        this.redis = Objects.requireNonNull(redis, "redis");
        this.name = Objects.requireNonNull(name, "name");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.key = name.getBytes(StandardCharsets.UTF_8);
    }

    public String getName() {
        return name;
    }

    /**
     * Delete the whole structure, removing the key itself.
     *
     * @return true if the key existed
     */
    public CompletableFuture<Boolean> clear() {
        LOG.trace("DEL {}", name);
        return execute(CommandType.DEL, args(), new IntegerOutput<>(Redis.CODEC))
                .thenApply(RedisObject::positive);
    }

    protected <T> CompletableFuture<T> execute(ProtocolKeyword type, CommandArgs<byte[], byte[]> args, CommandOutput<byte[], byte[], T> output) {
        return logFailure(type, redis.executeAsync(type, args, output));
    }

    /**
     * Dispatch a blocking command and map its reply. Cancelling the returned future cancels the command,
     * so a cancelled pop never consumes an element.
     */
    protected <T, R> CompletableFuture<R> executeBlocking(ProtocolKeyword type, CommandArgs<byte[], byte[]> args,
                                                          CommandOutput<byte[], byte[], T> output,
                                                          Function<? super T, ? extends R> mapper) {
        CompletableFuture<T> command = logFailure(type, redis.executeBlockingAsync(type, args, output));
        CompletableFuture<R> result = command.thenApply(mapper);
        result.whenComplete((r, e) -> {
            if (result.isCancelled()) {
                command.cancel(true);
            }
        });
        return result;
    }

    private <T> CompletableFuture<T> logFailure(ProtocolKeyword type, CompletableFuture<T> command) {
        command.whenComplete((r, e) -> {
            if (e != null && !command.isCancelled()) {
                LOG.debug("{} {} failed: {}", type, name, e.getMessage(), e);
            }
        });
        return command;
    }

    protected CommandArgs<byte[], byte[]> args() {
        return new CommandArgs<>(Redis.CODEC).addKey(key);
    }

    protected Optional<V> decode(byte[] bytes) {
        return codec.decode(name, bytes);
    }

    protected static boolean positive(Long n) {
        return n != null && n > 0;
    }

    protected static long checkTimeout(long timeout) {
        if (timeout < 0) {
            throw new IllegalArgumentException("timeout: " + timeout);
        }
        return timeout;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
