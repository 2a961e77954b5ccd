package cc.whohow.objects.redis;

import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.codec.RedisCodec;
import io.lettuce.core.output.CommandOutput;
import io.lettuce.core.protocol.CommandArgs;
import io.lettuce.core.protocol.ProtocolKeyword;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous command dispatch to one Redis server. Shared by every accessor, owned by the caller.
 */
public interface Redis extends AutoCloseable {
    RedisCodec<byte[], byte[]> CODEC = RedisCodec.of(ByteArrayCodec.INSTANCE, ByteArrayCodec.INSTANCE);

    <T> CompletableFuture<T> executeAsync(ProtocolKeyword type, CommandArgs<byte[], byte[]> args, CommandOutput<byte[], byte[], T> output);

    /**
     * Dispatch a command that may block on the server (BRPOP, BZPOPMAX). Implementations must not let the
     * blocked command hold up commands sent through {@link #executeAsync}. Cancelling the returned future
     * aborts the wait.
     */
    <T> CompletableFuture<T> executeBlockingAsync(ProtocolKeyword type, CommandArgs<byte[], byte[]> args, CommandOutput<byte[], byte[], T> output);

    CompletableFuture<Void> closeAsync();
}
