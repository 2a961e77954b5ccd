package cc.whohow.objects.redis;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.output.CommandOutput;
import io.lettuce.core.protocol.AsyncCommand;
import io.lettuce.core.protocol.Command;
import io.lettuce.core.protocol.CommandArgs;
import io.lettuce.core.protocol.ProtocolKeyword;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

public class StandaloneRedis implements Redis {
    private static final Logger LOG = LoggerFactory.getLogger(StandaloneRedis.class);

    protected final RedisClient client;
    protected final RedisURI uri;
    protected final StatefulRedisConnection<byte[], byte[]> connection;

    public StandaloneRedis(RedisClient client, RedisURI uri) {
        this.client = client;
        this.uri = uri;
        this.connection = client.connect(CODEC, uri);
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(ProtocolKeyword type, CommandArgs<byte[], byte[]> args, CommandOutput<byte[], byte[], T> output) {
        AsyncCommand<byte[], byte[], T> command = new AsyncCommand<>(new Command<>(type, output, args));
        connection.dispatch(command);
        return command;
    }

    /**
     * Each blocking command gets its own connection, closed once the command completes or the returned
     * future is cancelled. Closing the connection makes the server drop the blocked client.
     */
    @Override
    public <T> CompletableFuture<T> executeBlockingAsync(ProtocolKeyword type, CommandArgs<byte[], byte[]> args, CommandOutput<byte[], byte[], T> output) {
        CompletableFuture<T> result = new CompletableFuture<>();
        client.connectAsync(CODEC, uri).toCompletableFuture().whenComplete((blockingConnection, e) -> {
            if (e != null) {
                result.completeExceptionally(e);
                return;
            }
            LOG.debug("{} connection opened for {}", type, uri);
            if (result.isCancelled()) {
                close(type, blockingConnection);
                return;
            }
            AsyncCommand<byte[], byte[], T> command = new AsyncCommand<>(new Command<>(type, output, args));
            command.whenComplete((r, ce) -> {
                close(type, blockingConnection);
                if (ce != null) {
                    result.completeExceptionally(ce);
                } else {
                    result.complete(r);
                }
            });
            result.whenComplete((r, re) -> {
                if (result.isCancelled()) {
                    command.cancel(true);
                }
            });
            blockingConnection.dispatch(command);
        });
        return result;
    }

    @Override
    public CompletableFuture<Void> closeAsync() {
        return connection.closeAsync();
    }

    @Override
    public void close() throws Exception {
        closeAsync().join();
    }

    private void close(ProtocolKeyword type, StatefulRedisConnection<byte[], byte[]> blockingConnection) {
        blockingConnection.closeAsync().whenComplete((r, e) -> {
            if (e != null) {
                LOG.warn(e.getMessage(), e);
            } else {
                LOG.debug("{} connection closed for {}", type, uri);
            }
        });
    }
}
