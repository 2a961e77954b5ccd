package cc.whohow.objects.redis;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedisPriorityQueueTest {
    private InMemoryRedis redis;
    private RedisPriorityQueue<JsonNode> queue;

    @BeforeEach
    void setUp() {
        redis = new InMemoryRedis();
        queue = new RedisObjects(redis, new ObjectMapper()).priorityQueue("test-priority-queue");
    }

    @AfterEach
    void tearDown() {
        redis.close();
    }

    private static TextNode text(String value) {
        return TextNode.valueOf(value);
    }

    @Test
    void popsHighestPriorityFirst() {
        queue.push(text("a"), 1).join();
        queue.push(text("b"), 5).join();
        queue.push(text("c"), 3).join();

        assertThat(queue.pop().join()).contains(text("b"));
        assertThat(queue.popReady().join()).contains(text("c"));
        assertThat(queue.pop(1).join()).contains(text("a"));
        assertThat(queue.popReady().join()).isEmpty();
    }

    @Test
    void rePushUpdatesPriorityWithoutDuplicate() {
        queue.push(text("a"), 1).join();
        queue.push(text("b"), 2).join();
        assertThat(queue.length().join()).isEqualTo(2L);
        assertThat(queue.rank(text("a")).join()).contains(1L);

        queue.push(text("a"), 10).join();

        assertThat(queue.length().join()).isEqualTo(2L);
        assertThat(queue.score(text("a")).join()).contains(10.0);
        assertThat(queue.rank(text("a")).join()).contains(0L);
        assertThat(queue.rank(text("b")).join()).contains(1L);
    }

    @Test
    void defaultPriorityIsZero() {
        queue.push(text("low")).join();
        queue.push(text("negative"), -1).join();

        assertThat(queue.score(text("low")).join()).contains(0.0);
        assertThat(queue.popReady().join()).contains(text("low"));
    }

    @Test
    void equalPrioritiesPopInReverseMemberOrder() {
        queue.push(text("a"), 1).join();
        queue.push(text("b"), 1).join();

        assertThat(queue.popReady().join()).contains(text("b"));
        assertThat(queue.popReady().join()).contains(text("a"));
    }

    @Test
    void scoreAndRankOfMissingValueAreEmpty() {
        queue.push(text("a"), 1).join();

        assertThat(queue.score(text("missing")).join()).isEmpty();
        assertThat(queue.rank(text("missing")).join()).isEmpty();
    }

    @Test
    void lengthCountsEveryScore() {
        queue.push(text("low"), -1e9).join();
        queue.push(text("zero"), 0).join();
        queue.push(text("high"), 1e9).join();

        assertThat(queue.length().join()).isEqualTo(3L);
    }

    @Test
    void popTimesOutEmpty() {
        long start = System.nanoTime();

        assertThat(queue.pop(1).join()).isEmpty();

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(900);
    }

    @Test
    void blockedPopIsWokenByPush() {
        CompletableFuture<Optional<JsonNode>> pending = queue.pop(0);
        assertThat(pending).isNotDone();

        queue.push(text("wake"), 7).join();

        assertThat(pending.join()).contains(text("wake"));
        assertThat(queue.length().join()).isZero();
    }

    @Test
    void cancelledPopConsumesNothing() {
        CompletableFuture<Optional<JsonNode>> pending = queue.pop(0);

        pending.cancel(true);
        queue.push(text("kept"), 1).join();

        assertThat(redis.waiting("test-priority-queue")).isZero();
        assertThat(queue.length().join()).isEqualTo(1L);
        assertThat(queue.popReady().join()).contains(text("kept"));
    }

    @Test
    void negativeTimeoutIsRejected() {
        assertThatThrownBy(() -> queue.pop(-5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clearEmptiesQueue() {
        queue.push(text("a"), 1).join();

        queue.clear().join();

        assertThat(queue.length().join()).isZero();
        assertThat(queue.popReady().join()).isEmpty();
        assertThat(queue.score(text("a")).join()).isEmpty();
    }

    @Test
    void structuredValuesAreMembersByEncoding() {
        RedisPriorityQueue<List<Integer>> lists = new RedisObjects(redis, new ObjectMapper())
                .priorityQueue("lists", new TypeReference<List<Integer>>() {
                });

        lists.push(Arrays.asList(1, 2), 1).join();
        lists.push(Arrays.asList(1, 2), 4).join();
        lists.push(Arrays.asList(2, 1), 2).join();

        assertThat(lists.length().join()).isEqualTo(2L);
        assertThat(lists.popReady().join()).contains(Arrays.asList(1, 2));
        assertThat(lists.popReady().join()).contains(Arrays.asList(2, 1));
    }
}
