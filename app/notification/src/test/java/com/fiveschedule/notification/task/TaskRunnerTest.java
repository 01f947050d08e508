/*
 * Where: background task tests
 * What: status transitions, retry with backoff, permanent failure and queue priority
 */
package com.fiveschedule.notification.task;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fiveschedule.notification.cache.InMemoryCacheStore;
import com.fiveschedule.notification.config.CacheProperties;
import com.fiveschedule.notification.config.TaskProperties;
import com.fiveschedule.notification.service.RealtimeMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TaskRunnerTest {

    private static final Duration HOUR = Duration.ofHours(1);
    private static final String USER = "u_1";

    private final InMemoryCacheStore cacheStore = new InMemoryCacheStore();
    private final TaskStatusStore statusStore = new TaskStatusStore(
            cacheStore,
            new CacheProperties(HOUR, HOUR),
            new ObjectMapper().registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private TaskRunner taskRunner;

    @AfterEach
    void tearDown() {
        if (taskRunner != null) {
            taskRunner.shutdown();
        }
    }

    @Test
    void successfulTaskCompletesWithResult() throws Exception {
        taskRunner = runner(2, 3);

        String taskId = taskRunner.submit("sample", TaskPriority.DEFAULT, USER, () -> Map.of("created_count", 2));

        TaskStatus status = awaitTerminal(taskId);
        assertThat(status.status()).isEqualTo(TaskState.COMPLETED);
        assertThat(status.attempt()).isEqualTo(1);
        assertThat(status.queue()).isEqualTo("default");
        assertThat(status.userId()).isEqualTo(USER);
        assertThat(status.result()).containsEntry("created_count", 2);
        assertThat(meterRegistry.get("task.outcome.total").tag("result", "completed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void transientFailureIsRetriedUntilSuccess() throws Exception {
        taskRunner = runner(2, 3);
        AtomicInteger calls = new AtomicInteger();

        String taskId = taskRunner.submit("flaky", TaskPriority.HIGH, USER, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("database busy");
            }
            return Map.of("ok", true);
        });

        TaskStatus status = awaitTerminal(taskId);
        assertThat(status.status()).isEqualTo(TaskState.COMPLETED);
        assertThat(status.attempt()).isEqualTo(3);
        assertThat(status.error()).isNull();
        assertThat(calls).hasValue(3);
    }

    @Test
    void retriesStopAtMaxAttempts() throws Exception {
        taskRunner = runner(2, 2);
        AtomicInteger calls = new AtomicInteger();

        String taskId = taskRunner.submit("broken", TaskPriority.LOW, USER, () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("still broken");
        });

        TaskStatus status = awaitTerminal(taskId);
        assertThat(status.status()).isEqualTo(TaskState.FAILED);
        assertThat(status.attempt()).isEqualTo(2);
        assertThat(status.error()).isEqualTo("still broken");
        assertThat(calls).hasValue(2);
    }

    @Test
    void permanentFailureIsNotRetried() throws Exception {
        taskRunner = runner(2, 5);
        AtomicInteger calls = new AtomicInteger();

        String taskId = taskRunner.submit("missing", TaskPriority.HIGH, USER, () -> {
            calls.incrementAndGet();
            throw new PermanentTaskException("schedule not found", null);
        });

        TaskStatus status = awaitTerminal(taskId);
        assertThat(status.status()).isEqualTo(TaskState.FAILED);
        assertThat(status.error()).isEqualTo("schedule not found");
        assertThat(calls).hasValue(1);
    }

    @Test
    void higherPriorityQueuesAreTakenFirst() throws Exception {
        taskRunner = runner(1, 1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> order = new CopyOnWriteArrayList<>();

        String blocker = taskRunner.submit("blocker", TaskPriority.LOW, USER, () -> {
            release.await(5, TimeUnit.SECONDS);
            return Map.of();
        });
        awaitState(blocker, TaskState.PROCESSING);
        String low = taskRunner.submit("low", TaskPriority.LOW, USER, () -> record(order, "low"));
        String normal = taskRunner.submit("default", TaskPriority.DEFAULT, USER, () -> record(order, "default"));
        String high = taskRunner.submit("high", TaskPriority.HIGH, USER, () -> record(order, "high"));
        release.countDown();

        awaitTerminal(low);
        awaitTerminal(normal);
        awaitTerminal(high);
        assertThat(order).containsExactly("high", "default", "low");
    }

    @Test
    void shutdownFailsRetriesStillWaitingOnBackoff() throws Exception {
        taskRunner = new TaskRunner(statusStore, new TaskProperties(
                1, 3, Duration.ofMinutes(10), Duration.ofMinutes(10), 2.0, 1.0, 1.0, Duration.ofMinutes(10)),
                new RealtimeMetrics(meterRegistry), Clock.systemUTC());
        AtomicInteger calls = new AtomicInteger();

        String taskId = taskRunner.submit("flaky", TaskPriority.DEFAULT, USER, () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("database busy");
        });
        awaitState(taskId, TaskState.RETRYING);
        taskRunner.shutdown();

        TaskStatus status = statusStore.find(taskId).orElseThrow();
        assertThat(status.status()).isEqualTo(TaskState.FAILED);
        assertThat(status.error()).isEqualTo("task runner is shut down");
        assertThat(status.attempt()).isEqualTo(1);
        assertThat(calls).hasValue(1);
        assertThat(meterRegistry.get("task.outcome.total").tag("result", "failed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void backoffGrowsExponentiallyWithinJitterAndCap() {
        taskRunner = new TaskRunner(statusStore, new TaskProperties(
                1, 5, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0, 0.5, 1.5, Duration.ofMillis(200)),
                new RealtimeMetrics(meterRegistry), Clock.systemUTC());

        for (int i = 0; i < 50; i++) {
            assertThat(taskRunner.computeBackoffDuration(1).toMillis()).isBetween(500L, 1500L);
            assertThat(taskRunner.computeBackoffDuration(3).toMillis()).isBetween(2000L, 6000L);
            assertThat(taskRunner.computeBackoffDuration(10).toMillis()).isBetween(5000L, 15000L);
        }
    }

    @Test
    void unknownTaskIdHasNoStatus() {
        assertThat(statusStore.find("does-not-exist")).isEmpty();
    }

    private TaskRunner runner(int workers, int maxAttempts) {
        TaskProperties properties = new TaskProperties(
                workers, maxAttempts, Duration.ofMillis(20), Duration.ofMillis(50), 2.0, 1.0, 1.0, Duration.ofMillis(1));
        return new TaskRunner(statusStore, properties, new RealtimeMetrics(meterRegistry), Clock.systemUTC());
    }

    private static Map<String, Object> record(List<String> order, String name) {
        order.add(name);
        return Map.of();
    }

    private TaskStatus awaitTerminal(String taskId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            TaskStatus status = statusStore.find(taskId).orElseThrow();
            if (status.status().isTerminal()) {
                return status;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("task did not finish taskId=" + taskId);
    }

    private void awaitState(String taskId, TaskState state) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (statusStore.find(taskId).orElseThrow().status() == state) {
                return;
            }
            Thread.sleep(5);
        }
        throw new AssertionError("task never reached " + state + " taskId=" + taskId);
    }
}
