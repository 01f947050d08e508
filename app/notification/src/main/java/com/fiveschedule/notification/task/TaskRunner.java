/*
 * Where: background tasks
 * What: runs submitted tasks on a worker pool ordered by queue priority, retrying with backoff
 * Why: slow notification jobs leave the request path, and failures end up in the status store
 */
package com.fiveschedule.notification.task;

import com.fiveschedule.notification.config.TaskProperties;
import com.fiveschedule.notification.service.RealtimeMetrics;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class TaskRunner {

    private static final Logger logger = LoggerFactory.getLogger(TaskRunner.class);
    private static final int ERROR_MESSAGE_MAX_LENGTH = 500;

    private final TaskStatusStore statusStore;
    private final TaskProperties properties;
    private final RealtimeMetrics metrics;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final ThreadPoolExecutor workers;
    private final ScheduledExecutorService retryScheduler;
    private final Set<QueuedAttempt> scheduledRetries = ConcurrentHashMap.newKeySet();

    public TaskRunner(TaskStatusStore statusStore, TaskProperties properties, RealtimeMetrics metrics, Clock clock) {
        this.statusStore = statusStore;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        // execute() only: the queue holds QueuedAttempt, which orders by priority then submission
        this.workers = new ThreadPoolExecutor(
                properties.workers(),
                properties.workers(),
                0L,
                TimeUnit.MILLISECONDS,
                new PriorityBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat("task-worker-%d").setDaemon(true).build());
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("task-retry-%d").setDaemon(true).build());
    }

    /**
     * Queues a task on behalf of {@code userId} and returns its id at once. The task never reports failure to the caller;
     * its outcome is read from {@link TaskStatusStore}.
     */
    public String submit(String taskName, TaskPriority priority, String userId, Task task) {
        String taskId = UUID.randomUUID().toString();
        TaskStatus status = new TaskStatus(taskId, userId, taskName, priority.queueName(),
                TaskState.PENDING, 0, null, null, Instant.now(clock));
        statusStore.save(status);
        enqueue(new QueuedAttempt(priority, sequence.incrementAndGet(), status, task, 1));
        logger.info("task submitted taskId={} name={} queue={}", taskId, taskName, priority.queueName());
        return taskId;
    }

    private void enqueue(QueuedAttempt attempt) {
        try {
            workers.execute(attempt);
        } catch (RejectedExecutionException ex) {
            fail(attempt, "task runner is shut down");
        }
    }

    @VisibleForTesting
    void runAttempt(QueuedAttempt attempt) {
        TaskStatus processing = attempt.status.next(
                TaskState.PROCESSING, attempt.attempt, null, attempt.status.error(), Instant.now(clock));
        statusStore.save(processing);
        try {
            Map<String, Object> result = attempt.task.run();
            statusStore.save(processing.next(TaskState.COMPLETED, attempt.attempt, result, null, Instant.now(clock)));
            metrics.recordTaskOutcome(processing.taskName(), "completed");
            logger.info("task completed taskId={} name={} attempt={}",
                    processing.taskId(), processing.taskName(), attempt.attempt);
        } catch (PermanentTaskException ex) {
            logger.warn("task failed permanently taskId={} name={}", processing.taskId(), processing.taskName(), ex);
            fail(attempt.withStatus(processing), ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            fail(attempt.withStatus(processing), "interrupted");
        } catch (Exception ex) {
            handleFailure(attempt.withStatus(processing), ex);
        }
    }

    private void handleFailure(QueuedAttempt attempt, Exception ex) {
        if (attempt.attempt >= properties.maxAttempts()) {
            logger.warn("task retries exhausted taskId={} name={} attempt={}",
                    attempt.status.taskId(), attempt.status.taskName(), attempt.attempt, ex);
            fail(attempt, ex.getMessage());
            return;
        }
        Duration backoff = computeBackoffDuration(attempt.attempt);
        statusStore.save(attempt.status.next(
                TaskState.RETRYING, attempt.attempt, null, truncateError(ex.getMessage()), Instant.now(clock)));
        metrics.recordTaskOutcome(attempt.status.taskName(), "retry");
        logger.warn("task retry scheduled taskId={} name={} attempt={} backoff={}",
                attempt.status.taskId(), attempt.status.taskName(), attempt.attempt, backoff, ex);
        QueuedAttempt next = attempt.nextAttempt(sequence.incrementAndGet());
        scheduledRetries.add(attempt);
        try {
            retryScheduler.schedule(() -> {
                if (scheduledRetries.remove(attempt)) {
                    enqueue(next);
                }
            }, backoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException rejected) {
            if (scheduledRetries.remove(attempt)) {
                fail(attempt, "task runner is shut down");
            }
        }
    }

    private void fail(QueuedAttempt attempt, String error) {
        statusStore.save(attempt.status.next(
                TaskState.FAILED, attempt.attempt, null, truncateError(error), Instant.now(clock)));
        metrics.recordTaskOutcome(attempt.status.taskName(), "failed");
    }

    @VisibleForTesting
    Duration computeBackoffDuration(int attempt) {
        double baseMillis = properties.backoffBase().toMillis();
        double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
        double capped = Math.min(exp, properties.backoffMax().toMillis());
        double jitterMin = properties.backoffJitterMin();
        double jitterMax = properties.backoffJitterMax();
        double jitter = jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
        long backoffMillis = (long) Math.ceil(capped * jitter);
        long minMillis = properties.backoffMin().toMillis();
        return Duration.ofMillis(Math.max(minMillis, backoffMillis));
    }

    private String truncateError(String message) {
        if (message == null) {
            return "unknown error";
        }
        if (message.length() <= ERROR_MESSAGE_MAX_LENGTH) {
            return message;
        }
        return message.substring(0, ERROR_MESSAGE_MAX_LENGTH);
    }

    @PreDestroy
    public void shutdown() {
        retryScheduler.shutdownNow();
        // retries still waiting on their backoff never run; their status must not stay RETRYING
        for (QueuedAttempt attempt : scheduledRetries) {
            if (scheduledRetries.remove(attempt)) {
                fail(attempt, "task runner is shut down");
            }
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                failUnstarted(workers.shutdownNow());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            failUnstarted(workers.shutdownNow());
        }
    }

    private void failUnstarted(List<Runnable> unstarted) {
        for (Runnable runnable : unstarted) {
            if (runnable instanceof QueuedAttempt attempt) {
                fail(attempt, "task runner is shut down");
            }
        }
    }

    @VisibleForTesting
    final class QueuedAttempt implements Runnable, Comparable<QueuedAttempt> {

        private final TaskPriority priority;
        private final long order;
        private final TaskStatus status;
        private final Task task;
        private final int attempt;

        QueuedAttempt(TaskPriority priority, long order, TaskStatus status, Task task, int attempt) {
            this.priority = priority;
            this.order = order;
            this.status = status;
            this.task = task;
            this.attempt = attempt;
        }

        QueuedAttempt withStatus(TaskStatus newStatus) {
            return new QueuedAttempt(priority, order, newStatus, task, attempt);
        }

        QueuedAttempt nextAttempt(long newOrder) {
            return new QueuedAttempt(priority, newOrder, status, task, attempt + 1);
        }

        @Override
        public void run() {
            runAttempt(this);
        }

        @Override
        public int compareTo(QueuedAttempt other) {
            int byPriority = Integer.compare(priority.rank(), other.priority.rank());
            return byPriority != 0 ? byPriority : Long.compare(order, other.order);
        }
    }
}
