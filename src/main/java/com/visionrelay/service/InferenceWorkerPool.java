package com.visionrelay.service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.visionrelay.config.VisionRelayProperties;
import com.visionrelay.exception.InferenceRejectedException;

/**
 * Fixed-size pool running CPU-bound inference off the socket threads.
 *
 * The queue is bounded; when it is full the oldest queued task is dropped and
 * completes with an {@link InferenceRejectedException}. Tasks are tracked per
 * room so a purged room's queued and running work can be cancelled.
 */
@Component
public class InferenceWorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(InferenceWorkerPool.class);

    static final String QUEUE_FULL = "dropped: inference queue full";
    static final String SHUT_DOWN = "rejected: inference pool is shut down";

    private final ThreadPoolExecutor executor;
    private final Map<String, Set<InferenceTask<?>>> tasksByRoom = new ConcurrentHashMap<>();

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();

    @Autowired
    public InferenceWorkerPool(VisionRelayProperties properties) {
        this(properties.getInference().getWorkers(), properties.getInference().getQueueCapacity());
    }

    InferenceWorkerPool(int workers, int queueCapacity) {
        BlockingQueue<Runnable> queue = new ArrayBlockingQueue<>(queueCapacity);
        this.executor = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
                queue, new WorkerThreadFactory(), this::dropOldest);
        logger.info("Inference pool started: {} workers, queue capacity {}", workers, queueCapacity);
    }

    /**
     * Queue work on behalf of a room.
     */
    public <T> InferenceTask<T> submit(String roomId, Callable<T> work) {
        InferenceTask<T> task = new InferenceTask<>(roomId, work);
        tasksByRoom.computeIfAbsent(roomId, id -> ConcurrentHashMap.newKeySet()).add(task);
        submitted.incrementAndGet();
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            task.reject(SHUT_DOWN);
        }
        return task;
    }

    /**
     * Cancel every queued or running task of the room.
     *
     * @return number of tasks cancelled
     */
    public int cancelRoom(String roomId) {
        Set<InferenceTask<?>> tasks = tasksByRoom.remove(roomId);
        if (tasks == null) {
            return 0;
        }
        int count = 0;
        for (InferenceTask<?> task : tasks) {
            if (task.cancel(true)) {
                count++;
            }
        }
        executor.purge();
        if (count > 0) {
            logger.info("🧹 Cancelled {} inference task(s) for room {}", count, roomId);
        }
        return count;
    }

    private void dropOldest(Runnable incoming, ThreadPoolExecutor pool) {
        if (pool.isShutdown()) {
            if (incoming instanceof InferenceTask<?> task) {
                task.reject(SHUT_DOWN);
            }
            return;
        }
        // Cancelled tasks can linger in the queue until purged; they are not live work
        Runnable oldest;
        while ((oldest = pool.getQueue().poll()) != null) {
            if (oldest instanceof InferenceTask<?> task && !task.isDone()) {
                dropped.incrementAndGet();
                logger.warn("⚠️ Inference queue full, dropping oldest task of room {}", task.getRoomId());
                task.reject(QUEUE_FULL);
                break;
            }
        }
        pool.execute(incoming);
    }

    public void shutdown() {
        List<Runnable> pending = executor.shutdownNow();
        for (Runnable runnable : pending) {
            if (runnable instanceof InferenceTask<?> task) {
                task.reject(SHUT_DOWN);
            }
        }
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Inference workers did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Inference pool stopped");
    }

    // Statistics
    public long getSubmittedCount() {
        return submitted.get();
    }

    public long getCompletedCount() {
        return completed.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getCancelledCount() {
        return cancelled.get();
    }

    public long getTimedOutCount() {
        return timedOut.get();
    }

    public int getQueuedCount() {
        return executor.getQueue().size();
    }

    public int getActiveCount() {
        return executor.getActiveCount();
    }

    int getTrackedCount(String roomId) {
        Set<InferenceTask<?>> tasks = tasksByRoom.get(roomId);
        return tasks == null ? 0 : tasks.size();
    }

    private void untrack(InferenceTask<?> task) {
        tasksByRoom.computeIfPresent(task.getRoomId(), (id, tasks) -> {
            tasks.remove(task);
            return tasks.isEmpty() ? null : tasks;
        });
    }

    /**
     * Unit of work owned by a room. {@link #completion()} settles when the task
     * finishes, fails, is cancelled or is rejected.
     */
    public final class InferenceTask<T> extends FutureTask<T> {

        private final String roomId;
        private final CompletableFuture<T> completion = new CompletableFuture<>();
        private volatile String rejection;
        private volatile boolean expired;

        InferenceTask(String roomId, Callable<T> work) {
            super(work);
            this.roomId = roomId;
        }

        public String getRoomId() {
            return roomId;
        }

        public CompletableFuture<T> completion() {
            return completion;
        }

        void reject(String reason) {
            this.rejection = reason;
            cancel(false);
        }

        /**
         * Cancel because the caller's deadline passed. Counted as a timeout, not a cancellation.
         */
        public void expire() {
            expired = true;
            timedOut.incrementAndGet();
            cancel(true);
        }

        @Override
        protected void done() {
            untrack(this);
            if (isCancelled()) {
                if (rejection != null) {
                    completion.completeExceptionally(new InferenceRejectedException(rejection));
                } else if (expired) {
                    completion.completeExceptionally(new CancellationException("Inference deadline passed for room " + roomId));
                } else {
                    cancelled.incrementAndGet();
                    completion.completeExceptionally(new CancellationException("Inference cancelled for room " + roomId));
                }
                return;
            }
            try {
                T value = get();
                completed.incrementAndGet();
                completion.complete(value);
            } catch (ExecutionException e) {
                completion.completeExceptionally(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                completion.completeExceptionally(e);
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "inference-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
