package io.github.jakubt4.transitfinder.service.search;

import io.github.jakubt4.transitfinder.domain.SearchTask;
import io.github.jakubt4.transitfinder.domain.TaskOutcome;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs search tasks on a fixed worker pool and joins on all of them.
 *
 * <p>Outcomes come back in submission order. A task that throws or exceeds the per-task timeout
 * becomes a failed {@link TaskOutcome}; its siblings are unaffected.
 *
 * <p>The timeout of a task counts from the moment the coordinator starts waiting on it. Workers
 * take tasks in submission order, so by then the task is normally running. A timed-out task is
 * interrupted; one that ignores the interrupt keeps its worker until it returns, the pool runs one
 * worker short meanwhile, and queued tasks may spend part of their timeout waiting.
 */
@Slf4j
@Service
public class ParallelTaskExecutor {

    private final CoarseToFineSearcher searcher;
    private final Duration taskTimeout;
    private final ExecutorService workers;
    private final int workerCount;

    public ParallelTaskExecutor(final CoarseToFineSearcher searcher,
                                @Value("${transit.executor.workers:0}") final int workers,
                                @Value("${transit.executor.task-timeout:30s}") final Duration taskTimeout) {
        this.searcher = searcher;
        this.taskTimeout = taskTimeout;
        // one core stays with the coordinating thread
        this.workerCount = workers > 0 ? workers : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        this.workers = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
        log.info("Search worker pool started — {} workers, task timeout {}", workerCount, taskTimeout);
    }

    public int workerCount() {
        return workerCount;
    }

    public List<TaskOutcome> execute(final List<SearchTask> tasks) {
        final var futures = new ArrayList<Future<TaskOutcome>>(tasks.size());
        for (final var task : tasks) {
            futures.add(workers.submit(() -> run(task)));
        }

        final var outcomes = new ArrayList<TaskOutcome>(tasks.size());
        for (var i = 0; i < tasks.size(); i++) {
            outcomes.add(await(tasks.get(i), futures.get(i)));
        }
        return outcomes;
    }

    private TaskOutcome run(final SearchTask task) {
        try {
            return TaskOutcome.of(task, searcher.search(task));
        } catch (final RuntimeException e) {
            log.warn("Task {} failed: {}", task.describe(), e.toString());
            return TaskOutcome.failed(task, e.toString());
        }
    }

    private TaskOutcome await(final SearchTask task, final Future<TaskOutcome> future) {
        try {
            return future.get(taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            future.cancel(true);
            log.warn("Task {} timed out after {}", task.describe(), taskTimeout);
            return TaskOutcome.failed(task, "timed out after " + taskTimeout);
        } catch (final ExecutionException e) {
            log.warn("Task {} failed: {}", task.describe(), e.getCause().toString());
            return TaskOutcome.failed(task, e.getCause().toString());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return TaskOutcome.failed(task, "interrupted");
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
        log.info("Search worker pool stopped");
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(final Runnable runnable) {
            final var thread = new Thread(runnable, "transit-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
