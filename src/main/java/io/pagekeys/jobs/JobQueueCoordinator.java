package io.pagekeys.jobs;

import io.pagekeys.config.PageKeysConfig;
import io.pagekeys.model.JobProgress;
import io.pagekeys.model.QueueStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Routes jobs to named queues, one worker per queue name.
 *
 * <p>Queues are created on first use and live until {@link #close()}. Jobs sharing a
 * name run strictly in submission order; different names run concurrently. All
 * bookkeeping sits behind one lock that is never held while a job executes.
 *
 * <p>A job's failure is logged and reported to its completion callback and to
 * completion listeners. It is not retried and does not affect any other job.
 */
public final class JobQueueCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobQueueCoordinator.class);
    private static final int WORKERS_PER_QUEUE = 1;
    private static final long IDLE_POLL_MS = 10L;

    private final Object lock = new Object();
    private final Map<String, Dispatcher> queues = new LinkedHashMap<>();
    private final Map<String, Counters> stats = new LinkedHashMap<>();
    private final List<Consumer<JobCompletion>> completionListeners = new CopyOnWriteArrayList<>();
    private final DispatcherFactory dispatcherFactory;
    private final int queueCapacity;
    private boolean closed;

    public JobQueueCoordinator() {
        this(ExecutorDispatcher.factory(), PageKeysConfig.DEFAULT_QUEUE_CAPACITY);
    }

    public JobQueueCoordinator(int queueCapacity) {
        this(ExecutorDispatcher.factory(), queueCapacity);
    }

    public JobQueueCoordinator(DispatcherFactory dispatcherFactory, int queueCapacity) {
        this.dispatcherFactory = Objects.requireNonNull(dispatcherFactory, "dispatcherFactory");
        this.queueCapacity = Math.max(1, queueCapacity);
    }

    public void enqueueJob(Job job) {
        enqueue(job, null);
    }

    /**
     * Same as {@link #enqueueJob(Job)}, and then runs {@code onComplete} on the job's
     * worker once the job has finished. The callback may enqueue follow-up jobs.
     */
    public void enqueueJobWithCompletion(Job job, CompletionCallback onComplete) {
        enqueue(job, onComplete);
    }

    public void addCompletionListener(Consumer<JobCompletion> listener) {
        completionListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public Optional<QueueStats> getQueueStats(String queueName) {
        synchronized (lock) {
            Counters counters = stats.get(queueName);
            return counters == null ? Optional.empty() : Optional.of(counters.snapshot());
        }
    }

    public List<QueueStats> getActiveQueues() {
        synchronized (lock) {
            List<QueueStats> active = new ArrayList<>();
            for (Counters counters : stats.values()) {
                if (counters.active) {
                    active.add(counters.snapshot());
                }
            }
            return active;
        }
    }

    public JobProgress getJobProgress() {
        synchronized (lock) {
            List<QueueStats> all = new ArrayList<>(stats.size());
            int active = 0;
            for (Counters counters : stats.values()) {
                all.add(counters.snapshot());
                if (counters.active) {
                    active++;
                }
            }
            return new JobProgress(active > 0, List.copyOf(all), active, stats.size());
        }
    }

    /**
     * Polls until no queue has work left or the timeout elapses.
     *
     * @return {@code true} when every queue drained in time
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (getJobProgress().running()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(IDLE_POLL_MS);
        }
        return true;
    }

    @Override
    public void close() {
        List<Dispatcher> dispatchers;
        synchronized (lock) {
            closed = true;
            dispatchers = new ArrayList<>(queues.values());
        }
        for (Dispatcher dispatcher : dispatchers) {
            dispatcher.shutdown();
        }
    }

    private void enqueue(Job job, CompletionCallback onComplete) {
        Objects.requireNonNull(job, "job");
        String queueName = job.name();
        synchronized (lock) {
            if (closed) {
                throw new JobRejectedException(queueName, new RejectedExecutionException("coordinator is closed"));
            }
            Dispatcher dispatcher = queues.computeIfAbsent(
                    queueName,
                    name -> dispatcherFactory.create(name, WORKERS_PER_QUEUE, queueCapacity)
            );
            Counters counters = stats.computeIfAbsent(queueName, Counters::new);

            int previousHighWaterMark = counters.highWaterMark;
            counters.jobsRemaining++;
            if (counters.jobsRemaining > counters.highWaterMark) {
                counters.highWaterMark = counters.jobsRemaining;
            }
            counters.active = true;

            try {
                dispatcher.dispatch(() -> run(queueName, job, onComplete, counters));
            } catch (RejectedExecutionException e) {
                counters.jobsRemaining--;
                counters.highWaterMark = previousHighWaterMark;
                counters.active = counters.jobsRemaining > 0;
                throw new JobRejectedException(queueName, e);
            }
        }
    }

    private void run(String queueName, Job job, CompletionCallback onComplete, Counters counters) {
        try {
            Exception failure = null;
            try {
                job.execute();
            } catch (Exception e) {
                failure = e;
                log.error("Job execution failed: queue={} job={}", queueName, job.name(), e);
            }
            if (onComplete != null) {
                try {
                    onComplete.onComplete(failure);
                } catch (RuntimeException e) {
                    log.error("Job completion callback failed: queue={} job={}", queueName, job.name(), e);
                }
            }
            JobCompletion completion = new JobCompletion(job.name(), failure);
            for (Consumer<JobCompletion> listener : completionListeners) {
                try {
                    listener.accept(completion);
                } catch (RuntimeException e) {
                    log.error("Job completion listener failed: queue={} job={}", queueName, job.name(), e);
                }
            }
        } finally {
            synchronized (lock) {
                counters.jobsRemaining--;
                if (counters.jobsRemaining == 0) {
                    counters.active = false;
                    counters.highWaterMark = 0;
                }
            }
        }
    }

    private static final class Counters {
        private final String queueName;
        private int jobsRemaining;
        private int highWaterMark;
        private boolean active;

        private Counters(String queueName) {
            this.queueName = queueName;
        }

        private QueueStats snapshot() {
            return new QueueStats(queueName, jobsRemaining, highWaterMark, active);
        }
    }
}
