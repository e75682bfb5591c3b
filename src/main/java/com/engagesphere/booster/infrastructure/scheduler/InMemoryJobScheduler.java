package com.engagesphere.booster.infrastructure.scheduler;

import com.engagesphere.booster.domain.port.out.JobScheduler;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Timer-ordered, in-memory job scheduler.
 *
 * <p>Pending jobs live in a table keyed by job id plus a queue ordered by due
 * time. Both are guarded by one lock. A single coordinator thread sleeps until
 * the earliest due time (bounded by the poll interval), removes every job that
 * is due and hands each to the dispatch executor, so a slow task never delays
 * another. Tasks always run outside the lock.
 *
 * <p>A cancellation removes the job from both the table and the queue, so the
 * queue never holds more entries than there are pending jobs. A cancellation
 * that arrives after a job has been handed to the executor cannot stop it, and
 * the message is sent.
 *
 * <p>Nothing is persisted: pending jobs are lost on shutdown.
 */
public class InMemoryJobScheduler implements JobScheduler {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryJobScheduler.class);

    private final Clock clock;
    private final Executor dispatchExecutor;
    private final Duration pollInterval;
    private final String threadName;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition headChanged = lock.newCondition();
    private final Map<String, PendingJob> jobs = new HashMap<>();
    private final PriorityQueue<PendingJob> queue = new PriorityQueue<>(
            Comparator.comparing(PendingJob::dueTime).thenComparingLong(PendingJob::sequence));

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong scheduledCount = new AtomicLong();
    private final AtomicLong firedCount = new AtomicLong();
    private final AtomicLong cancelledCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    private volatile boolean running;
    private Thread coordinator;

    public InMemoryJobScheduler(Clock clock, Executor dispatchExecutor, Duration pollInterval, String threadName) {
        this.clock = clock;
        this.dispatchExecutor = dispatchExecutor;
        this.pollInterval = pollInterval;
        this.threadName = threadName;
    }

    @Override
    public boolean schedule(String jobId, Instant dueTime, Runnable task) {
        lock.lock();
        try {
            if (jobs.containsKey(jobId)) {
                logger.info("Job {} is already scheduled, ignoring new request for {}", jobId, dueTime);
                return false;
            }

            PendingJob job = new PendingJob(jobId, dueTime, task, sequence.incrementAndGet());
            jobs.put(jobId, job);
            queue.add(job);
            scheduledCount.incrementAndGet();

            if (queue.peek() == job) {
                headChanged.signalAll();
            }

            logger.debug("Scheduled job {} for {}", jobId, dueTime);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean cancel(String jobId) {
        lock.lock();
        try {
            PendingJob removed = jobs.remove(jobId);
            if (removed == null) {
                logger.debug("Job {} not pending, nothing to cancel", jobId);
                return false;
            }
            queue.remove(removed);
            cancelledCount.incrementAndGet();
            logger.debug("Cancelled job {} due {}", jobId, removed.dueTime());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isScheduled(String jobId) {
        lock.lock();
        try {
            return jobs.containsKey(jobId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> pendingJobIds() {
        lock.lock();
        try {
            return Set.copyOf(jobs.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dispatches every job due at or before the clock's current instant.
     *
     * @return number of jobs handed to the executor
     */
    public int runDueJobs() {
        List<PendingJob> due = new ArrayList<>();
        Instant now = clock.instant();

        lock.lock();
        try {
            while (!queue.isEmpty() && !queue.peek().dueTime().isAfter(now)) {
                PendingJob head = queue.poll();
                if (jobs.remove(head.jobId(), head)) {
                    due.add(head);
                }
            }
        } finally {
            lock.unlock();
        }

        for (PendingJob job : due) {
            dispatch(job);
        }
        return due.size();
    }

    public SchedulerStats stats() {
        lock.lock();
        try {
            return new SchedulerStats(jobs.size(), scheduledCount.get(), firedCount.get(),
                    cancelledCount.get(), failedCount.get());
        } finally {
            lock.unlock();
        }
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        coordinator = new Thread(this::coordinate, threadName);
        coordinator.setDaemon(true);
        coordinator.start();
        logger.info("Job scheduler started");
    }

    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        running = false;
        coordinator.interrupt();
        try {
            coordinator.join(pollInterval.toMillis() * 2);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        lock.lock();
        try {
            if (!jobs.isEmpty()) {
                logger.warn("Dropping {} pending jobs on shutdown", jobs.size());
            }
            jobs.clear();
            queue.clear();
        } finally {
            lock.unlock();
        }
        logger.info("Job scheduler shut down. {}", stats().summary());
    }

    public boolean isRunning() {
        return running;
    }

    int queuedEntries() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private void coordinate() {
        while (running) {
            try {
                awaitNextDueTime();
                runDueJobs();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (running) {
                    logger.warn("Scheduler coordinator interrupted while running, stopping");
                    running = false;
                }
                return;
            } catch (RuntimeException e) {
                logger.error("Unexpected error in scheduler coordinator", e);
            }
        }
    }

    private void awaitNextDueTime() throws InterruptedException {
        lock.lock();
        try {
            PendingJob head = queue.peek();
            Instant now = clock.instant();
            long waitNanos = pollInterval.toNanos();
            if (head != null && head.dueTime().isBefore(now.plus(pollInterval))) {
                waitNanos = Duration.between(now, head.dueTime()).toNanos();
            }
            if (waitNanos > 0) {
                headChanged.await(waitNanos, TimeUnit.NANOSECONDS);
            }
        } finally {
            lock.unlock();
        }
    }

    private void dispatch(PendingJob job) {
        try {
            dispatchExecutor.execute(() -> runJob(job));
        } catch (RejectedExecutionException e) {
            failedCount.incrementAndGet();
            logger.error("Dispatch executor rejected job {}", job.jobId(), e);
        }
    }

    private void runJob(PendingJob job) {
        long startNanos = System.nanoTime();
        try {
            job.task().run();
            firedCount.incrementAndGet();
            logger.info("Job {} fired in {} ms", job.jobId(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        } catch (RuntimeException e) {
            firedCount.incrementAndGet();
            failedCount.incrementAndGet();
            logger.error("Job {} failed and will not be retried", job.jobId(), e);
        }
    }

    private record PendingJob(String jobId, Instant dueTime, Runnable task, long sequence) {}
}
