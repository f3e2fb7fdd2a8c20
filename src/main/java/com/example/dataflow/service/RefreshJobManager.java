package com.example.dataflow.service;

import com.example.dataflow.core.TableRefresher;
import com.example.dataflow.core.metadata.MetadataReader;
import com.example.dataflow.core.model.JobSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one background refresh task running per eligible table.
 * <p>
 * A single controller thread periodically re-reads the desired job specs and reconciles them
 * against the tracked tasks: untracked tables get a new task, tables whose interval changed get
 * their task cancelled and replaced, and tables that are no longer eligible are cancelled and
 * untracked. Reconciliation never runs a refresh itself.
 * <p>
 * Each task waits one interval, runs one cycle to completion and only then waits again, so cycles
 * for one table never overlap. A replacement task does not start its first cycle until its
 * predecessor has exited. Cancellation is cooperative and observed between cycles.
 */
public class RefreshJobManager {

    private static final Logger log = LoggerFactory.getLogger(RefreshJobManager.class);

    private static final String MDC_TABLE_KEY = "table";

    private final MetadataReader metadataReader;
    private final TableRefresher tableRefresher;
    private final Duration reconcileInterval;
    private final Duration initialDelay;
    private final Duration shutdownLogInterval;
    private final TimeUnit intervalUnit;

    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.IDLE);
    private final AtomicLong startedTasks = new AtomicLong();

    // Guards jobs; held only for map reads and writes
    private final Object lock = new Object();
    private final Map<String, JobEntry> jobs = new HashMap<>();

    private final ScheduledExecutorService controller;
    private final ExecutorService taskExecutor;

    /**
     * @param intervalUnit Unit applied to each job's refresh interval; {@link TimeUnit#SECONDS} outside tests.
     */
    public RefreshJobManager(MetadataReader metadataReader,
                             TableRefresher tableRefresher,
                             Duration reconcileInterval,
                             Duration initialDelay,
                             Duration shutdownLogInterval,
                             TimeUnit intervalUnit) {
        this.metadataReader = Objects.requireNonNull(metadataReader, "MetadataReader cannot be null");
        this.tableRefresher = Objects.requireNonNull(tableRefresher, "TableRefresher cannot be null");
        this.reconcileInterval = Objects.requireNonNull(reconcileInterval, "reconcileInterval cannot be null");
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay cannot be null");
        this.shutdownLogInterval = Objects.requireNonNull(shutdownLogInterval, "shutdownLogInterval cannot be null");
        this.intervalUnit = Objects.requireNonNull(intervalUnit, "intervalUnit cannot be null");
        if (reconcileInterval.isZero() || reconcileInterval.isNegative()) {
            throw new IllegalArgumentException("reconcileInterval must be positive");
        }
        this.controller = Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("refresh-reconciler"));
        this.taskExecutor = Executors.newCachedThreadPool(namedDaemonThreads("refresh-task"));
    }

    /**
     * Starts the reconciliation loop. Calling this on a running manager does nothing.
     */
    public void start() {
        if (!state.compareAndSet(SchedulerState.IDLE, SchedulerState.RUNNING)) {
            log.info("Refresh job manager not started, current state is {}", state.get());
            return;
        }
        controller.scheduleWithFixedDelay(this::reconcileSafely,
                                          initialDelay.toMillis(),
                                          reconcileInterval.toMillis(),
                                          TimeUnit.MILLISECONDS);
        log.info("Refresh job manager started (reconcile every {} ms)", reconcileInterval.toMillis());
    }

    /**
     * Converges the tracked tasks to the current set of eligible job specs.
     * A failure to read the specs is logged and the tick is skipped.
     */
    public void reconcile() {
        if (!acceptingWork()) {
            return;
        }

        List<JobSpec> specs;
        try {
            specs = metadataReader.findRefreshJobs();
        } catch (RuntimeException e) {
            log.error("Failed to read refresh jobs, skipping this tick: {}", e.getMessage(), e);
            return;
        }

        Map<String, JobSpec> desired = new LinkedHashMap<>();
        for (JobSpec spec : specs) {
            desired.put(spec.getTableName(), spec);
        }

        synchronized (lock) {
            // stop() may have run while the specs were being read
            if (!acceptingWork()) {
                return;
            }

            for (JobSpec spec : desired.values()) {
                String tableName = spec.getTableName();
                JobEntry existing = jobs.get(tableName);
                if (existing == null) {
                    jobs.put(tableName, startTask(spec, null));
                    log.info("Started refresh job for {} every {} {}", tableName, spec.getIntervalSeconds(), unitName());
                } else if (existing.interval != spec.getIntervalSeconds()) {
                    existing.token.cancel();
                    jobs.put(tableName, startTask(spec, existing.finished));
                    log.info("Restarted refresh job for {}: interval {} -> {} {}",
                             tableName, existing.interval, spec.getIntervalSeconds(), unitName());
                }
            }

            Iterator<Map.Entry<String, JobEntry>> it = jobs.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, JobEntry> tracked = it.next();
                if (!desired.containsKey(tracked.getKey())) {
                    tracked.getValue().token.cancel();
                    it.remove();
                    log.info("Stopped refresh job for {}", tracked.getKey());
                }
            }
        }
    }

    /**
     * Cancels every task and blocks until all of them have exited. In-flight cycles are allowed
     * to finish. Idempotent: a call made after an interrupted stop, or while another thread is
     * stopping, waits for the same tasks instead of returning early.
     */
    public void stop() {
        SchedulerState current = state.get();
        while (current == SchedulerState.IDLE || current == SchedulerState.RUNNING) {
            if (state.compareAndSet(current, SchedulerState.STOPPING)) {
                cancelAll();
                break;
            }
            current = state.get();
        }
        if (current == SchedulerState.STOPPED) {
            log.debug("Refresh job manager already stopped");
            return;
        }

        try {
            controller.awaitTermination(shutdownLogInterval.toMillis(), TimeUnit.MILLISECONDS);
            while (!taskExecutor.awaitTermination(shutdownLogInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("Waiting for in-flight refresh cycles to finish...");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for refresh tasks to stop");
            return;
        }

        if (state.getAndSet(SchedulerState.STOPPED) != SchedulerState.STOPPED) {
            log.info("Refresh job manager stopped");
        }
    }

    public SchedulerState getState() {
        return state.get();
    }

    /**
     * @return Tracked table names mapped to their current interval, sorted by table name.
     */
    public Map<String, Integer> getTrackedJobs() {
        Map<String, Integer> snapshot = new TreeMap<>();
        synchronized (lock) {
            jobs.forEach((table, entry) -> snapshot.put(table, entry.interval));
        }
        return snapshot;
    }

    /**
     * @return Number of tasks started since construction, replacements included.
     */
    public long getStartedTaskCount() {
        return startedTasks.get();
    }

    private void cancelAll() {
        log.info("Stopping refresh job manager...");
        controller.shutdown();

        List<JobEntry> entries;
        synchronized (lock) {
            entries = new ArrayList<>(jobs.values());
            jobs.clear();
        }
        entries.forEach(entry -> entry.token.cancel());
        taskExecutor.shutdown();
        log.info("Cancelled {} refresh tasks", entries.size());
    }

    private boolean acceptingWork() {
        SchedulerState current = state.get();
        return current == SchedulerState.IDLE || current == SchedulerState.RUNNING;
    }

    private void reconcileSafely() {
        try {
            reconcile();
        } catch (RuntimeException e) {
            // An exception escaping here would cancel the periodic schedule
            log.error("Reconciliation failed: {}", e.getMessage(), e);
        }
    }

    private JobEntry startTask(JobSpec spec, CountDownLatch predecessorFinished) {
        JobEntry entry = new JobEntry(spec.getIntervalSeconds());
        startedTasks.incrementAndGet();
        taskExecutor.execute(() -> runTask(spec.getTableName(), entry, predecessorFinished));
        return entry;
    }

    private void runTask(String tableName, JobEntry entry, CountDownLatch predecessorFinished) {
        MDC.put(MDC_TABLE_KEY, tableName);
        try {
            if (predecessorFinished != null) {
                predecessorFinished.await();
            }
            while (!entry.token.awaitCancellation(entry.interval, intervalUnit)) {
                try {
                    tableRefresher.refresh(tableName);
                } catch (RuntimeException e) {
                    log.error("Refresh cycle for {} failed: {}", tableName, e.getMessage(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Refresh task for {} interrupted", tableName);
        } finally {
            entry.finished.countDown();
            log.debug("Refresh task for {} exited", tableName);
            MDC.remove(MDC_TABLE_KEY);
        }
    }

    private String unitName() {
        return intervalUnit.name().toLowerCase(Locale.ROOT);
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class JobEntry {
        final CancellationToken token = new CancellationToken();
        final CountDownLatch finished = new CountDownLatch(1);
        final int interval;

        JobEntry(int interval) {
            this.interval = interval;
        }
    }
}
