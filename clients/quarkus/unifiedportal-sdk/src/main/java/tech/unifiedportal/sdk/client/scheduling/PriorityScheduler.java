package tech.unifiedportal.sdk.client.scheduling;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;
import tech.unifiedportal.sdk.enums.Priority;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Concurrency-limited scheduler with five strict-priority FIFO lanes.
 *
 * <p>Dispatch scans lanes from {@link Priority#CRITICAL} to {@link Priority#BACKGROUND}
 * while fewer than {@code maxConcurrent} units are executing. When a unit finishes
 * and work is still queued, the next scan runs on the scheduler thread after a
 * {@value #YIELD_MS}ms yield, never from inside the completing unit.
 *
 * <p>A steady stream of CRITICAL work starves BACKGROUND work. That is accepted.
 */
public class PriorityScheduler {

    private static final Logger LOG = Logger.getLogger(PriorityScheduler.class);

    static final long YIELD_MS = 10;

    private final int maxConcurrent;
    private final Clock clock;
    private final ScheduledExecutorService yieldExecutor;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Priority, ArrayDeque<UnitOfWork<?>>> lanes = new EnumMap<>(Priority.class);

    private int activeCount;
    private boolean drainScheduled;
    private volatile boolean shutdown;

    public PriorityScheduler(int maxConcurrent, MeterRegistry meterRegistry, Clock clock) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be positive: " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.clock = clock;
        for (Priority priority : Priority.values()) {
            lanes.put(priority, new ArrayDeque<>());
        }
        this.yieldExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "unifiedportal-scheduler");
            t.setDaemon(true);
            return t;
        });
        registerGauges(meterRegistry);
        LOG.infof("Priority scheduler started with maxConcurrent %d", maxConcurrent);
    }

    private void registerGauges(MeterRegistry meterRegistry) {
        Gauge.builder("unifiedportal.scheduler.active", this, PriorityScheduler::activeCount)
            .description("Units of work currently executing")
            .register(meterRegistry);
        for (Priority priority : Priority.values()) {
            Gauge.builder("unifiedportal.scheduler.pending", this, s -> s.pendingIn(priority))
                .description("Units of work waiting in a lane")
                .tag("priority", priority.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry);
        }
    }

    /**
     * Queue work at the given priority.
     *
     * @param work starts the work and returns its completion
     * @return completes with the work's outcome once it has been dispatched and finished
     */
    public <T> CompletableFuture<T> enqueue(Supplier<CompletableFuture<T>> work, Priority priority) {
        if (shutdown) {
            return CompletableFuture.failedFuture(new RejectedExecutionException("Scheduler is shut down"));
        }

        UnitOfWork<T> unit = new UnitOfWork<>(priority, work, clock.instant());
        lock.lock();
        try {
            lanes.get(priority).addLast(unit);
        } finally {
            lock.unlock();
        }
        LOG.debugf("Queued unit [%s] at %s", unit.id(), priority);

        drain();
        return unit.completion();
    }

    private void drain() {
        List<UnitOfWork<?>> dispatch = new ArrayList<>();
        lock.lock();
        try {
            while (activeCount < maxConcurrent) {
                UnitOfWork<?> next = pollHighestPriority();
                if (next == null) {
                    break;
                }
                activeCount++;
                dispatch.add(next);
            }
        } finally {
            lock.unlock();
        }

        dispatch.forEach(this::execute);
    }

    private UnitOfWork<?> pollHighestPriority() {
        for (Priority priority : Priority.values()) {
            UnitOfWork<?> unit = lanes.get(priority).pollFirst();
            if (unit != null) {
                return unit;
            }
        }
        return null;
    }

    private <T> void execute(UnitOfWork<T> unit) {
        LOG.debugf("Dispatching unit [%s] (%s)", unit.id(), unit.priority());
        unit.start().whenComplete((result, failure) -> onFinished(unit, result, failure));
    }

    private <T> void onFinished(UnitOfWork<T> unit, T result, Throwable failure) {
        lock.lock();
        try {
            activeCount--;
        } finally {
            lock.unlock();
        }

        unit.finish(result, failure);
        scheduleDrainIfQueued();
    }

    private void scheduleDrainIfQueued() {
        lock.lock();
        try {
            if (drainScheduled || shutdown || totalQueued() == 0) {
                return;
            }
            drainScheduled = true;
        } finally {
            lock.unlock();
        }

        try {
            yieldExecutor.schedule(() -> {
                lock.lock();
                try {
                    drainScheduled = false;
                } finally {
                    lock.unlock();
                }
                drain();
            }, YIELD_MS, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Scheduler shut down, queued work will not be dispatched");
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return activeCount;
        } finally {
            lock.unlock();
        }
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    private int pendingIn(Priority priority) {
        lock.lock();
        try {
            return lanes.get(priority).size();
        } finally {
            lock.unlock();
        }
    }

    private int totalQueued() {
        int total = 0;
        for (ArrayDeque<UnitOfWork<?>> lane : lanes.values()) {
            total += lane.size();
        }
        return total;
    }

    public QueueStats stats() {
        lock.lock();
        try {
            Map<Priority, Integer> perLane = new EnumMap<>(Priority.class);
            lanes.forEach((priority, lane) -> perLane.put(priority, lane.size()));
            return new QueueStats(Collections.unmodifiableMap(perLane), activeCount, totalQueued(), maxConcurrent);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop dispatching and fail everything still queued.
     */
    public void shutdown() {
        List<UnitOfWork<?>> abandoned = new ArrayList<>();
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            lanes.values().forEach(lane -> {
                abandoned.addAll(lane);
                lane.clear();
            });
        } finally {
            lock.unlock();
        }

        yieldExecutor.shutdownNow();
        RejectedExecutionException rejected = new RejectedExecutionException("Scheduler is shut down");
        abandoned.forEach(unit -> unit.finish(null, rejected));
        LOG.infof("Priority scheduler shut down, %d queued unit(s) rejected", abandoned.size());
    }
}
