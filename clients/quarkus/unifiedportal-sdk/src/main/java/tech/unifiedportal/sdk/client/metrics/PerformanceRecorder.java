package tech.unifiedportal.sdk.client.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Records the outcome and latency of every completed call attempt.
 *
 * <p>Keeps a running aggregate plus the last {@value #HISTORY_SIZE} latency samples,
 * and mirrors each record into Micrometer.
 */
public class PerformanceRecorder {

    private static final Logger LOG = Logger.getLogger(PerformanceRecorder.class);

    static final int HISTORY_SIZE = 100;
    static final long SLOW_THRESHOLD_MS = 5000;

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Timer successTimer;
    private final Timer failureTimer;
    private final Counter serverErrorCounter;
    private final Counter clientErrorCounter;
    private final Counter networkErrorCounter;
    private final Counter slowCounter;

    private final long[] history = new long[HISTORY_SIZE];
    private int historyStart;
    private int historyCount;

    private long totalCalls;
    private long successCount;
    private long failureCount;
    private long totalLatency;
    private long slowCallCount;
    private long serverErrors;
    private long clientErrors;
    private long networkErrors;

    public PerformanceRecorder(MeterRegistry meterRegistry, Clock clock) {
        this.clock = clock;
        this.successTimer = Timer.builder("unifiedportal.client.calls")
            .description("Completed call attempts")
            .tag("outcome", "success")
            .register(meterRegistry);
        this.failureTimer = Timer.builder("unifiedportal.client.calls")
            .description("Completed call attempts")
            .tag("outcome", "failure")
            .register(meterRegistry);
        this.serverErrorCounter = errorCounter(meterRegistry, "server");
        this.clientErrorCounter = errorCounter(meterRegistry, "client");
        this.networkErrorCounter = errorCounter(meterRegistry, "network");
        this.slowCounter = Counter.builder("unifiedportal.client.slow")
            .description("Call attempts slower than " + SLOW_THRESHOLD_MS + "ms")
            .register(meterRegistry);
    }

    private static Counter errorCounter(MeterRegistry meterRegistry, String bucket) {
        return Counter.builder("unifiedportal.client.errors")
            .description("Failed call attempts by error bucket")
            .tag("bucket", bucket)
            .register(meterRegistry);
    }

    /**
     * Record a completed attempt.
     *
     * @param startedAt when the attempt started executing
     * @param success whether the attempt succeeded
     * @param statusCode response status, or 0 when no response was received
     */
    public void record(Instant startedAt, boolean success, int statusCode) {
        long latency = Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());

        lock.lock();
        try {
            totalCalls++;
            totalLatency += latency;
            appendHistory(latency);

            if (success) {
                successCount++;
            } else {
                failureCount++;
                if (statusCode >= 500) {
                    serverErrors++;
                    serverErrorCounter.increment();
                } else if (statusCode >= 400) {
                    clientErrors++;
                    clientErrorCounter.increment();
                } else {
                    networkErrors++;
                    networkErrorCounter.increment();
                }
            }

            if (latency > SLOW_THRESHOLD_MS) {
                slowCallCount++;
                slowCounter.increment();
                LOG.warnf("Slow call: %dms (status %d)", latency, statusCode);
            }
        } finally {
            lock.unlock();
        }

        (success ? successTimer : failureTimer).record(Duration.ofMillis(latency));
    }

    public CallMetrics snapshot() {
        lock.lock();
        try {
            double averageLatency = totalCalls == 0 ? 0.0 : (double) totalLatency / totalCalls;
            double successRate = totalCalls == 0 ? 0.0 : (double) successCount / totalCalls * 100.0;
            return new CallMetrics(totalCalls, successCount, failureCount, totalLatency,
                averageLatency, successRate, slowCallCount, serverErrors, clientErrors,
                networkErrors, copyHistory());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Zero the aggregate and history. Micrometer meters are cumulative and keep counting.
     */
    public void reset() {
        lock.lock();
        try {
            totalCalls = 0;
            successCount = 0;
            failureCount = 0;
            totalLatency = 0;
            slowCallCount = 0;
            serverErrors = 0;
            clientErrors = 0;
            networkErrors = 0;
            historyStart = 0;
            historyCount = 0;
        } finally {
            lock.unlock();
        }
    }

    private void appendHistory(long latency) {
        if (historyCount < HISTORY_SIZE) {
            history[(historyStart + historyCount) % HISTORY_SIZE] = latency;
            historyCount++;
        } else {
            history[historyStart] = latency;
            historyStart = (historyStart + 1) % HISTORY_SIZE;
        }
    }

    private List<Long> copyHistory() {
        List<Long> copy = new ArrayList<>(historyCount);
        for (int i = 0; i < historyCount; i++) {
            copy.add(history[(historyStart + i) % HISTORY_SIZE]);
        }
        return copy;
    }
}
