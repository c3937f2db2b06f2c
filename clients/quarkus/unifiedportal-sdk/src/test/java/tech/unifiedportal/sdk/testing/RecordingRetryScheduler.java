package tech.unifiedportal.sdk.testing;

import tech.unifiedportal.sdk.client.retry.RetryScheduler;
import tech.unifiedportal.sdk.client.retry.ScheduledRetry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records requested backoff delays. Actions run immediately unless the scheduler is paused,
 * in which case they wait for {@link #runPending()}.
 */
public class RecordingRetryScheduler implements RetryScheduler {

    private final List<Duration> delays = new CopyOnWriteArrayList<>();
    private final List<Pending> pending = new CopyOnWriteArrayList<>();
    private volatile boolean paused;

    public void pause() {
        paused = true;
    }

    @Override
    public ScheduledRetry schedule(Duration delay, Runnable action) {
        delays.add(delay);
        Pending retry = new Pending(action);
        if (paused) {
            pending.add(retry);
        } else {
            retry.run();
        }
        return retry;
    }

    public void runPending() {
        List<Pending> toRun = new ArrayList<>(pending);
        pending.clear();
        toRun.forEach(Pending::run);
    }

    public List<Duration> delays() {
        return delays;
    }

    public List<Long> delaysInMillis() {
        return delays.stream().map(Duration::toMillis).toList();
    }

    private static final class Pending implements ScheduledRetry {

        private final Runnable action;
        private boolean done;
        private boolean cancelled;

        Pending(Runnable action) {
            this.action = action;
        }

        synchronized void run() {
            if (cancelled || done) {
                return;
            }
            done = true;
            action.run();
        }

        @Override
        public synchronized boolean cancel() {
            if (done) {
                return false;
            }
            cancelled = true;
            done = true;
            return true;
        }

        @Override
        public synchronized boolean isDone() {
            return done;
        }
    }
}
