package tech.unifiedportal.sdk.client.scheduling;

import tech.unifiedportal.sdk.enums.Priority;
import tech.unifiedportal.sdk.support.TsidGenerator;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * A queued unit of work, owned by its priority lane until dispatched.
 *
 * @param <T> result type of the work
 */
public final class UnitOfWork<T> {

    private final String id;
    private final Priority priority;
    private final Supplier<CompletableFuture<T>> work;
    private final CompletableFuture<T> completion = new CompletableFuture<>();
    private final Instant enqueuedAt;

    UnitOfWork(Priority priority, Supplier<CompletableFuture<T>> work, Instant enqueuedAt) {
        this.id = TsidGenerator.unitId();
        this.priority = priority;
        this.work = work;
        this.enqueuedAt = enqueuedAt;
    }

    public String id() {
        return id;
    }

    public Priority priority() {
        return priority;
    }

    public Instant enqueuedAt() {
        return enqueuedAt;
    }

    CompletableFuture<T> completion() {
        return completion;
    }

    /**
     * Invoke the work. A thunk that throws, or returns null, yields a failed future.
     */
    CompletableFuture<T> start() {
        try {
            CompletableFuture<T> started = work.get();
            if (started == null) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Unit of work " + id + " returned no future"));
            }
            return started;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    void finish(T result, Throwable failure) {
        if (failure != null) {
            completion.completeExceptionally(failure);
        } else {
            completion.complete(result);
        }
    }
}
