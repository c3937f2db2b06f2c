package tech.unifiedportal.sdk.notification;

/**
 * Handle returned by {@link PortalEventBus#subscribe}. Cancelling is idempotent.
 */
@FunctionalInterface
public interface EventSubscription extends AutoCloseable {

    void cancel();

    @Override
    default void close() {
        cancel();
    }
}
