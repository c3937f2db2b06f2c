package tech.unifiedportal.sdk.notification;

import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Typed publish/subscribe for {@link PortalEvent}s.
 *
 * <p>Listeners run on the publishing thread. A listener that throws is logged and
 * does not prevent delivery to the others.
 */
public class PortalEventBus {

    private static final Logger LOG = Logger.getLogger(PortalEventBus.class);

    private final List<Listener<?>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Subscribe to events of the given type, including its subtypes.
     * Pass {@code PortalEvent.class} to receive everything.
     */
    public <E extends PortalEvent> EventSubscription subscribe(Class<E> eventType, Consumer<? super E> consumer) {
        Listener<E> listener = new Listener<>(eventType, consumer);
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(PortalEvent event) {
        for (Listener<?> listener : listeners) {
            try {
                listener.deliver(event);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Listener for [%s] failed", event.type());
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    private record Listener<E extends PortalEvent>(Class<E> eventType, Consumer<? super E> consumer) {

        void deliver(PortalEvent event) {
            if (eventType.isInstance(event)) {
                consumer.accept(eventType.cast(event));
            }
        }
    }
}
