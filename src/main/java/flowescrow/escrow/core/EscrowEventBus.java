package flowescrow.escrow.core;

import flowescrow.escrow.model.EscrowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of committed escrow events (indexers, dashboards, audit log).
 * Listeners run on the calling thread after the operation has committed.
 */
public final class EscrowEventBus {

    private static final Logger log = LoggerFactory.getLogger(EscrowEventBus.class);
    private static final Logger audit = LoggerFactory.getLogger("flowescrow.audit");

    private final CopyOnWriteArrayList<Consumer<EscrowEvent>> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(Consumer<EscrowEvent> listener) {
        listeners.add(listener);
    }

    public void unsubscribe(Consumer<EscrowEvent> listener) {
        listeners.remove(listener);
    }

    /**
     * Deliver to every listener. A failing listener is logged and does not stop the others.
     */
    public void publish(EscrowEvent event) {
        audit.info("#{} {} task={} actor={} {}",
                event.sequence(), event.type(), event.taskId(), event.actor(), event.details());
        for (Consumer<EscrowEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed on #{} {}: {}", event.sequence(), event.type(), e.toString(), e);
            }
        }
    }
}
