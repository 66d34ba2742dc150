package kiln.engine.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out of pool events to subscribed listeners.
 * A failing listener is logged and skipped; it never affects the publisher or
 * the other listeners.
 */
public final class PoolEventBus {

    private static final Logger log = LoggerFactory.getLogger(PoolEventBus.class);

    private final CopyOnWriteArrayList<PoolEventListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(PoolEventListener listener) {
        listeners.addIfAbsent(listener);
    }

    public void unsubscribe(PoolEventListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void publish(PoolEvent event) {
        for (PoolEventListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {}: {}", l.getClass().getSimpleName(), event.type(), e.toString());
            }
        }
    }
}
