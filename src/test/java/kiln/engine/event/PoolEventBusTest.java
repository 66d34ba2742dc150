package kiln.engine.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PoolEventBusTest {

    @Test
    void deliversToEveryListenerInOrder() {
        PoolEventBus bus = new PoolEventBus();
        List<String> received = new ArrayList<>();
        bus.subscribe(e -> received.add("a:" + e.type()));
        bus.subscribe(e -> received.add("b:" + e.type()));

        bus.publish(PoolEvent.worker(PoolEventType.WORKER_CREATED, "worker-1", null));

        assertEquals(List.of("a:WORKER_CREATED", "b:WORKER_CREATED"), received);
    }

    @Test
    void failingListenerIsIsolated() {
        PoolEventBus bus = new PoolEventBus();
        List<PoolEvent> received = new ArrayList<>();
        bus.subscribe(e -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribe(received::add);

        assertDoesNotThrow(() -> bus.publish(PoolEvent.pool(PoolEventType.SHUTDOWN_STARTED, "stop")));
        assertEquals(1, received.size());
        assertEquals("stop", received.get(0).message());
    }

    @Test
    void subscribeIsIdempotentAndUnsubscribeRemoves() {
        PoolEventBus bus = new PoolEventBus();
        List<PoolEvent> received = new ArrayList<>();
        PoolEventListener listener = received::add;

        bus.subscribe(listener);
        bus.subscribe(listener);
        assertEquals(1, bus.listenerCount());

        bus.unsubscribe(listener);
        bus.publish(PoolEvent.pool(PoolEventType.SHUTDOWN_COMPLETED, null));
        assertTrue(received.isEmpty());
        assertEquals(0, bus.listenerCount());
    }
}
