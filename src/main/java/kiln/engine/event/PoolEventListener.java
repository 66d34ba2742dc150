package kiln.engine.event;

/**
 * Receives pool events on the publishing thread, usually the coordinator loop.
 * Implementations must return quickly and hand slow work to their own executor.
 */
@FunctionalInterface
public interface PoolEventListener {
    void onEvent(PoolEvent event);
}
