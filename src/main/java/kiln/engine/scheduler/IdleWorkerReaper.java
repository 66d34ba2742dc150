package kiln.engine.scheduler;

import kiln.engine.config.EngineConfig;
import kiln.engine.core.PoolCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Background job that retires workers which have sat idle longer than
 * {@code idleTimeout}. The removal itself happens on the coordinator loop;
 * this only computes the cutoff and waits briefly for the count.
 */
public class IdleWorkerReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(IdleWorkerReaper.class);

    private static final long WAIT_MS = 2_000;

    private final PoolCoordinator pool;
    private final EngineConfig config;

    public IdleWorkerReaper(PoolCoordinator pool, EngineConfig config) {
        this.pool = pool;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reapIdleWorkers();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Idle worker reaper error", e);
        }
    }

    /**
     * @return number of workers retired
     */
    public int reapIdleWorkers() throws InterruptedException, ExecutionException, TimeoutException {
        if (pool.isShutdown()) {
            return 0;
        }
        Instant cutoff = Instant.now().minus(config.idleTimeout());
        int retired = pool.retireIdleWorkers(cutoff).get(WAIT_MS, TimeUnit.MILLISECONDS);

        if (retired > 0) {
            log.info("Idle reaper: retired {} worker(s) idle since before {}", retired, cutoff);
        } else {
            log.debug("No idle workers to retire");
        }
        return retired;
    }
}
