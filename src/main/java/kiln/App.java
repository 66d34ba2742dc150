package kiln;

import kiln.engine.config.Dependencies;
import kiln.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point.
 *
 * Starts the worker pool and its HTTP API, configured from the INI file given
 * as the first argument or from KILN_* environment variables, and runs until
 * the JVM is asked to stop.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        EngineConfig config;
        try {
            config = loadConfig(args);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "kiln-shutdown"));

        try {
            deps.httpServer().start();
        } catch (IllegalStateException e) {
            log.error("Failed to start", e);
            deps.close();
            System.exit(1);
            return;
        }

        log.info("Kiln engine running with {}", config);
        stopped.await();
    }

    static EngineConfig loadConfig(String[] args) throws IOException {
        if (args.length > 0) {
            File file = new File(args[0]);
            log.info("Loading configuration from {}", file.getAbsolutePath());
            return EngineConfig.fromIni(file);
        }
        return EngineConfig.fromEnv();
    }
}
