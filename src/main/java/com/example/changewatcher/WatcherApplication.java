package com.example.changewatcher;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import com.example.changewatcher.exceptions.WatcherException;
import com.example.changewatcher.models.FilterSpec;
import com.example.changewatcher.service.CancellationSignal;
import com.example.changewatcher.service.ChangeEventHandler;
import com.example.changewatcher.service.WatcherController;

import io.prometheus.client.exporter.HTTPServer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

@SpringBootApplication
public class WatcherApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(WatcherApplication.class);

    @Value("${prometheus.server.port:8081}") // Default port for metrics
    private int metricsPort;

    @Value("${prometheus.server.enabled:true}")
    private boolean metricsEnabled;

    @Value("${watcher.autostart:true}")
    private boolean autostart;

    // 0s watches until shutdown
    @Value("${watcher.duration:60s}")
    private Duration duration;

    @Value("${spring.lifecycle.timeout-per-shutdown-phase:30s}")
    private Duration shutdownTimeout;

    @Autowired
    private WatcherController watcherController;

    @Autowired
    private FilterSpec filterSpec;

    @Autowired
    private ChangeEventHandler changeEventHandler;

    private HTTPServer httpServer;

    private ExecutorService watcherExecutor;

    public WatcherApplication() {
    }

    @PostConstruct
    public void init() {
        if (metricsEnabled) {
            startHttpServer();
        }
        if (autostart) {
            startWatcher();
        }
    }

    public void startHttpServer() {
        try {
            httpServer = new HTTPServer(metricsPort);
            LOGGER.info("Prometheus metrics server started on port {}", metricsPort);
        } catch (Exception e) {
            LOGGER.error("Error starting Prometheus HTTP server: {}", e.getMessage());
        }
    }

    public void startWatcher() {
        watcherExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "change-watcher");
            thread.setDaemon(true);
            return thread;
        });
        watcherExecutor.execute(this::runWatcher);
        LOGGER.info("Change stream watcher started in a daemon thread");
    }

    public void runWatcher() {
        try {
            if (duration == null || duration.isZero()) {
                watcherController.run(filterSpec, changeEventHandler, new CancellationSignal());
            } else {
                watcherController.run(filterSpec, changeEventHandler, duration);
            }
        } catch (WatcherException e) {
            LOGGER.error("Change stream watcher stopped: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void closeConnection() {
        try {
            if (httpServer != null) {
                httpServer.close();
                LOGGER.info("Prometheus metrics server stopped");
            }
            watcherController.close();
            awaitWatcherStopped();
        } catch (Exception e) {
            LOGGER.error("Error closing change stream watcher", e);
        }
    }

    // The watcher flushes its resume token on the way out, which needs the Mongo client still open
    private void awaitWatcherStopped() {
        if (watcherExecutor == null) {
            return;
        }
        watcherExecutor.shutdown();
        try {
            if (!watcherExecutor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.error("Change stream watcher did not stop within {}", shutdownTimeout);
                watcherExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            watcherExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static void main(String[] args) {
        SpringApplication.run(WatcherApplication.class, args);
    }
}
