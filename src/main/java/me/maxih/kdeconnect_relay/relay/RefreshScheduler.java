package me.maxih.kdeconnect_relay.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

class RefreshScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RefreshScheduler.class);

    private final ScheduledExecutorService executor;
    private final Duration burstInterval;
    private final Duration backstopInterval;
    private final Consumer<RelayInput> sink;

    RefreshScheduler(Duration burstInterval, Duration backstopInterval, Consumer<RelayInput> sink) {
        this.burstInterval = burstInterval;
        this.backstopInterval = backstopInterval;
        this.sink = sink;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "kdeconnect-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    void start() {
        long burstMillis = burstInterval.toMillis();
        long backstopMillis = backstopInterval.toMillis();
        executor.scheduleAtFixedRate(() -> sink.accept(new RelayInput.BurstTick()),
                burstMillis, burstMillis, TimeUnit.MILLISECONDS);
        executor.scheduleWithFixedDelay(() -> sink.accept(new RelayInput.BackstopTick()),
                backstopMillis, backstopMillis, TimeUnit.MILLISECONDS);
        logger.debug("Refresh ticks scheduled: burst every {} ms, backstop every {} ms", burstMillis, backstopMillis);
    }

    @Override
    public void close() {
        if (!executor.isShutdown()) executor.shutdownNow();
    }
}
