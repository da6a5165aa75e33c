package com.koni.historyinjector.infrastructure.messaging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Stops ingestion for good once a fatal condition is detected.
 *
 * Listener containers are stopped from a separate thread because the halt is usually triggered
 * from a consumer thread, which must be allowed to return before its container can stop.
 */
@Slf4j
@Component
public class IngestionHaltSwitch {

    private final KafkaListenerEndpointRegistry registry;
    private final AtomicBoolean halted = new AtomicBoolean(false);
    private final AtomicReference<String> haltReason = new AtomicReference<>();

    public IngestionHaltSwitch(KafkaListenerEndpointRegistry registry) {
        this.registry = registry;
    }

    /**
     * Halts ingestion. Only the first call has an effect.
     *
     * @param cause why ingestion stops
     */
    public void halt(Throwable cause) {
        if (!halted.compareAndSet(false, true)) {
            return;
        }
        haltReason.set(String.valueOf(cause.getMessage()));
        log.error("FATAL: halting history ingestion, no further messages will be consumed: {}", cause.getMessage(), cause);
        Thread stopper = new Thread(() -> {
            registry.stop();
            log.error("All history listener containers stopped");
        }, "ingestion-halt");
        stopper.setDaemon(true);
        stopper.start();
    }

    public boolean isHalted() {
        return halted.get();
    }

    public String getHaltReason() {
        return haltReason.get();
    }
}
