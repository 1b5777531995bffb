package com.msgrelay.app;

import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Starts every unit on its own thread and waits for all of them to finish.
 * <p>
 * A unit that fails is logged and left down; it is not restarted and the others keep running.
 */
@Slf4j
public class ProcessSupervisor {

    private final List<RelayUnit> units;

    public ProcessSupervisor(List<RelayUnit> units) {
        this.units = List.copyOf(units);
    }

    public void runAll() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, units.size()),
                new DefaultThreadFactory("relay-unit"));
        try {
            List<Future<?>> running = new ArrayList<>();
            for (RelayUnit unit : units) {
                log.info("Starting {} unit", unit.name());
                running.add(executor.submit(() -> runUnit(unit)));
            }
            for (Future<?> future : running) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    log.error("Unit thread ended abnormally", e.getCause());
                }
            }
        } finally {
            executor.shutdownNow();
        }
        log.info("All units terminated");
    }

    public void stopAll() {
        for (RelayUnit unit : units) {
            try {
                unit.stop();
            } catch (RuntimeException e) {
                log.error("Failed to stop {} unit: {}", unit.name(), e.getMessage());
            }
        }
    }

    private static void runUnit(RelayUnit unit) {
        Thread.currentThread().setName("relay-unit-" + unit.name());
        try {
            unit.run();
            log.info("{} unit terminated", unit.name());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} unit interrupted", unit.name());
        } catch (Exception e) {
            log.error("{} unit crashed", unit.name(), e);
        }
    }
}
