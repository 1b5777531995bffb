package com.msgrelay.app;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessSupervisorTest {

    @Test
    void crashedUnitLeavesTheOtherRunning() throws Exception {
        BlockingUnit survivor = new BlockingUnit("socket");
        CrashingUnit crasher = new CrashingUnit("http");
        ProcessSupervisor supervisor = new ProcessSupervisor(List.of(crasher, survivor));

        Thread runner = new Thread(() -> {
            try {
                supervisor.runAll();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        runner.start();

        assertTrue(crasher.crashed.await(5, TimeUnit.SECONDS));
        assertTrue(survivor.started.await(5, TimeUnit.SECONDS));
        runner.join(200);
        assertTrue(runner.isAlive(), "supervisor must keep waiting for the surviving unit");
        assertEquals(1, survivor.stopped.getCount());

        supervisor.stopAll();
        runner.join(5000);
        assertFalse(runner.isAlive());
    }

    @Test
    void eachUnitRunsOnItsOwnNamedThread() throws Exception {
        RecordingUnit http = new RecordingUnit("http");
        RecordingUnit socket = new RecordingUnit("socket");

        new ProcessSupervisor(List.of(http, socket)).runAll();

        assertEquals("relay-unit-http", http.threadName.get());
        assertEquals("relay-unit-socket", socket.threadName.get());
    }

    @Test
    void stopFailureDoesNotPreventStoppingOthers() {
        BlockingUnit other = new BlockingUnit("socket");
        RelayUnit failingStop = new RecordingUnit("http") {
            @Override
            public void stop() {
                throw new IllegalStateException("already stopped");
            }
        };

        new ProcessSupervisor(List.of(failingStop, other)).stopAll();

        assertEquals(0, other.stopped.getCount());
    }

    private static class BlockingUnit implements RelayUnit {
        private final String name;
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch stopped = new CountDownLatch(1);

        BlockingUnit(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void run() throws InterruptedException {
            started.countDown();
            stopped.await();
        }

        @Override
        public void stop() {
            stopped.countDown();
        }
    }

    private static class CrashingUnit implements RelayUnit {
        private final String name;
        final CountDownLatch crashed = new CountDownLatch(1);

        CrashingUnit(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void run() {
            crashed.countDown();
            throw new IllegalStateException("Address already in use");
        }

        @Override
        public void stop() {
        }
    }

    private static class RecordingUnit implements RelayUnit {
        private final String name;
        final AtomicReference<String> threadName = new AtomicReference<>();

        RecordingUnit(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void run() {
            threadName.set(Thread.currentThread().getName());
        }

        @Override
        public void stop() {
        }
    }
}
