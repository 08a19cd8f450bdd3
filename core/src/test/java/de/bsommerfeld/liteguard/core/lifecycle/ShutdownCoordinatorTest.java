package de.bsommerfeld.liteguard.core.lifecycle;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ShutdownCoordinatorTest {

    @Test
    void runJobs_shouldRunJobsInRegistrationOrder() {
        var coordinator = new ShutdownCoordinator();
        List<String> order = new ArrayList<>();
        coordinator.addJob(() -> order.add("first"), "first");
        coordinator.addJob(() -> order.add("second"), "second");

        assertEquals(2, coordinator.runJobs());
        assertEquals(List.of("first", "second"), order);
    }

    @Test
    void runJobs_shouldRunEachJobOnlyOnce() {
        var coordinator = new ShutdownCoordinator();
        var calls = new AtomicInteger();
        coordinator.addJob(() -> calls.incrementAndGet() > 0, "count");

        coordinator.runJobs();
        assertEquals(0, coordinator.runJobs());
        assertEquals(1, calls.get());
        assertTrue(coordinator.hasRun());
    }

    @Test
    void runJobs_shouldContinueAfterFailingJob() {
        var coordinator = new ShutdownCoordinator();
        var reached = new AtomicInteger();
        coordinator.addJob(() -> false, "reports failure");
        coordinator.addJob(() -> {
            throw new IllegalStateException("boom");
        }, "throws");
        coordinator.addJob(() -> reached.incrementAndGet() == 1, "last");

        assertEquals(1, coordinator.runJobs());
        assertEquals(1, reached.get());
    }

    @Test
    void addJob_shouldIgnoreJobsAfterShutdown() {
        var coordinator = new ShutdownCoordinator();
        coordinator.runJobs();

        coordinator.addJob(() -> true, "late");

        assertEquals(0, coordinator.pendingJobs());
    }

    @Test
    void installHook_shouldBeIdempotent() {
        var coordinator = new ShutdownCoordinator();
        assertDoesNotThrow(() -> {
            coordinator.installHook();
            coordinator.installHook();
        });
    }
}
