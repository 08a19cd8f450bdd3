package de.bsommerfeld.liteguard.core.lifecycle;

import java.util.function.BooleanSupplier;

/**
 * Accepts teardown jobs that must run once when the process terminates
 * gracefully. A job reports success by returning {@code true}.
 */
public interface ShutdownRegistrar {

    /**
     * @param job   teardown action, invoked at most once
     * @param label human-readable name used in shutdown logging
     */
    void addJob(BooleanSupplier job, String label);
}
