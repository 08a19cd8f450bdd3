package de.bsommerfeld.liteguard.core.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Process-wide collector of teardown jobs.
 *
 * <h3>Ordering</h3>
 * Jobs run in registration order. A job that returns {@code false} or throws
 * is logged and the remaining jobs still run; one broken resource must not
 * keep the others open.
 *
 * <h3>Single shot</h3>
 * {@link #runJobs()} does its work on the first call only. The JVM hook
 * installed by {@link #installHook()} and an explicit call during an orderly
 * stop can therefore coexist without closing anything twice.
 */
public class ShutdownCoordinator implements ShutdownRegistrar {

    private static final Logger LOG = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private final List<Job> jobs = new ArrayList<>();
    private final AtomicBoolean ran = new AtomicBoolean(false);
    private final AtomicBoolean hookInstalled = new AtomicBoolean(false);

    @Override
    public synchronized void addJob(BooleanSupplier job, String label) {
        Objects.requireNonNull(job, "job");
        if (ran.get()) {
            LOG.warn("Shutdown already ran, job '{}' will not be executed.", label);
            return;
        }
        jobs.add(new Job(job, label));
        LOG.debug("Registered shutdown job '{}'", label);
    }

    /**
     * Registers a JVM shutdown hook that calls {@link #runJobs()}. Repeated
     * calls install nothing further.
     */
    public void installHook() {
        if (!hookInstalled.compareAndSet(false, true))
            return;
        Thread hook = new Thread(this::runJobs, "liteguard-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        LOG.debug("Shutdown hook installed.");
    }

    /**
     * Runs every registered job once.
     *
     * @return number of jobs that reported success; {@code 0} on every call
     *         after the first
     */
    public int runJobs() {
        if (!ran.compareAndSet(false, true))
            return 0;

        List<Job> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(jobs);
            jobs.clear();
        }

        LOG.info("Running {} shutdown job(s)...", snapshot.size());
        int succeeded = 0;
        for (Job job : snapshot) {
            try {
                if (job.action().getAsBoolean()) {
                    succeeded++;
                    LOG.info("Shutdown job '{}' done.", job.label());
                } else {
                    LOG.error("Shutdown job '{}' reported failure.", job.label());
                }
            } catch (RuntimeException e) {
                LOG.error("Shutdown job '{}' threw", job.label(), e);
            }
        }
        return succeeded;
    }

    /** Number of jobs waiting for {@link #runJobs()}. */
    public synchronized int pendingJobs() {
        return jobs.size();
    }

    public boolean hasRun() {
        return ran.get();
    }

    private record Job(BooleanSupplier action, String label) {
    }
}
