package com.geico.poc.ttlindex.worker;

import com.geico.poc.ttlindex.lifecycle.RecoveryStateProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scheduling loop of the TTL background worker.
 *
 * Each iteration:
 * - waits for naptime, a signal, or supervisor death, then resets the latch; a signal
 *   delivered while a pass runs leaves the latch set, so the next wait returns at once
 * - exits on supervisor death (code 1) or a terminate request (code 0)
 * - reloads settings if a reload was requested
 * - runs a cleanup pass only on a timeout wake (or an unrecognised wake), and only while
 *   enabled and the store is not in recovery
 *
 * A pass in flight always runs to completion; terminate is only checked between passes.
 */
public class TtlWorker {

    private static final Logger log = LoggerFactory.getLogger(TtlWorker.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;

    private final String name;
    private final SignalState signals;
    private final WorkerLatch latch;
    private final WorkerSettingsProvider settingsProvider;
    private final RecoveryStateProbe recoveryProbe;
    private final CleanupExecutor cleanupExecutor;

    private WorkerSettings settings;
    private long passCount;

    public TtlWorker(String name,
                     SignalState signals,
                     WorkerLatch latch,
                     WorkerSettingsProvider settingsProvider,
                     RecoveryStateProbe recoveryProbe,
                     CleanupExecutor cleanupExecutor) {
        this.name = name;
        this.signals = signals;
        this.latch = latch;
        this.settingsProvider = settingsProvider;
        this.recoveryProbe = recoveryProbe;
        this.cleanupExecutor = cleanupExecutor;
    }

    /**
     * Run until terminated.
     *
     * @return process exit code
     */
    public int run() {
        settings = settingsProvider.load();
        log.info("🚀 " + name + " started (" + settings + ")");

        while (!signals.isTerminateRequested()) {
            int waitResult = latch.await(settings.getNaptimeMillis());
            latch.reset();

            if ((waitResult & WorkerLatch.WL_SUPERVISOR_DEATH) != 0) {
                log.error("❌ " + name + ": supervisor died, exiting");
                return EXIT_FATAL;
            }

            if (signals.isTerminateRequested()) {
                break;
            }

            if (signals.consumeReload()) {
                reloadSettings();
            }

            if (shouldPerformCleanup(waitResult) && canPerformCleanup()) {
                CleanupResult result = cleanupExecutor.runCleanupPass();
                Integer exitCode = handleResult(result);
                if (exitCode != null) {
                    return exitCode;
                }
            }
        }

        log.info("🛑 " + name + " shutting down after " + passCount + " cleanup passes");
        return EXIT_OK;
    }

    /**
     * Cleanup runs on timeout only. A wake caused purely by the latch (reload or terminate
     * signals) does not trigger one, so repeated reloads cannot cause a cleanup storm.
     * Anything else is treated as a reason to run.
     */
    static boolean shouldPerformCleanup(int waitResult) {
        if ((waitResult & WorkerLatch.WL_TIMEOUT) != 0) {
            return true;
        } else if ((waitResult & WorkerLatch.WL_LATCH_SET) != 0) {
            return false;
        } else {
            return true;
        }
    }

    boolean canPerformCleanup() {
        if (!settings.isEnabled()) {
            return false;
        }
        try {
            return !recoveryProbe.isInRecovery();
        } catch (RuntimeException e) {
            if (StoreErrors.isTerminationRequest(e)) {
                signals.requestTerminate();
            }
            log.warn("⚠️  " + name + ": could not check recovery state, skipping this cycle: " + e.getMessage());
            return false;
        }
    }

    private void reloadSettings() {
        try {
            settings = settingsProvider.load();
            log.info("🔄 " + name + " reloaded settings (" + settings + ")");
        } catch (RuntimeException e) {
            log.warn("⚠️  " + name + ": settings reload failed, keeping " + settings + ": " + e.getMessage());
        }
    }

    /**
     * @return exit code if the worker must stop, otherwise null
     */
    private Integer handleResult(CleanupResult result) {
        passCount++;
        switch (result.getStatus()) {
            case COMPLETED:
                if (result.getRowsDeleted() > 0) {
                    log.info("✅ " + name + ": cleanup pass deleted " + result.getRowsDeleted() + " expired rows");
                } else {
                    log.debug(name + ": cleanup pass found nothing to delete");
                }
                return null;
            case SKIPPED:
                return null;
            case FAILED:
            default:
                RuntimeException error = result.getError();
                if (StoreErrors.isTerminationRequest(error)) {
                    log.info("🛑 " + name + ": backend terminated by administrator command");
                    signals.requestTerminate();
                    return null;
                }
                if (StoreErrors.isSessionLost(error)) {
                    log.error("❌ " + name + ": store session lost, exiting: " + error.getMessage());
                    return EXIT_FATAL;
                }
                log.warn("⚠️  " + name + ": cleanup pass failed and was rolled back: " + error.getMessage());
                return null;
        }
    }

    WorkerSettings getSettings() {
        return settings;
    }
}
