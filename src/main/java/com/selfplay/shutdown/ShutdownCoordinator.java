package com.selfplay.shutdown;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.selfplay.manager.SelfplayManager;
import com.selfplay.runtime.SetupResult;

/**
 * Owns the stop protocol: signal delivery flips the {@link StopSignal}, workers drain on their own, and
 * {@link #completeShutdown} tears down the poll loop and the manager once every worker has joined.
 */
public class ShutdownCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private final StopSignal stopSignal;
    private final InterruptibleSleeper sleeper;
    private final long shutdownGraceMs;
    private final HookRegistry hookRegistry;
    private final CountDownLatch teardownComplete = new CountDownLatch(1);

    private volatile Thread installedHook;
    private volatile int exitStatus = -1;

    public ShutdownCoordinator(StopSignal stopSignal, InterruptibleSleeper sleeper, long shutdownGraceMs) {
        this(stopSignal, sleeper, shutdownGraceMs, HookRegistry.runtime());
    }

    ShutdownCoordinator(StopSignal stopSignal, InterruptibleSleeper sleeper, long shutdownGraceMs, HookRegistry hookRegistry) {
        this.stopSignal = stopSignal;
        this.sleeper = sleeper;
        this.shutdownGraceMs = shutdownGraceMs;
        this.hookRegistry = hookRegistry;
    }

    /**
     * Registers the JVM shutdown hook that SIGINT and SIGTERM run through. If the hook cannot be
     * registered there is no working signal-driven stop path and startup must abort.
     */
    public SetupResult<Thread> installSignalHandlers() {
        Thread hook = new Thread(this::onShutdownSignal, "selfplay-shutdown-hook");
        try {
            hookRegistry.add(hook);
        } catch (IllegalStateException | SecurityException e) {
            return SetupResult.failed("Could not install shutdown hook, signal-quitting will NOT work: " + e.getMessage());
        }
        installedHook = hook;
        return SetupResult.ok(hook);
    }

    /**
     * Holds the JVM until teardown has flushed everything, then halts it with the run's own exit status.
     * Without the halt a signalled JVM exits with the signal's status and {@code System.exit} from the
     * main thread blocks behind this hook.
     */
    private void onShutdownSignal() {
        stopSignal.onSignal();
        boolean completed;
        try {
            completed = teardownComplete.await(shutdownGraceMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (!completed) {
            log.warn("selfplay.shutdown.grace-expired graceMs={} exiting before teardown finished", shutdownGraceMs);
            return;
        }
        log.info("Teardown finished after signal, exiting with status {}", exitStatus);
        hookRegistry.halt(exitStatus);
    }

    /**
     * Called after every game worker has joined.
     */
    public void completeShutdown(Thread pollLoopThread, SelfplayManager manager, Runnable releaseEngineResources)
            throws InterruptedException {
        stopSignal.requestStop();
        sleeper.wakeAll();
        if (pollLoopThread != null) {
            pollLoopThread.join();
        }
        manager.close();
        releaseEngineResources.run();
    }

    /**
     * @param status the process exit status the run ended with; a signalled JVM exits with it
     */
    public void markTeardownComplete(int status) {
        exitStatus = status;
        teardownComplete.countDown();
        Thread hook = installedHook;
        if (hook == null || stopSignal.wasSignalReceived()) {
            return;
        }
        try {
            hookRegistry.remove(hook);
            installedHook = null;
        } catch (IllegalStateException e) {
            log.debug("JVM shutdown already in progress, leaving hook registered", e);
        }
    }

    interface HookRegistry {
        void add(Thread hook);

        void remove(Thread hook);

        void halt(int status);

        static HookRegistry runtime() {
            return new HookRegistry() {
                @Override
                public void add(Thread hook) {
                    Runtime.getRuntime().addShutdownHook(hook);
                }

                @Override
                public void remove(Thread hook) {
                    Runtime.getRuntime().removeShutdownHook(hook);
                }

                @Override
                public void halt(int status) {
                    Runtime.getRuntime().halt(status);
                }
            };
        }
    }
}
