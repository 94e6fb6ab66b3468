package com.conclave.dispatch.cli;

import com.conclave.core.engine.OrchestratorCoordinator;
import com.conclave.core.events.EventBus;
import com.conclave.core.model.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Wraps a coordinator call with live progress output and a JVM shutdown hook that cancels the
 * run and waits for its final checkpoint.
 */
class RunSupervisor {

    private static final Logger log = LoggerFactory.getLogger(RunSupervisor.class);
    static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(30);

    private final OrchestratorCoordinator coordinator;
    private final EventBus eventBus;

    RunSupervisor(OrchestratorCoordinator coordinator, EventBus eventBus) {
        this.coordinator = coordinator;
        this.eventBus = eventBus;
    }

    RunReport supervise(Supplier<RunReport> run) {
        var subscription = eventBus.subscribeAll(ConsoleOutput::event);
        Thread hook = new Thread(() -> {
            log.info("Shutdown requested, cancelling active run");
            coordinator.shutdown(SHUTDOWN_WAIT);
        }, "conclave-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return run.get();
        } finally {
            subscription.unsubscribe();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, hook stays registered");
            }
        }
    }

    static int exitCode(RunReport report) {
        return report.succeeded() ? 0 : 1;
    }
}
