package com.conclave.executor;

/**
 * Runs one attempt of a task inside its workspace.
 *
 * <p>Implementations must honour thread interruption: when the calling thread is interrupted
 * they force-terminate whatever they started and throw {@link InterruptedException}.
 * A non-zero exit code is returned, not thrown.
 */
public interface ExternalTaskExecutor {

    /**
     * @throws InterruptedException when the attempt was interrupted (timeout or cancellation)
     * @throws com.conclave.core.error.ExecutorTimeoutException when the executor enforced the timeout itself
     * @throws com.conclave.core.error.ExecutorFailureException when the attempt could not be launched
     */
    ExecutorOutput execute(ExecutorRequest request) throws InterruptedException;
}
