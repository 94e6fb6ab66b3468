package com.conclave.executor;

/**
 * What an executor attempt produced.
 *
 * @param exitCode process exit code; 0 means success
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 */
public record ExecutorOutput(int exitCode, String stdout, String stderr) {

    public ExecutorOutput {
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }
}
