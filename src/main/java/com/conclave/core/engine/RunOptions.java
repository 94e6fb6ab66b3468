package com.conclave.core.engine;

import java.time.Duration;

/**
 * Per-run overrides of configured values. Null fields fall back to configuration.
 *
 * @param maxParallel concurrency limit
 * @param taskTimeout time limit per attempt
 * @param baseRef     reference new workspaces start from (ignored on resume)
 */
public record RunOptions(Integer maxParallel, Duration taskTimeout, String baseRef) {

    public static RunOptions defaults() {
        return new RunOptions(null, null, null);
    }
}
