package com.calcifer.core.engine;

import com.calcifer.config.RunSettings;
import com.calcifer.core.model.TargetFilter;
import com.calcifer.core.registry.ConfigException;

import java.time.Duration;

/**
 * Caller-supplied knobs for one run.
 *
 * @param continueOnError  keep going after a failed task instead of aborting
 * @param targetFilter     restricts the run to matching hosts; null for all
 * @param perTaskTimeout   bound on each task invocation; null for none
 * @param runTimeout       bound on the whole run; null for none
 * @param expectConverged  treat any change as an idempotency violation
 * @param settings         settings handed to tasks
 */
public record RunOptions(
    boolean continueOnError,
    TargetFilter targetFilter,
    Duration perTaskTimeout,
    Duration runTimeout,
    boolean expectConverged,
    RunSettings settings
) {

    public RunOptions {
        if (perTaskTimeout != null && (perTaskTimeout.isNegative() || perTaskTimeout.isZero())) {
            throw new ConfigException("Task timeout must be positive: " + perTaskTimeout);
        }
        if (runTimeout != null && (runTimeout.isNegative() || runTimeout.isZero())) {
            throw new ConfigException("Run timeout must be positive: " + runTimeout);
        }
        settings = settings != null ? settings : RunSettings.empty();
    }

    public static RunOptions defaults() {
        return new RunOptions(false, null, null, null, false, RunSettings.empty());
    }

    public RunOptions withContinueOnError(boolean value) {
        return new RunOptions(value, targetFilter, perTaskTimeout, runTimeout, expectConverged, settings);
    }

    public RunOptions withTargetFilter(TargetFilter value) {
        return new RunOptions(continueOnError, value, perTaskTimeout, runTimeout, expectConverged, settings);
    }

    public RunOptions withPerTaskTimeout(Duration value) {
        return new RunOptions(continueOnError, targetFilter, value, runTimeout, expectConverged, settings);
    }

    public RunOptions withRunTimeout(Duration value) {
        return new RunOptions(continueOnError, targetFilter, perTaskTimeout, value, expectConverged, settings);
    }

    public RunOptions withExpectConverged(boolean value) {
        return new RunOptions(continueOnError, targetFilter, perTaskTimeout, runTimeout, value, settings);
    }

    public RunOptions withSettings(RunSettings value) {
        return new RunOptions(continueOnError, targetFilter, perTaskTimeout, runTimeout, expectConverged, value);
    }
}
