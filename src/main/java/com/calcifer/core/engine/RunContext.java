package com.calcifer.core.engine;

import com.calcifer.backend.ssh.SessionPool;
import com.calcifer.core.model.Goal;
import com.calcifer.core.model.Inventory;

/**
 * Per-run state shared by every lane of the run.
 */
public record RunContext(
    String runId,
    Goal goal,
    Inventory inventory,
    RunOptions options,
    SessionPool sessions,
    RunFacts facts,
    AbortSignal abort
) {}
