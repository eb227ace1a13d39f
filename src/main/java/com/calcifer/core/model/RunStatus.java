package com.calcifer.core.model;

import java.util.Collection;

/**
 * Overall status of a run, derived from its task results.
 */
public enum RunStatus {
    OK,
    WARNING,
    FAILED;

    /**
     * FAILED if any result failed, else WARNING if any result warned, else OK.
     */
    public static RunStatus rollup(Collection<TaskResult> results) {
        boolean warning = false;
        for (TaskResult result : results) {
            if (result.status() == TaskStatus.FAILED) {
                return FAILED;
            }
            if (result.status() == TaskStatus.WARNING) {
                warning = true;
            }
        }
        return warning ? WARNING : OK;
    }
}
