package com.calcifer.backend;

/**
 * Result of one shell command on a host.
 *
 * @param exitCode process exit status, {@code -1} when none was reported
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public CommandResult {
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    /** Trimmed standard output. */
    public String output() {
        return stdout.trim();
    }

    /** Best short description of a failure: stderr when present, else stdout. */
    public String errorSummary() {
        String err = stderr.trim();
        if (err.isEmpty()) {
            err = stdout.trim();
        }
        if (err.isEmpty()) {
            return "exit code " + exitCode;
        }
        return err.length() > 500 ? err.substring(0, 500) + "..." : err;
    }
}
