package com.outrider.executor;

/**
 * The agent CLI exited with a non-zero status.
 */
public class ProcessExitException extends RuntimeException {

    private final int exitCode;

    public ProcessExitException(int exitCode, String lastLine) {
        super(lastLine == null || lastLine.isBlank()
                ? "process exited with code " + exitCode
                : "process exited with code " + exitCode + ": " + lastLine);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
