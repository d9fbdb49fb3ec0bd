package com.phillippitts.enginecoordinator.exception;

/**
 * An executing task raised. The failure is isolated to that task; the engine keeps running.
 */
public class EngineCrashException extends CoordinatorException {

    private final String source;

    public EngineCrashException(String source, Throwable cause) {
        super(source + " task failed: " + (cause == null ? "unknown" : cause.toString()), cause);
        this.source = source;
    }

    /** Worker or engine that ran the task. */
    public String getSource() {
        return source;
    }
}
