package io.agentrelay.runtime;

/**
 * Timeout bounds must be finite and non-negative. Raised before any work is started.
 */
public final class InvalidTimeoutException extends IllegalArgumentException {
    private final double timeoutSeconds;

    public InvalidTimeoutException(double timeoutSeconds) {
        super("Timeout must be a non-negative number of seconds, got: " + timeoutSeconds);
        this.timeoutSeconds = timeoutSeconds;
    }

    public double timeoutSeconds() {
        return timeoutSeconds;
    }
}
