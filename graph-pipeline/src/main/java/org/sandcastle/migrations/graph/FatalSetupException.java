package org.sandcastle.migrations.graph;

/**
 * A failure that leaves the run without a usable foundation (metadata or placeholder
 * records could not be obtained). Always aborts the run.
 */
public class FatalSetupException extends MigrationException {
    public FatalSetupException(String message) {
        super(message);
    }

    public FatalSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
