package org.sandcastle.migrations.graph;

/**
 * Base of every unchecked failure raised by the migration engine.
 */
public class MigrationException extends RuntimeException {
    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
