package org.dgov.governance;

/**
 * A synchronous rejection of a governance call. Nothing is committed when
 * one of these is thrown.
 */
public class GovernanceException extends RuntimeException {

    private final GovernanceError error;

    public GovernanceException(GovernanceError error, String message) {
        super(error + ": " + message);
        this.error = error;
    }

    public GovernanceException(GovernanceError error, String message, Throwable cause) {
        super(error + ": " + message, cause);
        this.error = error;
    }

    public GovernanceError getError() {
        return error;
    }
}
