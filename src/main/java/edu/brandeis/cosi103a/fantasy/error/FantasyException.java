package edu.brandeis.cosi103a.fantasy.error;

/**
 * Base type for every failure raised by the roster, draft and scoring code.
 */
public class FantasyException extends RuntimeException {
    public FantasyException(String message) {
        super(message);
    }

    public FantasyException(String message, Throwable cause) {
        super(message, cause);
    }
}
