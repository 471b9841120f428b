package edu.brandeis.cosi103a.fantasy.error;

/**
 * Thrown when the draft results and a team's roster disagree, e.g. an undone pick is no
 * longer on the roster that made it.
 */
public class DraftInconsistencyException extends FantasyException {
    public DraftInconsistencyException(String message) {
        super(message);
    }

    public DraftInconsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
