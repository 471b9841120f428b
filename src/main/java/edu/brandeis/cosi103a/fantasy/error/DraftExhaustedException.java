package edu.brandeis.cosi103a.fantasy.error;

/**
 * Thrown when a pick is made after every pick of the draft has been used.
 */
public class DraftExhaustedException extends FantasyException {
    public DraftExhaustedException(int volume) {
        super("All " + volume + " picks of the draft have been made");
    }
}
