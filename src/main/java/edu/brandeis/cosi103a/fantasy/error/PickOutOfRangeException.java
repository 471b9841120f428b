package edu.brandeis.cosi103a.fantasy.error;

/**
 * Thrown when a pick number falls outside {@code [1, rounds * teams]}.
 */
public class PickOutOfRangeException extends FantasyException {
    public PickOutOfRangeException(int pick, int volume) {
        super("Pick " + pick + " is outside the draft range [1, " + volume + "]");
    }
}
