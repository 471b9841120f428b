package edu.brandeis.cosi103a.fantasy.error;

/**
 * Thrown when a roster slot code is not part of the active position schema.
 */
public class UnknownPositionException extends FantasyException {
    private final String position;

    public UnknownPositionException(String position) {
        super("Unknown roster position: " + position);
        this.position = position;
    }

    public String getPosition() {
        return position;
    }
}
