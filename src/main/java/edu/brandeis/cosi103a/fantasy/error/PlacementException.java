package edu.brandeis.cosi103a.fantasy.error;

/**
 * Thrown when a drafted player has no open slot on the roster of the team making the pick.
 */
public class PlacementException extends FantasyException {
    public PlacementException(String message) {
        super(message);
    }
}
