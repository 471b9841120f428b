package edu.brandeis.cosi103a.fantasy.error;

/**
 * Thrown when a move targets a full position and no player to displace was given.
 */
public class MissingReplacementException extends FantasyException {
    public MissingReplacementException(String destination) {
        super("All " + destination + " slots are occupied; a replacement player is required");
    }
}
