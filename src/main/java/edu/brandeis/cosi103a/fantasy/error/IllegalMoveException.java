package edu.brandeis.cosi103a.fantasy.error;

import edu.brandeis.cosi103a.fantasy.roster.Player;

/**
 * Thrown when a player is moved to a roster slot it is not eligible for.
 */
public class IllegalMoveException extends FantasyException {
    public IllegalMoveException(Player player, String destination) {
        super("Player " + player + " cannot be moved to " + destination);
    }
}
