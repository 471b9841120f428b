package edu.brandeis.cosi103a.fantasy.error;

import edu.brandeis.cosi103a.fantasy.roster.Player;

/**
 * Thrown when a player's listed position is not a code of the active position schema.
 */
public class InvalidPlayerException extends FantasyException {
    private final Player player;

    public InvalidPlayerException(Player player) {
        super("Player " + player + " has a position outside the roster schema");
        this.player = player;
    }

    public Player getPlayer() {
        return player;
    }
}
