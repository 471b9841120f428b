package edu.brandeis.cosi103a.fantasy.error;

import edu.brandeis.cosi103a.fantasy.roster.Player;

/**
 * Thrown when a player expected on a roster cannot be found in any slot it could occupy.
 */
public class PlayerNotFoundException extends FantasyException {
    private final Player player;

    public PlayerNotFoundException(Player player) {
        super("Player " + player + " is not on the roster");
        this.player = player;
    }

    public PlayerNotFoundException(Player player, String position) {
        super("Player " + player + " does not occupy a " + position + " slot");
        this.player = player;
    }

    public Player getPlayer() {
        return player;
    }
}
