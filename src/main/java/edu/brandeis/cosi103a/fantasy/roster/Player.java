package edu.brandeis.cosi103a.fantasy.roster;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A player as seen by a roster: who they are, the position they are listed at, and whether
 * they may be placed on injured reserve.
 *
 * @param name           display name, used to tell apart players sharing a position
 * @param position       listed position code, e.g. "WR"
 * @param injuredReserve whether the player is eligible for an IR slot
 */
public record Player(
    @JsonProperty("name") String name,
    @JsonProperty("position") String position,
    @JsonProperty("injuredReserve") boolean injuredReserve
) {
    public Player {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(position, "position");
    }

    /**
     * Convenience constructor for a healthy player.
     */
    public Player(String name, String position) {
        this(name, position, false);
    }
}
