package edu.brandeis.cosi103a.fantasy.roster;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * Outcome of an add/drop on one roster.
 *
 * @param added   players actually placed, in request order
 * @param dropped players actually removed, in request order
 */
public record Transaction(
    @JsonProperty("added") ImmutableList<Player> added,
    @JsonProperty("dropped") ImmutableList<Player> dropped
) {
    public static Transaction empty() {
        return new Transaction(ImmutableList.of(), ImmutableList.of());
    }
}
