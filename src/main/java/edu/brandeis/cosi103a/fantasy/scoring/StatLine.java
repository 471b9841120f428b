package edu.brandeis.cosi103a.fantasy.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

/**
 * One row of league statistics for a player over a season or a week.
 *
 * @param name     player name
 * @param position listed position, e.g. "QB" or "DEF"
 * @param team     team abbreviation; null for free agents
 * @param opponent opponent abbreviation; null on a bye
 * @param venue    where the game was played
 * @param stats    statistic name to value
 */
public record StatLine(
    @JsonProperty("name") String name,
    @JsonProperty("position") String position,
    @JsonProperty("team") String team,
    @JsonProperty("opponent") String opponent,
    @JsonProperty("venue") Venue venue,
    @JsonProperty("stats") ImmutableMap<String, Double> stats
) {
    public enum Venue {
        HOME,
        AWAY,
        BYE
    }

    public StatLine {
        stats = stats == null ? ImmutableMap.of() : stats;
    }

    public double stat(String statistic) {
        return stats.getOrDefault(statistic, 0.0);
    }
}
