package edu.brandeis.cosi103a.fantasy.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.fantasy.error.ConfigurationLoadException;
import edu.brandeis.cosi103a.fantasy.roster.PositionCodes;

import java.util.List;
import java.util.Map;

/**
 * A league as described in its JSON configuration file.
 *
 * @param name       league name
 * @param convention position code convention, "ESPN" or "YAHOO"
 * @param slots      roster slots per position code
 * @param teams      team names, in first-round draft order
 * @param rounds     number of draft rounds
 */
public record LeagueConfig(
    @JsonProperty("name") String name,
    @JsonProperty("convention") String convention,
    @JsonProperty("slots") Map<String, Integer> slots,
    @JsonProperty("teams") List<String> teams,
    @JsonProperty("rounds") int rounds
) {

    /**
     * Convenience constructor drafting one round per roster slot.
     *
     * @throws ConfigurationLoadException if the convention is unknown, or the slots are missing
     *         or hold a null count
     */
    public LeagueConfig(String name, String convention, Map<String, Integer> slots, List<String> teams) {
        this(name, convention, slots, teams, defaultRounds(name, convention, slots));
    }

    /**
     * @throws IllegalArgumentException if the convention is not a known preset
     */
    public PositionCodes positionCodes() {
        return PositionCodes.forConvention(convention);
    }

    /**
     * One round per slot, excluding injured reserve.
     */
    private static int defaultRounds(String name, String convention, Map<String, Integer> slots) {
        if (convention == null) {
            throw new ConfigurationLoadException("League " + name + " has no position convention");
        }
        if (slots == null) {
            throw new ConfigurationLoadException("League " + name + " has no roster slots");
        }
        String injuredReserve;
        try {
            injuredReserve = PositionCodes.forConvention(convention).injuredReserve();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationLoadException(e.getMessage(), e);
        }

        int rounds = 0;
        for (Map.Entry<String, Integer> entry : slots.entrySet()) {
            if (entry.getKey().equals(injuredReserve)) {
                continue;
            }
            if (entry.getValue() == null) {
                throw new ConfigurationLoadException(
                    "League " + name + " has no slot count for position " + entry.getKey());
            }
            rounds += entry.getValue();
        }
        return rounds;
    }
}
