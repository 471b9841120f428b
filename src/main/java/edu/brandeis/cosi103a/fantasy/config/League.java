package edu.brandeis.cosi103a.fantasy.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.fantasy.draft.SnakeDraft;
import edu.brandeis.cosi103a.fantasy.roster.PositionSchema;
import edu.brandeis.cosi103a.fantasy.roster.Roster;

import java.util.Optional;

/**
 * A configured league: its position schema, one roster per team, and the draft that fills them.
 */
public final class League {

    private final String name;
    private final PositionSchema schema;
    private final ImmutableMap<String, Roster> rosters;
    private final SnakeDraft draft;

    private League(String name, PositionSchema schema, ImmutableMap<String, Roster> rosters, int rounds) {
        this.name = name;
        this.schema = schema;
        this.rosters = rosters;
        this.draft = new SnakeDraft(rosters.values().asList(), rounds);
    }

    /**
     * Builds a league with empty rosters from its configuration.
     *
     * @throws edu.brandeis.cosi103a.fantasy.error.ConfigurationLoadException if the configuration
     *         is incomplete or names a team twice
     * @throws edu.brandeis.cosi103a.fantasy.error.SchemaConfigurationException if the slot counts
     *         do not fit the league's position convention
     */
    public static League from(LeagueConfig config) {
        LeagueConfigLoader.validate(config);
        PositionSchema schema = new PositionSchema(config.positionCodes(), config.slots());
        ImmutableMap.Builder<String, Roster> rosters = ImmutableMap.builder();
        for (String team : config.teams()) {
            rosters.put(team, new Roster(schema));
        }
        return new League(config.name(), schema, rosters.build(), config.rounds());
    }

    public String name() {
        return name;
    }

    public PositionSchema schema() {
        return schema;
    }

    public SnakeDraft draft() {
        return draft;
    }

    /**
     * Team names in first-round draft order.
     */
    public ImmutableList<String> teams() {
        return rosters.keySet().asList();
    }

    /**
     * @throws IllegalArgumentException if no team has that name
     */
    public Roster roster(String team) {
        Roster roster = rosters.get(team);
        if (roster == null) throw new IllegalArgumentException("No team named " + team + " in league " + name);
        return roster;
    }

    /**
     * The team making the next draft pick, or empty once the draft is over.
     */
    public Optional<String> onTheClock() {
        return draft.peek().map(pick -> teams().get(draft.getTeamIndex(pick.number())));
    }
}
