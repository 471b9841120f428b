package edu.brandeis.cosi103a.fantasy.roster;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.fantasy.error.InvalidPlayerException;
import edu.brandeis.cosi103a.fantasy.error.SchemaConfigurationException;
import edu.brandeis.cosi103a.fantasy.error.UnknownPositionException;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Number of roster slots a league allots to each position.
 *
 * <p>Which slots a player may occupy:
 * <pre>
 *          QB  RB  WR  TE  D/ST  K
 *   QB     X
 *   RB         X
 *   WR             X
 *   TE                 X
 *   FLEX       X   X   X
 *   D/ST                   X
 *   K                            X
 *   BN     X   X   X   X   X     X
 *   IR     X*  X*  X*  X*  X*    X*   (* only when flagged injured reserve)
 * </pre>
 *
 * Instances are immutable.
 */
public final class PositionSchema {

    private final PositionCodes codes;
    private final ImmutableMap<String, Integer> counts;

    /**
     * Creates a schema from slot counts keyed by position code.
     *
     * @param codes  the league's position codes
     * @param counts slots per code; must name every code of {@code codes} and nothing else
     * @throws SchemaConfigurationException if the key set differs from the position codes or a
     *                                      count is missing or negative
     */
    public PositionSchema(PositionCodes codes, Map<String, Integer> counts) {
        this.codes = Objects.requireNonNull(codes, "codes");
        Objects.requireNonNull(counts, "counts");

        Set<String> expected = new HashSet<>(codes.positions());
        if (!expected.equals(counts.keySet())) {
            throw new SchemaConfigurationException(
                "Slot counts " + counts.keySet() + " do not match positions " + codes.positions());
        }

        // Canonical order, regardless of the order of the input map
        ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
        for (String position : codes.positions()) {
            Integer count = counts.get(position);
            if (count == null || count < 0) {
                throw new SchemaConfigurationException(
                    "Slot count for " + position + " must be a non-negative integer, was " + count);
            }
            builder.put(position, count);
        }
        this.counts = builder.build();
    }

    /**
     * ESPN schema with the given slot counts.
     */
    public static PositionSchema espn(Map<String, Integer> counts) {
        return new PositionSchema(PositionCodes.ESPN, counts);
    }

    /**
     * Yahoo! schema with the given slot counts.
     */
    public static PositionSchema yahoo(Map<String, Integer> counts) {
        return new PositionSchema(PositionCodes.YAHOO, counts);
    }

    public PositionCodes codes() {
        return codes;
    }

    public ImmutableList<String> positions() {
        return codes.positions();
    }

    /**
     * Slot counts in canonical position order.
     */
    public ImmutableMap<String, Integer> counts() {
        return counts;
    }

    public String flex() {
        return codes.flex();
    }

    public String dst() {
        return codes.dst();
    }

    public String kicker() {
        return codes.kicker();
    }

    public String bench() {
        return codes.bench();
    }

    public String injuredReserve() {
        return codes.injuredReserve();
    }

    /**
     * Total number of slots across all positions.
     */
    public int size() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean contains(String position) {
        return counts.containsKey(position);
    }

    /**
     * @throws UnknownPositionException if {@code position} is not a code of this schema
     */
    public int count(String position) {
        Integer count = counts.get(position);
        if (count == null) {
            throw new UnknownPositionException(position);
        }
        return count;
    }

    /**
     * Whether players listed at {@code position} may fill the flex slot: any offense position
     * except quarterback.
     *
     * @throws UnknownPositionException if {@code position} is not a code of this schema
     */
    public boolean flexable(String position) {
        if (!contains(position)) {
            throw new UnknownPositionException(position);
        }
        return codes.offense().contains(position) && !PositionCodes.QUARTERBACK.equals(position);
    }

    /**
     * Whether {@code player} may occupy a {@code destination} slot.
     *
     * @throws InvalidPlayerException   if the player's position is not a code of this schema
     * @throws UnknownPositionException if {@code destination} is not a code of this schema
     */
    public boolean moveable(Player player, String destination) {
        validate(player);
        if (!contains(destination)) {
            throw new UnknownPositionException(destination);
        }

        return destination.equals(bench())
            || destination.equals(player.position())
            || (player.injuredReserve() && destination.equals(injuredReserve()))
            || (flexable(player.position()) && destination.equals(flex()));
    }

    /**
     * @throws InvalidPlayerException on the first player whose position is not a code of this schema
     */
    public void validate(Player... players) {
        for (Player player : players) {
            if (!contains(player.position())) {
                throw new InvalidPlayerException(player);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PositionSchema other)) return false;
        return codes.equals(other.codes) && counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(codes, counts);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            sb.append(String.format("%-6s %d%n", entry.getKey(), entry.getValue()));
        }
        return sb.toString();
    }
}
