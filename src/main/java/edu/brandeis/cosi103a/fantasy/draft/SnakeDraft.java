package edu.brandeis.cosi103a.fantasy.draft;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.fantasy.error.DraftExhaustedException;
import edu.brandeis.cosi103a.fantasy.error.DraftInconsistencyException;
import edu.brandeis.cosi103a.fantasy.error.FantasyException;
import edu.brandeis.cosi103a.fantasy.error.PickOutOfRangeException;
import edu.brandeis.cosi103a.fantasy.error.PlacementException;
import edu.brandeis.cosi103a.fantasy.roster.Player;
import edu.brandeis.cosi103a.fantasy.roster.Roster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A multi-round snake draft across a fixed list of teams.
 *
 * <p>Odd rounds pick in roster order, even rounds in reverse order. For 4 teams and 3 rounds:
 * <pre>
 *   round 1: picks  1  2  3  4  -> teams 0 1 2 3
 *   round 2: picks  5  6  7  8  -> teams 3 2 1 0
 *   round 3: picks  9 10 11 12  -> teams 0 1 2 3
 * </pre>
 *
 * <p>Picks are made with {@link #push(Player)} and undone, most recent first, with {@link #pop()}.
 * Drafted players are placed on, and removed from, the picking team's {@link Roster}.
 *
 * <p>Not thread-safe.
 */
public class SnakeDraft {

    private static final Logger log = LoggerFactory.getLogger(SnakeDraft.class);

    private final ImmutableList<Roster> rosters;
    private final int rounds;

    private Player[][] results;
    private Deque<Pick> remaining;
    private int size;

    /**
     * Creates a draft and puts it at its first pick.
     *
     * @param rosters participating teams, in first-round pick order
     * @param rounds  number of rounds, at least 1
     * @throws IllegalArgumentException if there are no teams, a roster is listed twice, or
     *                                  {@code rounds} is not positive
     */
    public SnakeDraft(List<Roster> rosters, int rounds) {
        Preconditions.checkArgument(!rosters.isEmpty(), "A draft needs at least one team");
        Preconditions.checkArgument(rounds > 0, "Round count must be positive, was %s", rounds);
        Set<Roster> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        distinct.addAll(rosters);
        Preconditions.checkArgument(distinct.size() == rosters.size(), "A roster may only draft once per pick order");

        this.rosters = ImmutableList.copyOf(rosters);
        this.rounds = rounds;
        reset();
    }

    public ImmutableList<Roster> rosters() {
        return rosters;
    }

    public int rounds() {
        return rounds;
    }

    public int teams() {
        return rosters.size();
    }

    /**
     * Total number of picks: rounds times teams.
     */
    public int volume() {
        return rounds * teams();
    }

    /**
     * Number of picks made so far.
     */
    public int size() {
        return size;
    }

    public boolean isComplete() {
        return size == volume();
    }

    /**
     * The next pick to be made, without making it.
     *
     * @return the next pick, or empty once every pick has been made
     */
    public Optional<Pick> peek() {
        return Optional.ofNullable(remaining.peekFirst());
    }

    /**
     * Makes the next pick: adds {@code player} to the roster of the team on the clock and
     * records it in the results. The draft only advances if the player was placed.
     *
     * @return the pick that was made
     * @throws DraftExhaustedException if every pick has already been made
     * @throws PlacementException      if the team's roster has no slot for the player
     */
    public Pick push(Player player) {
        Pick pick = remaining.peekFirst();
        if (pick == null) {
            throw new DraftExhaustedException(volume());
        }

        int team = getTeamIndex(pick.number());
        Roster roster = rosters.get(team);
        if (!roster.add(player).contains(player)) {
            throw new PlacementException(
                "Could not add " + player + " to the roster of team " + team + " at pick " + pick.number());
        }

        remaining.removeFirst();
        results[pick.round() - 1][team] = player;
        size++;
        log.debug("Pick {} (round {}): team {} drafted {}", pick.number(), pick.round(), team, player);
        if (isComplete()) {
            log.info("Draft complete after {} picks", size);
        }
        return pick;
    }

    /**
     * Undoes the most recent pick: removes the player from the team's roster and clears it from
     * the results. The undone pick is the next one {@link #push(Player)} makes.
     *
     * @return the player whose pick was undone, or empty if no picks have been made
     * @throws DraftInconsistencyException if the player is no longer on the roster that drafted it
     */
    public Optional<Player> pop() {
        if (size == 0) {
            return Optional.empty();
        }

        Pick pick = new Pick(getRound(size), size);
        int team = getTeamIndex(pick.number());
        Roster roster = rosters.get(team);
        Player player = results[pick.round() - 1][team];

        List<Player> dropped;
        try {
            dropped = roster.drop(player);
        } catch (FantasyException e) {
            throw inconsistency(pick, player, team, e);
        }
        if (!dropped.contains(player)) {
            throw inconsistency(pick, player, team, null);
        }

        results[pick.round() - 1][team] = null;
        size--;
        remaining.addFirst(pick);
        log.debug("Undid pick {} (round {}): team {} gave back {}", pick.number(), pick.round(), team, player);
        return Optional.of(player);
    }

    private static DraftInconsistencyException inconsistency(Pick pick, Player player, int team, Throwable cause) {
        log.error("Pick {} ({}) could not be dropped from the roster of team {}", pick.number(), player, team);
        String message = "Could not drop " + player + " from the roster of team " + team;
        return cause == null
            ? new DraftInconsistencyException(message)
            : new DraftInconsistencyException(message, cause);
    }

    /**
     * Clears the results and returns the draft to its first pick. Rosters are left as they are.
     */
    public void reset() {
        size = 0;
        results = new Player[rounds][teams()];
        remaining = new ArrayDeque<>(volume());
        for (int number = 1; number <= volume(); number++) {
            remaining.addLast(new Pick(getRound(number), number));
        }
        log.debug("Draft reset: {} rounds, {} teams", rounds, teams());
    }

    /**
     * The 1-based round containing pick {@code pick}.
     *
     * @throws PickOutOfRangeException if {@code pick} is not in {@code [1, volume()]}
     */
    public int getRound(int pick) {
        if (pick < 1 || pick > volume()) {
            throw new PickOutOfRangeException(pick, volume());
        }
        return (pick - 1) / teams() + 1;
    }

    /**
     * Index into {@link #rosters()} of the team making pick {@code pick}.
     *
     * @throws PickOutOfRangeException if {@code pick} is not in {@code [1, volume()]}
     */
    public int getTeamIndex(int pick) {
        int offset = (pick - 1) % teams();
        return getRound(pick) % 2 == 1 ? offset : teams() - 1 - offset;
    }

    /**
     * The roster of the team making pick {@code pick}.
     *
     * @throws PickOutOfRangeException if {@code pick} is not in {@code [1, volume()]}
     */
    public Roster getTeam(int pick) {
        return rosters.get(getTeamIndex(pick));
    }

    /**
     * The player drafted by team {@code team} in round {@code round}, if that pick has been made.
     *
     * @param round 1-based round
     * @param team  0-based index into {@link #rosters()}
     */
    public Optional<Player> result(int round, int team) {
        Preconditions.checkArgument(round >= 1 && round <= rounds, "Round %s out of range", round);
        Preconditions.checkElementIndex(team, teams(), "team");
        return Optional.ofNullable(results[round - 1][team]);
    }

    /**
     * Results grid, one row per round and one column per team.
     */
    public ImmutableList<ImmutableList<Optional<Player>>> results() {
        ImmutableList.Builder<ImmutableList<Optional<Player>>> grid = ImmutableList.builder();
        for (Player[] row : results) {
            ImmutableList.Builder<Optional<Player>> cells = ImmutableList.builder();
            for (Player player : row) {
                cells.add(Optional.ofNullable(player));
            }
            grid.add(cells.build());
        }
        return grid.build();
    }

    /**
     * Drafted players in the order they were picked.
     */
    public ImmutableList<Player> picks() {
        ImmutableList.Builder<Player> picks = ImmutableList.builder();
        for (int number = 1; number <= size; number++) {
            picks.add(results[getRound(number) - 1][getTeamIndex(number)]);
        }
        return picks.build();
    }

    /**
     * Draft order grid, one row per round and one column per team, each cell holding the pick
     * that team makes in that round.
     */
    public ImmutableList<ImmutableList<Pick>> schedule() {
        Pick[][] grid = new Pick[rounds][teams()];
        for (int number = 1; number <= volume(); number++) {
            int round = getRound(number);
            grid[round - 1][getTeamIndex(number)] = new Pick(round, number);
        }

        ImmutableList.Builder<ImmutableList<Pick>> schedule = ImmutableList.builder();
        for (Pick[] row : grid) {
            schedule.add(ImmutableList.copyOf(row));
        }
        return schedule.build();
    }

    @Override
    public String toString() {
        return "SnakeDraft(rounds=" + rounds + ", teams=" + teams() + ", picks=" + size + ")";
    }
}
