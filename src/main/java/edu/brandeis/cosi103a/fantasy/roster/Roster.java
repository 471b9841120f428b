package edu.brandeis.cosi103a.fantasy.roster;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.fantasy.error.IllegalMoveException;
import edu.brandeis.cosi103a.fantasy.error.MissingReplacementException;
import edu.brandeis.cosi103a.fantasy.error.PlayerNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One team's roster: a fixed number of slots per position, each holding at most one player.
 *
 * <p>The number of slots per position comes from the {@link PositionSchema} and never changes.
 * A player occupies at most one slot on the roster.
 *
 * <p>Not thread-safe. Callers sharing a roster across threads must serialize access themselves.
 */
public class Roster {

    private static final Logger log = LoggerFactory.getLogger(Roster.class);

    private final PositionSchema schema;
    private final Map<String, Player[]> slots;

    /**
     * Creates an empty roster and adds the given players to it.
     *
     * @param schema  the league's position schema
     * @param players initial players; those that do not fit are left out
     */
    public Roster(PositionSchema schema, Player... players) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.slots = new LinkedHashMap<>();
        for (String position : schema.positions()) {
            slots.put(position, new Player[schema.count(position)]);
        }
        add(players);
    }

    public PositionSchema schema() {
        return schema;
    }

    /**
     * Attempts to add players, in order. Each player goes to the first vacant slot of its own
     * position, then of flex (if the position is flexable), then of the bench. A player with no
     * vacancy in any of these, or already on the roster, is skipped.
     *
     * @return the players actually placed
     * @throws edu.brandeis.cosi103a.fantasy.error.InvalidPlayerException if any player's position
     *         is not in the schema; nothing is placed in that case
     */
    public ImmutableList<Player> add(Player... players) {
        schema.validate(players);

        ImmutableList.Builder<Player> added = ImmutableList.builder();
        for (Player player : players) {
            if (contains(player)) {
                log.debug("Skipping {}: already on the roster", player);
                continue;
            }

            String position;
            if (hasVacancy(player.position())) {
                position = player.position();
            } else if (schema.flexable(player.position()) && hasVacancy(schema.flex())) {
                position = schema.flex();
            } else if (hasVacancy(schema.bench())) {
                position = schema.bench();
            } else {
                log.debug("Skipping {}: no open {}, flex or bench slot", player, player.position());
                continue;
            }

            Player[] array = slots.get(position);
            int index = indexOf(array, null);
            array[index] = player;
            added.add(player);
            log.debug("Placed {} at {}[{}]", player, position, index);
        }
        return added.build();
    }

    /**
     * Removes players from wherever they sit on the roster.
     *
     * @return the players removed, in order
     * @throws PlayerNotFoundException if a player is not on the roster; players earlier in the
     *         argument list stay removed
     */
    public ImmutableList<Player> drop(Player... players) {
        schema.validate(players);

        ImmutableList.Builder<Player> dropped = ImmutableList.builder();
        for (Player player : players) {
            Slot slot = locate(player);
            slots.get(slot.position())[slot.index()] = null;
            dropped.add(player);
            log.debug("Dropped {} from {}[{}]", player, slot.position(), slot.index());
        }
        return dropped.build();
    }

    /**
     * Moves a player into a vacant {@code destination} slot, leaving its current slot empty.
     *
     * @see #move(Player, String, Player)
     */
    public void move(Player player, String destination) {
        move(player, destination, null);
    }

    /**
     * Moves a player to a {@code destination} slot. When {@code replace} is given, the two
     * players swap slots; otherwise the player takes the first vacant destination slot and its
     * previous slot is left empty.
     *
     * @param player      the player to move
     * @param destination position code of the target slot
     * @param replace     player currently in {@code destination} to swap with, or {@code null}
     * @throws IllegalMoveException         if either player is not eligible for its new slot
     * @throws MissingReplacementException  if {@code destination} is full and no replacement is given
     * @throws PlayerNotFoundException      if {@code player} is not on the roster, or {@code replace}
     *                                      is not in a {@code destination} slot
     */
    public void move(Player player, String destination, Player replace) {
        schema.validate(player);
        if (!schema.moveable(player, destination)) {
            throw new IllegalMoveException(player, destination);
        }

        Player[] target = slots.get(destination);
        if (replace == null && !hasVacancy(destination)) {
            throw new MissingReplacementException(destination);
        }
        Slot source = locate(player);

        int targetIndex;
        if (replace == null) {
            targetIndex = indexOf(target, null);
        } else {
            schema.validate(replace);
            targetIndex = indexOf(target, replace);
            if (targetIndex < 0) {
                throw new PlayerNotFoundException(replace, destination);
            }
            if (!schema.moveable(replace, source.position())) {
                throw new IllegalMoveException(replace, source.position());
            }
        }

        slots.get(source.position())[source.index()] = replace;
        target[targetIndex] = player;
        log.debug("Moved {} from {}[{}] to {}[{}]{}", player, source.position(), source.index(),
            destination, targetIndex, replace == null ? "" : ", swapping with " + replace);
    }

    /**
     * Adds then drops players in one call.
     *
     * @param add  players to add, or {@code null} for none
     * @param drop players to drop, or {@code null} for none
     * @return what was added and dropped
     */
    public Transaction transaction(List<Player> add, List<Player> drop) {
        if (add == null && drop == null) {
            return Transaction.empty();
        }
        ImmutableList<Player> added = add == null ? ImmutableList.of() : add(add.toArray(Player[]::new));
        ImmutableList<Player> dropped = drop == null ? ImmutableList.of() : drop(drop.toArray(Player[]::new));
        return new Transaction(added, dropped);
    }

    /**
     * Trades with another roster: this roster gains {@code add} and loses {@code drop}, and
     * {@code other} gains {@code drop} and loses {@code add}.
     *
     * <p>Both sides drop before either side adds, so a full roster can still take a player in
     * exchange for one it gives up. The trade is not atomic: if a step fails, earlier steps stay
     * applied. Use {@link #copy()} and {@link #restore(Roster)} on both rosters to roll back.
     *
     * @return the transaction applied to each roster
     * @throws PlayerNotFoundException if a player being traded away is not on its roster
     */
    public TradeResult trade(Roster other, List<Player> add, List<Player> drop) {
        Objects.requireNonNull(other, "other");
        Player[] incoming = add.toArray(Player[]::new);
        Player[] outgoing = drop.toArray(Player[]::new);

        ImmutableList<Player> droppedHere = drop(outgoing);
        ImmutableList<Player> droppedThere = other.drop(incoming);
        ImmutableList<Player> addedHere = add(incoming);
        ImmutableList<Player> addedThere = other.add(outgoing);

        return new TradeResult(
            this, new Transaction(addedHere, droppedHere),
            other, new Transaction(addedThere, droppedThere));
    }

    /**
     * Read-only view of the slots for one position; empty slots are {@link Optional#empty()}.
     *
     * @throws edu.brandeis.cosi103a.fantasy.error.UnknownPositionException if {@code position} is
     *         not in the schema
     */
    public ImmutableList<Optional<Player>> slots(String position) {
        schema.count(position);
        return Arrays.stream(slots.get(position))
            .map(Optional::ofNullable)
            .collect(ImmutableList.toImmutableList());
    }

    /**
     * Number of filled slots at {@code position}.
     */
    public int occupied(String position) {
        schema.count(position);
        return (int) Arrays.stream(slots.get(position)).filter(Objects::nonNull).count();
    }

    /**
     * Number of filled slots on the whole roster.
     */
    public int size() {
        return players().size();
    }

    public boolean contains(Player player) {
        return positionOf(player).isPresent();
    }

    /**
     * The position code of the slot {@code player} sits in, if any.
     */
    public Optional<String> positionOf(Player player) {
        for (Map.Entry<String, Player[]> entry : slots.entrySet()) {
            if (indexOf(entry.getValue(), player) >= 0) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * All players on the roster, in position then slot order.
     */
    public ImmutableList<Player> players() {
        return slots.values().stream()
            .flatMap(Arrays::stream)
            .filter(Objects::nonNull)
            .collect(ImmutableList.toImmutableList());
    }

    /**
     * A detached copy of this roster's slots, for rolling back a failed trade.
     */
    public Roster copy() {
        Roster copy = new Roster(schema);
        copy.restore(this);
        return copy;
    }

    /**
     * Overwrites this roster's slots with those of {@code snapshot}.
     *
     * @throws IllegalArgumentException if the two rosters use different schemas
     */
    public void restore(Roster snapshot) {
        if (!schema.equals(snapshot.schema)) {
            throw new IllegalArgumentException("Cannot restore from a roster with a different schema");
        }
        for (Map.Entry<String, Player[]> entry : snapshot.slots.entrySet()) {
            Player[] source = entry.getValue();
            System.arraycopy(source, 0, slots.get(entry.getKey()), 0, source.length);
        }
    }

    /**
     * Finds the slot holding {@code player}, looking at its own position, then flex, then bench,
     * then injured reserve.
     */
    private Slot locate(Player player) {
        for (String position : List.of(player.position(), schema.flex(), schema.bench(), schema.injuredReserve())) {
            int index = indexOf(slots.get(position), player);
            if (index >= 0) {
                return new Slot(position, index);
            }
        }
        throw new PlayerNotFoundException(player);
    }

    private boolean hasVacancy(String position) {
        return indexOf(slots.get(position), null) >= 0;
    }

    private static int indexOf(Player[] array, Player player) {
        for (int i = 0; i < array.length; i++) {
            if (Objects.equals(array[i], player)) {
                return i;
            }
        }
        return -1;
    }

    private record Slot(String position, int index) {}

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Player[]> entry : slots.entrySet()) {
            Player[] array = entry.getValue();
            for (int i = 0; i < array.length; i++) {
                sb.append(String.format("%-6s %d  %s%n", entry.getKey(), i,
                    array[i] == null ? "-" : array[i].name()));
            }
        }
        return sb.toString();
    }
}
