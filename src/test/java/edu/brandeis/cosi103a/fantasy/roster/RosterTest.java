package edu.brandeis.cosi103a.fantasy.roster;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.fantasy.error.IllegalMoveException;
import edu.brandeis.cosi103a.fantasy.error.InvalidPlayerException;
import edu.brandeis.cosi103a.fantasy.error.MissingReplacementException;
import edu.brandeis.cosi103a.fantasy.error.PlayerNotFoundException;
import edu.brandeis.cosi103a.fantasy.error.UnknownPositionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for Roster placement, removal, moves, transactions and trades.
 */
class RosterTest {

    private PositionSchema schema;

    @BeforeEach
    void setUp() {
        schema = PositionSchema.espn(PositionSchemaTest.ESPN_COUNTS);
    }

    @Test
    void constructor_addsInitialPlayers() {
        Player qb = new Player("Passer", "QB");
        Roster roster = new Roster(schema, qb);

        assertEquals(List.of(Optional.of(qb)), roster.slots("QB"));
        assertEquals(1, roster.size());
    }

    @Test
    void add_fillsNaturalPositionThenFlexThenBench() {
        Roster roster = new Roster(schema);
        List<Player> receivers = createPlayers("WR", 4);

        List<Player> added = roster.add(receivers.toArray(Player[]::new));

        assertEquals(receivers, added);
        assertEquals(Optional.of("WR"), roster.positionOf(receivers.get(0)));
        assertEquals(Optional.of("WR"), roster.positionOf(receivers.get(1)));
        assertEquals(Optional.of("FLEX"), roster.positionOf(receivers.get(2)));
        assertEquals(Optional.of("BN"), roster.positionOf(receivers.get(3)));
    }

    @Test
    void add_quarterbackSkipsFlex() {
        Roster roster = new Roster(schema);
        List<Player> passers = createPlayers("QB", 2);

        roster.add(passers.toArray(Player[]::new));

        assertEquals(Optional.of("BN"), roster.positionOf(passers.get(1)));
        assertEquals(0, roster.occupied("FLEX"));
    }

    @Test
    void add_skipsPlayerWithNoOpenSlotAndLeavesRosterUnchanged() {
        Roster roster = new Roster(schema);
        roster.add(createPlayers("QB", 7).toArray(Player[]::new)); // 1 starter + 6 bench
        ImmutableList<Player> before = roster.players();
        String layoutBefore = roster.toString();

        Player extra = new Player("QB extra", "QB");
        List<Player> added = roster.add(extra);

        assertTrue(added.isEmpty(), "No slot should admit another quarterback");
        assertFalse(roster.contains(extra));
        assertEquals(before, roster.players());
        assertEquals(layoutBefore, roster.toString());
    }

    @Test
    void add_reportsOnlyPlayersPlaced() {
        Roster roster = new Roster(schema);
        roster.add(createPlayers("K", 7).toArray(Player[]::new));

        Player lateKicker = new Player("Late kicker", "K");
        Player tightEnd = new Player("Tight end", "TE");
        List<Player> added = roster.add(lateKicker, tightEnd);

        assertEquals(List.of(tightEnd), added);
    }

    @Test
    void add_skipsPlayerAlreadyOnRoster() {
        Player wr = new Player("Receiver", "WR");
        Roster roster = new Roster(schema, wr);

        assertTrue(roster.add(wr).isEmpty());
        assertEquals(1, roster.size());
    }

    @Test
    void add_rejectsInvalidPlayerBeforePlacingAnyone() {
        Roster roster = new Roster(schema);
        Player wr = new Player("Receiver", "WR");

        assertThrows(InvalidPlayerException.class, () -> roster.add(wr, new Player("Punter", "P")));
        assertFalse(roster.contains(wr));
    }

    @Test
    void add_neverExceedsSlotCounts() {
        Roster roster = new Roster(schema);
        Random random = new Random(42);
        List<String> positions = List.of("QB", "RB", "WR", "TE", "D/ST", "K");

        for (int i = 0; i < 60; i++) {
            String position = positions.get(random.nextInt(positions.size()));
            roster.add(new Player(position + " " + i, position, random.nextBoolean()));
        }

        for (String position : schema.positions()) {
            assertTrue(roster.occupied(position) <= schema.count(position),
                position + " holds " + roster.occupied(position) + " players");
        }
        assertTrue(roster.size() <= schema.size() - schema.count("IR"), "add never fills injured reserve");
    }

    @Test
    void drop_removesPlayerFromNaturalSlot() {
        Player rb = new Player("Runner", "RB");
        Roster roster = new Roster(schema, rb);

        List<Player> dropped = roster.drop(rb);

        assertEquals(List.of(rb), dropped);
        assertFalse(roster.contains(rb));
        assertEquals(0, roster.occupied("RB"));
    }

    @Test
    void drop_findsPlayersInFlexAndOnBench() {
        Roster roster = new Roster(schema);
        List<Player> tightEnds = createPlayers("TE", 3);
        roster.add(tightEnds.toArray(Player[]::new));
        Player inFlex = tightEnds.get(1);
        Player onBench = tightEnds.get(2);

        List<Player> dropped = roster.drop(inFlex, onBench);

        assertEquals(List.of(inFlex, onBench), dropped);
        assertEquals(0, roster.occupied("FLEX"));
        assertEquals(0, roster.occupied("BN"));
        assertTrue(roster.contains(tightEnds.get(0)));
    }

    @Test
    void drop_findsPlayerOnInjuredReserve() {
        Player hurt = new Player("Hurt", "WR", true);
        Roster roster = new Roster(schema, hurt);
        roster.move(hurt, "IR");

        assertEquals(List.of(hurt), roster.drop(hurt));
        assertEquals(0, roster.size());
    }

    @Test
    void drop_rejectsPlayerNotOnRoster() {
        Roster roster = new Roster(schema, new Player("Receiver", "WR"));
        Player stranger = new Player("Stranger", "WR");

        PlayerNotFoundException e = assertThrows(PlayerNotFoundException.class, () -> roster.drop(stranger));
        assertEquals(stranger, e.getPlayer());
        assertEquals(1, roster.size());
    }

    @Test
    void drop_distinguishesPlayersByName() {
        Player first = new Player("Same spot", "TE");
        Player second = new Player("Other guy", "TE");
        Roster roster = new Roster(schema, first, second);

        roster.drop(second);

        assertTrue(roster.contains(first));
        assertFalse(roster.contains(second));
    }

    @Test
    void move_toBenchWithVacancyLeavesPriorSlotEmpty() {
        Player qb = new Player("Passer", "QB");
        Roster roster = new Roster(schema, qb);

        roster.move(qb, "BN");

        assertEquals(List.of(Optional.empty()), roster.slots("QB"));
        assertEquals(Optional.of(qb), roster.slots("BN").get(0));
    }

    @Test
    void move_benchPlayerIntoFlex() {
        Roster roster = new Roster(schema);
        List<Player> runners = createPlayers("RB", 3);
        roster.add(runners.toArray(Player[]::new)); // 2 RB + FLEX
        Player benched = new Player("Bench runner", "RB");
        roster.add(benched);
        roster.drop(runners.get(2));

        roster.move(benched, "FLEX");

        assertEquals(Optional.of("FLEX"), roster.positionOf(benched));
        assertEquals(0, roster.occupied("BN"));
    }

    @Test
    void move_rejectsIneligibleDestination() {
        Player qb = new Player("Passer", "QB");
        Roster roster = new Roster(schema, qb);

        assertThrows(IllegalMoveException.class, () -> roster.move(qb, "FLEX"));
        assertThrows(IllegalMoveException.class, () -> roster.move(qb, "IR"));
        assertEquals(Optional.of("QB"), roster.positionOf(qb));
    }

    @Test
    void move_rejectsUnknownDestination() {
        Player qb = new Player("Passer", "QB");
        Roster roster = new Roster(schema, qb);

        assertThrows(UnknownPositionException.class, () -> roster.move(qb, "DEF"));
    }

    @Test
    void move_toFullPositionRequiresReplacement() {
        Roster roster = new Roster(schema);
        List<Player> passers = createPlayers("QB", 2);
        roster.add(passers.toArray(Player[]::new));

        assertThrows(MissingReplacementException.class, () -> roster.move(passers.get(1), "QB"));
        assertEquals(Optional.of("BN"), roster.positionOf(passers.get(1)));
    }

    @Test
    void move_withReplacementSwapsSlots() {
        Roster roster = new Roster(schema);
        List<Player> passers = createPlayers("QB", 2);
        roster.add(passers.toArray(Player[]::new));
        Player starter = passers.get(0);
        Player backup = passers.get(1);

        roster.move(backup, "QB", starter);

        assertEquals(Optional.of("QB"), roster.positionOf(backup));
        assertEquals(Optional.of("BN"), roster.positionOf(starter));
        assertEquals(2, roster.size());
    }

    @Test
    void move_rejectsReplacementNotInDestination() {
        Roster roster = new Roster(schema);
        List<Player> passers = createPlayers("QB", 3);
        roster.add(passers.toArray(Player[]::new));

        assertThrows(PlayerNotFoundException.class,
            () -> roster.move(passers.get(1), "QB", passers.get(2)));
    }

    @Test
    void move_rejectsReplacementIneligibleForVacatedSlot() {
        Player wr = new Player("Receiver", "WR");
        Player kicker = new Player("Kicker", "K");
        Roster roster = new Roster(schema, createPlayers("WR", 2).toArray(Player[]::new));
        roster.add(wr); // FLEX
        roster.add(kicker, new Player("Backup kicker", "K")); // K, BN
        Player backupKicker = new Player("Backup kicker", "K");
        String before = roster.toString();

        assertThrows(IllegalMoveException.class, () -> roster.move(wr, "BN", backupKicker));
        assertEquals(before, roster.toString());
    }

    @Test
    void move_rejectsPlayerNotOnRoster() {
        Roster roster = new Roster(schema);

        assertThrows(PlayerNotFoundException.class, () -> roster.move(new Player("Ghost", "WR"), "BN"));
    }

    @Test
    void move_fullDestinationCheckedBeforeLookingUpPlayer() {
        Roster roster = new Roster(schema, new Player("Starter", "QB"));

        assertThrows(MissingReplacementException.class, () -> roster.move(new Player("Ghost", "QB"), "QB"));
    }

    @Test
    void move_injuredPlayerToInjuredReserveFreesStartingSlot() {
        Player hurt = new Player("Hurt", "TE", true);
        Roster roster = new Roster(schema, hurt);

        roster.move(hurt, "IR");
        Player healthy = new Player("Healthy", "TE");
        roster.add(healthy);

        assertEquals(Optional.of("IR"), roster.positionOf(hurt));
        assertEquals(Optional.of("TE"), roster.positionOf(healthy));
    }

    @Test
    void transaction_addsThenDrops() {
        Player wr = new Player("Receiver", "WR");
        Player rb = new Player("Runner", "RB");
        Roster roster = new Roster(schema, wr);

        Transaction transaction = roster.transaction(List.of(rb), List.of(wr));

        assertEquals(List.of(rb), transaction.added());
        assertEquals(List.of(wr), transaction.dropped());
        assertEquals(List.of(rb), roster.players());
    }

    @Test
    void transaction_acceptsMissingSides() {
        Player wr = new Player("Receiver", "WR");
        Roster roster = new Roster(schema);

        Transaction transaction = roster.transaction(List.of(wr), null);

        assertEquals(List.of(wr), transaction.added());
        assertTrue(transaction.dropped().isEmpty());
        assertEquals(Transaction.empty(), roster.transaction(null, null));
    }

    @Test
    void trade_swapsPlayersBetweenRosters() {
        Player ourWr = new Player("Our receiver", "WR");
        Player theirRb = new Player("Their runner", "RB");
        Roster ours = new Roster(schema, ourWr);
        Roster theirs = new Roster(schema, theirRb);

        TradeResult result = ours.trade(theirs, List.of(theirRb), List.of(ourWr));

        assertEquals(List.of(theirRb), ours.players());
        assertEquals(List.of(ourWr), theirs.players());
        assertEquals(new Transaction(ImmutableList.of(theirRb), ImmutableList.of(ourWr)), result.forRoster(ours));
        assertEquals(new Transaction(ImmutableList.of(ourWr), ImmutableList.of(theirRb)), result.forRoster(theirs));
        assertThrows(IllegalArgumentException.class, () -> result.forRoster(new Roster(schema)));
    }

    @Test
    void trade_worksBetweenFullRosters() {
        Roster ours = new Roster(schema, createPlayers("K", 7).toArray(Player[]::new));
        Roster theirs = new Roster(schema, createPlayers("D/ST", 7).toArray(Player[]::new));
        Player ourKicker = ours.slots("K").get(0).orElseThrow();
        Player theirDefense = theirs.slots("D/ST").get(0).orElseThrow();

        ours.trade(theirs, List.of(theirDefense), List.of(ourKicker));

        assertTrue(ours.contains(theirDefense));
        assertTrue(theirs.contains(ourKicker));
        assertEquals(7, ours.size());
        assertEquals(7, theirs.size());
    }

    @Test
    void trade_isNotAtomicButCanBeRolledBack() {
        Player ourWr = new Player("Our receiver", "WR");
        Player notTheirs = new Player("Someone else", "RB");
        Roster ours = new Roster(schema, ourWr);
        Roster theirs = new Roster(schema, new Player("Their runner", "RB"));
        Roster oursBefore = ours.copy();
        Roster theirsBefore = theirs.copy();

        assertThrows(PlayerNotFoundException.class,
            () -> ours.trade(theirs, List.of(notTheirs), List.of(ourWr)));
        assertFalse(ours.contains(ourWr), "Our side of the trade was already applied");

        ours.restore(oursBefore);
        theirs.restore(theirsBefore);
        assertTrue(ours.contains(ourWr));
        assertEquals(theirsBefore.players(), theirs.players());
    }

    @Test
    void copy_isIndependentOfOriginal() {
        Player wr = new Player("Receiver", "WR");
        Roster roster = new Roster(schema, wr);
        Roster copy = roster.copy();

        roster.drop(wr);

        assertTrue(copy.contains(wr));
        assertNotSame(roster, copy);
    }

    @Test
    void restore_rejectsOtherSchema() {
        Roster roster = new Roster(schema);
        Roster yahoo = new Roster(PositionSchema.yahoo(PositionSchemaTest.YAHOO_COUNTS));

        assertThrows(IllegalArgumentException.class, () -> roster.restore(yahoo));
    }

    @Test
    void slots_rejectsUnknownPosition() {
        Roster roster = new Roster(schema);

        assertThrows(UnknownPositionException.class, () -> roster.slots("DEF"));
    }

    private List<Player> createPlayers(String position, int count) {
        List<Player> players = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            players.add(new Player(position + " " + i, position));
        }
        return players;
    }
}
