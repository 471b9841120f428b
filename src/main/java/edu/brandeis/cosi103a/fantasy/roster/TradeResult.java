package edu.brandeis.cosi103a.fantasy.roster;

/**
 * Outcome of a trade, one {@link Transaction} per participating roster.
 *
 * @param initiator        the roster that proposed the trade
 * @param initiatorSide    what {@code initiator} gained and lost
 * @param counterparty     the other roster
 * @param counterpartySide what {@code counterparty} gained and lost
 */
public record TradeResult(
    Roster initiator,
    Transaction initiatorSide,
    Roster counterparty,
    Transaction counterpartySide
) {
    /**
     * The transaction applied to {@code roster}.
     *
     * @throws IllegalArgumentException if {@code roster} took no part in the trade
     */
    public Transaction forRoster(Roster roster) {
        if (roster == initiator) {
            return initiatorSide;
        }
        if (roster == counterparty) {
            return counterpartySide;
        }
        throw new IllegalArgumentException("Roster was not part of this trade");
    }
}
