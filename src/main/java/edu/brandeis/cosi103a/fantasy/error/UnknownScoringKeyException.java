package edu.brandeis.cosi103a.fantasy.error;

/**
 * Thrown when a scoring category or statistic is not defined by a scoring scheme.
 */
public class UnknownScoringKeyException extends FantasyException {
    public UnknownScoringKeyException(String category) {
        super("Unknown scoring category: " + category);
    }

    public UnknownScoringKeyException(String category, String statistic) {
        super("Unknown statistic " + statistic + " in scoring category " + category);
    }
}
