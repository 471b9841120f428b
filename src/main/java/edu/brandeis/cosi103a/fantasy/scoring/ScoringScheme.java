package edu.brandeis.cosi103a.fantasy.scoring;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import edu.brandeis.cosi103a.fantasy.error.UnknownScoringKeyException;

import java.util.Map;

/**
 * Points awarded per unit of each statistic, grouped by scoring category (e.g. "OFF", "K", "D/ST").
 */
public final class ScoringScheme {

    private final ImmutableMap<String, ImmutableMap<String, Double>> points;

    public ScoringScheme(Map<String, ? extends Map<String, Double>> points) {
        ImmutableMap.Builder<String, ImmutableMap<String, Double>> builder = ImmutableMap.builder();
        points.forEach((category, stats) -> builder.put(category, ImmutableMap.copyOf(stats)));
        this.points = builder.build();
    }

    public ImmutableSet<String> categories() {
        return points.keySet();
    }

    public boolean contains(String category, String statistic) {
        ImmutableMap<String, Double> stats = points.get(category);
        return stats != null && stats.containsKey(statistic);
    }

    /**
     * @throws UnknownScoringKeyException if the category is not in this scheme
     */
    public ImmutableMap<String, Double> category(String category) {
        ImmutableMap<String, Double> stats = points.get(category);
        if (stats == null) {
            throw new UnknownScoringKeyException(category);
        }
        return stats;
    }

    /**
     * @throws UnknownScoringKeyException if the category is not in this scheme
     */
    public ImmutableSet<String> statistics(String category) {
        return category(category).keySet();
    }

    /**
     * Points per unit of {@code statistic} in {@code category}.
     *
     * @throws UnknownScoringKeyException if either key is not in this scheme
     */
    public double points(String category, String statistic) {
        Double value = category(category).get(statistic);
        if (value == null) {
            throw new UnknownScoringKeyException(category, statistic);
        }
        return value;
    }

    @Override
    public String toString() {
        return "ScoringScheme" + points;
    }
}
