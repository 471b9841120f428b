package edu.brandeis.cosi103a.fantasy.scoring;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.fantasy.error.UnknownScoringKeyException;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns statistics into fantasy points under a {@link ScoringScheme}.
 */
public class PointCalculator {

    private final ScoringScheme scheme;
    private final ImmutableMap<String, String> categoryByPosition;
    private final String defaultCategory;

    /**
     * @param scheme             points per statistic
     * @param categoryByPosition scoring category for positions that do not use {@code defaultCategory}
     * @param defaultCategory    category for every other position, typically offense
     */
    public PointCalculator(ScoringScheme scheme, Map<String, String> categoryByPosition, String defaultCategory) {
        this.scheme = scheme;
        this.categoryByPosition = ImmutableMap.copyOf(categoryByPosition);
        this.defaultCategory = defaultCategory;
    }

    /**
     * Calculator for the ESPN categories: kickers score as "K", defenses as "D/ST", everyone else as "OFF".
     */
    public static PointCalculator espn(ScoringScheme scheme) {
        return new PointCalculator(scheme, Map.of("K", "K", "D/ST", "D/ST", "DEF", "D/ST"), "OFF");
    }

    /**
     * Calculator for the Yahoo! categories: kickers score as "K", defenses as "DEF", everyone else as "OFF".
     */
    public static PointCalculator yahoo(ScoringScheme scheme) {
        return new PointCalculator(scheme, Map.of("K", "K", "DEF", "DEF", "D/ST", "DEF"), "OFF");
    }

    public String categoryFor(String position) {
        return categoryByPosition.getOrDefault(position, defaultCategory);
    }

    /**
     * Points for {@code line} in the category its position scores under.
     *
     * @throws UnknownScoringKeyException if that category is not in the scheme
     */
    public double total(StatLine line) {
        return total(categoryFor(line.position()), line);
    }

    /**
     * Points for {@code line} in {@code category}. Statistics the category does not score are ignored.
     *
     * @throws UnknownScoringKeyException if the category is not in the scheme
     */
    public double total(String category, StatLine line) {
        ImmutableMap<String, Double> points = scheme.category(category);
        double total = 0.0;
        for (Map.Entry<String, Double> stat : line.stats().entrySet()) {
            Double perUnit = points.get(stat.getKey());
            if (perUnit != null) {
                total += perUnit * stat.getValue();
            }
        }
        return total;
    }

    /**
     * Stat lines ordered by total points, highest first.
     */
    public ImmutableList<StatLine> rank(List<StatLine> lines) {
        return lines.stream()
            .sorted(Comparator.comparingDouble((StatLine line) -> total(line)).reversed())
            .collect(ImmutableList.toImmutableList());
    }
}
