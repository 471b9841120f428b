package edu.brandeis.cosi103a.fantasy.roster;

import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The roster position codes a league platform uses.
 *
 * <p>Two conventions ship as presets, {@link #ESPN} and {@link #YAHOO}. They differ only in the
 * names of the flex and defense codes and in the order offense positions are listed.
 *
 * @param offense        offensive skill position codes, including {@link #QUARTERBACK}
 * @param flex           code of the slot open to any non-quarterback offense player
 * @param dst            defense/special teams code
 * @param kicker         kicker code
 * @param bench          bench code
 * @param injuredReserve injured reserve code
 */
public record PositionCodes(
    ImmutableList<String> offense,
    String flex,
    String dst,
    String kicker,
    String bench,
    String injuredReserve
) {
    public static final String QUARTERBACK = "QB";

    public static final PositionCodes ESPN = new PositionCodes(
        ImmutableList.of("QB", "RB", "WR", "TE"), "FLEX", "D/ST", "K", "BN", "IR");

    public static final PositionCodes YAHOO = new PositionCodes(
        ImmutableList.of("QB", "WR", "RB", "TE"), "W-R-T", "DEF", "K", "BN", "IR");

    public PositionCodes {
        Objects.requireNonNull(offense, "offense");
        Objects.requireNonNull(flex, "flex");
        Objects.requireNonNull(dst, "dst");
        Objects.requireNonNull(kicker, "kicker");
        Objects.requireNonNull(bench, "bench");
        Objects.requireNonNull(injuredReserve, "injuredReserve");

        if (!offense.contains(QUARTERBACK)) {
            throw new IllegalArgumentException("Offense codes must include " + QUARTERBACK + ": " + offense);
        }

        Set<String> seen = new HashSet<>();
        for (String code : all(offense, flex, dst, kicker, bench, injuredReserve)) {
            if (!seen.add(code)) {
                throw new IllegalArgumentException("Duplicate position code: " + code);
            }
        }
    }

    /**
     * Looks up a preset by its platform name, ignoring case.
     *
     * @throws IllegalArgumentException if no preset has that name
     */
    public static PositionCodes forConvention(String convention) {
        return switch (convention.toUpperCase()) {
            case "ESPN" -> ESPN;
            case "YAHOO" -> YAHOO;
            default -> throw new IllegalArgumentException("Unknown position convention: " + convention);
        };
    }

    /**
     * All codes in canonical order: offense, flex, dst, kicker, bench, injured reserve.
     */
    public ImmutableList<String> positions() {
        return all(offense, flex, dst, kicker, bench, injuredReserve);
    }

    private static ImmutableList<String> all(List<String> offense, String... rest) {
        return ImmutableList.<String>builder().addAll(offense).add(rest).build();
    }
}
