package edu.brandeis.cosi103a.fantasy.draft;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One slot in the draft order.
 *
 * @param round  1-based round number
 * @param number 1-based absolute pick number, counted across all rounds
 */
public record Pick(
    @JsonProperty("round") int round,
    @JsonProperty("number") int number
) {}
