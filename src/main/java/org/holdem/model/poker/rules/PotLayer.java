package org.holdem.model.poker.rules;

import java.util.List;

/**
 * One slice of the pot. {@code contributors} paid into it; {@code eligible} are the
 * contributors still holding cards at showdown.
 */
public record PotLayer(long amount, List<String> contributors, List<String> eligible) {
    public PotLayer {
        contributors = List.copyOf(contributors);
        eligible = List.copyOf(eligible);
    }
}
