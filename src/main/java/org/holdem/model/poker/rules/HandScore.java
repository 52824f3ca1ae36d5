package org.holdem.model.poker.rules;

import java.util.List;

/**
 * Result of {@link HandEvaluator#evaluate}. Ordered by category, then kickers
 * element by element (both descending).
 */
public record HandScore(HandCategory category, List<Integer> kickers) implements Comparable<HandScore> {

    public HandScore {
        kickers = List.copyOf(kickers);
    }

    @Override
    public int compareTo(HandScore o) {
        int c = Integer.compare(category.getScore(), o.category.getScore());
        if (c != 0) return c;
        int n = Math.min(kickers.size(), o.kickers.size());
        for (int i = 0; i < n; i++) {
            c = Integer.compare(kickers.get(i), o.kickers.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(kickers.size(), o.kickers.size());
    }

    public boolean beats(HandScore o) {
        return compareTo(o) > 0;
    }
}
