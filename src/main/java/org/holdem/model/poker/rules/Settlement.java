package org.holdem.model.poker.rules;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a hand: who receives what, layer by layer.
 *
 * @param unclaimed chips of layers whose contributors all folded; nobody receives them
 * @param oddChips  chips left over by the integer split of a tied layer
 */
public record Settlement(List<LayerResult> layers,
                         Map<String, Long> payouts,
                         Map<String, HandScore> scores,
                         long unclaimed,
                         long oddChips) {

    public record LayerResult(PotLayer layer, List<String> winners, long share) {}

    public Settlement {
        layers = List.copyOf(layers);
        payouts = Map.copyOf(payouts);
        scores = Map.copyOf(scores);
    }

    /** Everyone else folded: the last player takes the whole pot unseen. */
    public static Settlement uncontested(String winner, long pot, List<String> contributors) {
        PotLayer layer = new PotLayer(pot, contributors, List.of(winner));
        return new Settlement(List.of(new LayerResult(layer, List.of(winner), pot)),
                Map.of(winner, pot), Map.of(), 0, 0);
    }

    /** Chips that left the stacks this hand and were not paid back to anyone. */
    public long unresolved() {
        return unclaimed + oddChips;
    }
}
