package org.holdem.model.poker.rules;

import org.holdem.model.poker.Card;
import org.holdem.model.poker.PokerPlayer;

import java.util.*;

public final class PotRules {
    private PotRules(){}

    private static final int BOARD_SIZE = 5;

    /**
     * Splits the contributions into layers, smallest first. Each layer takes the smallest
     * outstanding contribution from every player who still has some.
     */
    public static List<PotLayer> layers(List<PokerPlayer> players) {
        Map<PokerPlayer, Long> remaining = new LinkedHashMap<>();
        for (PokerPlayer p : players) {
            if (p.getTotalContribution() > 0) remaining.put(p, p.getTotalContribution());
        }

        List<PotLayer> out = new ArrayList<>();
        while (!remaining.isEmpty()) {
            long slice = Collections.min(remaining.values());
            List<String> contributors = new ArrayList<>();
            List<String> eligible = new ArrayList<>();
            for (PokerPlayer p : remaining.keySet()) {
                contributors.add(p.getName());
                if (p.isActive()) eligible.add(p.getName());
            }
            out.add(new PotLayer(slice * contributors.size(), contributors, eligible));

            Iterator<Map.Entry<PokerPlayer, Long>> it = remaining.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<PokerPlayer, Long> e = it.next();
                long left = e.getValue() - slice;
                if (left == 0) it.remove();
                else e.setValue(left);
            }
        }
        return out;
    }

    /** Ranks the remaining hands and pays every layer to its best eligible hand(s). */
    public static Settlement settle(List<PokerPlayer> players, List<Card> community) {
        if (community.size() < BOARD_SIZE)
            throw new IllegalStateException("Showdown with " + community.size() + " community cards");

        Map<String, HandScore> scores = new LinkedHashMap<>();
        for (PokerPlayer p : players) {
            if (!p.isActive()) continue;
            List<Card> all = new ArrayList<>(p.getHand());
            all.addAll(community);
            scores.put(p.getName(), HandEvaluator.evaluate(all));
        }

        Map<String, Long> payouts = new LinkedHashMap<>();
        List<Settlement.LayerResult> results = new ArrayList<>();
        long unclaimed = 0, oddChips = 0;

        for (PotLayer layer : layers(players)) {
            if (layer.eligible().isEmpty()) {
                unclaimed += layer.amount();
                results.add(new Settlement.LayerResult(layer, List.of(), 0));
                continue;
            }
            HandScore best = null;
            for (String name : layer.eligible()) {
                HandScore s = scores.get(name);
                if (best == null || s.beats(best)) best = s;
            }
            List<String> winners = new ArrayList<>();
            for (String name : layer.eligible()) {
                if (scores.get(name).compareTo(best) == 0) winners.add(name);
            }
            long share = layer.amount() / winners.size();
            oddChips += layer.amount() % winners.size();
            for (String w : winners) payouts.merge(w, share, Long::sum);
            results.add(new Settlement.LayerResult(layer, winners, share));
        }
        return new Settlement(results, payouts, scores, unclaimed, oddChips);
    }
}
