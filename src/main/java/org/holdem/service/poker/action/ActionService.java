package org.holdem.service.poker.action;

import lombok.RequiredArgsConstructor;
import org.holdem.dto.poker.ActionMsg;
import org.holdem.exception.PokerException;
import org.holdem.model.poker.PlayerAction;
import org.holdem.model.poker.PokerTable;
import org.holdem.service.poker.engine.RoundEngine;
import org.holdem.service.poker.registry.TableRegistry;
import org.holdem.service.poker.util.Locks;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ActionService {
    private final TableRegistry registry;
    private final RoundEngine engine;
    private final Locks locks;

    public void apply(String player, ActionMsg msg) {
        PokerTable t = registry.find(msg.getTableId())
                .orElseThrow(() -> new PokerException(PokerException.Reason.INVALID_ACTION, "unknown table"));
        PlayerAction action = toAction(msg);

        synchronized (locks.of(t.getId())) {
            if (t.getHand() == null || !t.getHand().hasPlayer(player))
                throw new PokerException(PokerException.Reason.INVALID_ACTION, "you are not in this hand");
            engine.onPlayerAction(t, player, action);
        }
    }

    static PlayerAction toAction(ActionMsg msg) {
        if (msg.getType() == null) throw new PokerException(PokerException.Reason.INVALID_ACTION, "missing action type");
        return switch (msg.getType()) {
            case FOLD -> PlayerAction.fold();
            case BET -> PlayerAction.bet(msg.getAmount());
        };
    }
}
