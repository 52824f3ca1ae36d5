package org.holdem.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.holdem.dto.poker.ActionMsg;
import org.holdem.dto.poker.JoinMsg;
import org.holdem.dto.poker.LeaveMsg;
import org.holdem.exception.PokerException;
import org.holdem.service.PokerTableService;
import org.holdem.service.poker.access.AccessService;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;

@Slf4j
@Controller
@RequiredArgsConstructor
public class PokerWsController {

    private final PokerTableService service;
    private final AccessService access;

    // ----------------------------------------------------------------
    // JOIN : table donnée, ou première table avec une place libre
    @MessageMapping("/poker/join")
    public void join(@Valid @Payload(required = false) JoinMsg msg, Principal principal,
                     SimpMessageHeaderAccessor headers) {
        String player = resolvePlayer(principal);
        String tableId = msg != null ? msg.getTableId() : null;
        try {
            service.join(player, tableId, headers.getSessionId());
        } catch (RuntimeException ex) {
            reject(player, "join", ex);
        }
    }

    // ----------------------------------------------------------------
    @MessageMapping("/poker/action")
    public void action(@Valid @Payload ActionMsg msg, Principal principal) {
        String player = resolvePlayer(principal);
        try {
            service.action(player, msg);
        } catch (RuntimeException ex) {
            reject(player, "action", ex);
        }
    }

    // ----------------------------------------------------------------
    @MessageMapping("/poker/leave")
    public void leave(@Valid @Payload LeaveMsg msg, Principal principal) {
        String player = resolvePlayer(principal);
        try {
            service.leave(player, msg.getTableId());
        } catch (RuntimeException ex) {
            reject(player, "leave", ex);
        }
    }

    @MessageExceptionHandler({MethodArgumentNotValidException.class, MessageConversionException.class})
    public void onInvalidPayload(Exception ex, Principal principal) {
        if (principal == null) return;
        log.debug("Invalid payload from {}: {}", principal.getName(), ex.getMessage());
        PokerException rejection = rejectionIn(ex);
        access.sendError(principal.getName(), rejection != null ? rejection.getMessage() : "Invalid message");
    }

    // le désérialiseur enveloppe l'exception levée par ActionMsg.Type.of
    private static PokerException rejectionIn(Throwable ex) {
        for (Throwable c = ex; c != null; c = c.getCause()) {
            if (c instanceof PokerException p) return p;
        }
        return null;
    }

    private String resolvePlayer(Principal principal) {
        if (principal == null || principal.getName() == null || principal.getName().isBlank())
            throw new IllegalStateException("Anonymous socket, connect with ?name=");
        return principal.getName();
    }

    private void reject(String player, String command, RuntimeException ex) {
        if (ex instanceof PokerException || ex instanceof IllegalArgumentException) {
            log.debug("{} rejected for {}: {}", command, player, ex.getMessage());
            access.sendError(player, ex.getMessage());
        } else {
            log.error("{} failed for {}", command, player, ex);
            access.sendError(player, "Internal error");
        }
    }
}
