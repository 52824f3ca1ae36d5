package org.holdem.service.poker.util;

import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Striped monitors: every mutation of a table runs under {@code of(tableId)}. The
 * stripe count is fixed, so ids chosen by clients cannot grow it.
 */
@Component
public class Locks {
    static final int STRIPES = 128;

    private final Object[] stripes = new Object[STRIPES];

    public Locks() {
        for (int i = 0; i < stripes.length; i++) stripes[i] = new Object();
    }

    public Object of(String tableId) {
        int idx = Objects.hashCode(tableId) & (stripes.length - 1);
        return stripes[idx];
    }
}
