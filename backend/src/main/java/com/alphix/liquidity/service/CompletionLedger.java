package com.alphix.liquidity.service;

import com.alphix.liquidity.model.DepositIntent;
import com.alphix.liquidity.model.TokenRef;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable per-token flags: has this token's authorization cleared? Only tokens with a positive
 * amount have an entry. Updates return a new ledger so a batch is applied in one swap.
 */
public final class CompletionLedger {

    private static final CompletionLedger EMPTY = new CompletionLedger(Collections.emptyMap());

    private final Map<String, Boolean> entries;

    private CompletionLedger(final Map<String, Boolean> entries) {
        this.entries = entries;
    }

    public static CompletionLedger empty() {
        return EMPTY;
    }

    public static CompletionLedger forIntent(final DepositIntent intent) {
        Map<String, Boolean> entries = new LinkedHashMap<>();
        for (TokenRef token : intent.involvedTokens()) {
            entries.put(token.symbol(), Boolean.FALSE);
        }
        return new CompletionLedger(Collections.unmodifiableMap(entries));
    }

    /**
     * Symbols without an entry are ignored.
     */
    public CompletionLedger markComplete(final Collection<String> symbols) {
        Map<String, Boolean> next = new LinkedHashMap<>(entries);
        boolean changed = false;
        for (String symbol : symbols) {
            if (next.containsKey(symbol) && !next.get(symbol)) {
                next.put(symbol, Boolean.TRUE);
                changed = true;
            }
        }
        return changed ? new CompletionLedger(Collections.unmodifiableMap(next)) : this;
    }

    public CompletionLedger markComplete(final String symbol) {
        return markComplete(Collections.singletonList(symbol));
    }

    public boolean contains(final String symbol) {
        return entries.containsKey(symbol);
    }

    public boolean isComplete(final String symbol) {
        return Boolean.TRUE.equals(entries.get(symbol));
    }

    public int size() {
        return entries.size();
    }

    public Map<String, Boolean> asMap() {
        return entries;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompletionLedger other)) {
            return false;
        }
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
