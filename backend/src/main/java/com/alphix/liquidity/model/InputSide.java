package com.alphix.liquidity.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Which amount of a deposit the user typed; the other one is derived.
 */
public enum InputSide {
    TOKEN0,
    TOKEN1;

    /**
     * Case-insensitive, surrounding whitespace ignored. Blank means TOKEN0; anything else
     * unrecognised is empty.
     */
    public static Optional<InputSide> parse(final String side) {
        if (side == null || side.isBlank()) {
            return Optional.of(TOKEN0);
        }
        try {
            return Optional.of(valueOf(side.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public InputSide other() {
        return this == TOKEN0 ? TOKEN1 : TOKEN0;
    }
}
