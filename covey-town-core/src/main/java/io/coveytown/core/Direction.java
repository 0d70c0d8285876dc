package io.coveytown.core;

import java.util.Locale;

/**
 * Facing of a player's avatar.
 */
public enum Direction {
    FRONT,
    BACK,
    LEFT,
    RIGHT;

    /**
     * Lower-case wire name ({@code "front"}, {@code "back"}, ...).
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
