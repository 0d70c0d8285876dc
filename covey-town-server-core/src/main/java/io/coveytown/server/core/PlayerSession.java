package io.coveytown.server.core;

import java.util.Objects;

/**
 * Binding between a joined player, its bearer token and its video credential.
 */
public final class PlayerSession {

    private final Player player;
    private final String sessionToken;
    private final String videoToken;

    PlayerSession(Player player, String sessionToken, String videoToken) {
        this.player = Objects.requireNonNull(player, "player");
        this.sessionToken = Objects.requireNonNull(sessionToken, "sessionToken");
        this.videoToken = Objects.requireNonNull(videoToken, "videoToken");
    }

    public Player player() {
        return player;
    }

    public String sessionToken() {
        return sessionToken;
    }

    public String videoToken() {
        return videoToken;
    }
}
