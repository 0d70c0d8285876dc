package io.coveytown.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Last reported position of a player.
 *
 * <p>Immutable. A location optionally carries the label of the conversation area the client
 * reports the player to be in; when present that label is authoritative for membership.
 */
public final class UserLocation {

    private final double x;
    private final double y;
    private final Direction rotation;
    private final boolean moving;
    private final String conversationLabel;

    public UserLocation(double x, double y, Direction rotation, boolean moving, String conversationLabel) {
        this.x = x;
        this.y = y;
        this.rotation = Objects.requireNonNull(rotation, "rotation");
        this.moving = moving;
        this.conversationLabel = conversationLabel;
    }

    /**
     * Where every new player starts: the origin, facing front, standing still.
     */
    public static UserLocation origin() {
        return new UserLocation(0, 0, Direction.FRONT, false, null);
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public Direction rotation() {
        return rotation;
    }

    public boolean moving() {
        return moving;
    }

    /**
     * Label of the conversation area reported by the client; empty labels count as absent.
     */
    public Optional<String> conversationLabel() {
        if (conversationLabel == null || conversationLabel.isEmpty()) return Optional.empty();
        return Optional.of(conversationLabel);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof UserLocation)) return false;
        UserLocation that = (UserLocation) other;
        return Double.compare(x, that.x) == 0
                && Double.compare(y, that.y) == 0
                && moving == that.moving
                && rotation == that.rotation
                && Objects.equals(conversationLabel(), that.conversationLabel());
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, rotation, moving, conversationLabel());
    }

    @Override
    public String toString() {
        return "UserLocation{x=" + x + ", y=" + y + ", rotation=" + rotation.wireName()
                + ", moving=" + moving + ", conversationLabel=" + conversationLabel + '}';
    }
}
