package io.coveytown.server.core;

import io.coveytown.core.UserLocation;

import java.util.Objects;

/**
 * A participant in a town.
 *
 * <p>Location and conversation membership are mutated only by the owning {@link TownState},
 * under its lock. Players compare by identity.
 */
public final class Player {

    private final String id;
    private final String userName;
    private volatile UserLocation location = UserLocation.origin();
    private volatile ConversationArea activeConversationArea;

    public Player(String id, String userName) {
        this.id = Objects.requireNonNull(id, "id");
        this.userName = Objects.requireNonNull(userName, "userName");
    }

    public String id() {
        return id;
    }

    public String userName() {
        return userName;
    }

    public UserLocation location() {
        return location;
    }

    /**
     * The conversation area this player currently occupies, or {@code null}.
     */
    public ConversationArea activeConversationArea() {
        return activeConversationArea;
    }

    void updateLocation(UserLocation location) {
        this.location = Objects.requireNonNull(location, "location");
    }

    void activeConversationArea(ConversationArea area) {
        this.activeConversationArea = area;
    }

    @Override
    public String toString() {
        return "Player{id=" + id + ", userName=" + userName + '}';
    }
}
