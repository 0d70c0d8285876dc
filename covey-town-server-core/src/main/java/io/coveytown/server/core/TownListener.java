package io.coveytown.server.core;

/**
 * Observer of a single town.
 *
 * <p>Callbacks run synchronously on the thread that performed the triggering operation, while the
 * town's lock is held. Implementations should hand off slow work. A listener may remove itself
 * (or any other listener) from within a callback.
 */
public interface TownListener {

    void onPlayerJoined(Player newPlayer);

    void onPlayerMoved(Player movedPlayer);

    void onPlayerDisconnected(Player removedPlayer);

    /**
     * Called when an area is created or its occupant list changes.
     */
    void onConversationAreaUpdated(ConversationArea conversationArea);

    /**
     * Called once when an area loses its last occupant and is removed from the town.
     */
    void onConversationAreaDestroyed(ConversationArea conversationArea);

    /**
     * The town is closing; connections fed by this listener should be terminated.
     */
    void onTownDestroyed();
}
