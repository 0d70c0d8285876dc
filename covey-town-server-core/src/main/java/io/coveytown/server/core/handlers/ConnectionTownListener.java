package io.coveytown.server.core.handlers;

import io.coveytown.server.core.ConversationArea;
import io.coveytown.server.core.Player;
import io.coveytown.server.core.TownListener;

import java.util.Objects;

/**
 * Relays town events onto one client connection.
 */
final class ConnectionTownListener implements TownListener {

    private final TownConnection connection;

    ConnectionTownListener(TownConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    @Override
    public void onPlayerJoined(Player newPlayer) {
        connection.emit(TownConnection.EVENT_NEW_PLAYER, newPlayer);
    }

    @Override
    public void onPlayerMoved(Player movedPlayer) {
        connection.emit(TownConnection.EVENT_PLAYER_MOVED, movedPlayer);
    }

    @Override
    public void onPlayerDisconnected(Player removedPlayer) {
        connection.emit(TownConnection.EVENT_PLAYER_DISCONNECT, removedPlayer);
    }

    @Override
    public void onConversationAreaUpdated(ConversationArea conversationArea) {
        connection.emit(TownConnection.EVENT_CONVERSATION_UPDATED, conversationArea);
    }

    @Override
    public void onConversationAreaDestroyed(ConversationArea conversationArea) {
        connection.emit(TownConnection.EVENT_CONVERSATION_DESTROYED, conversationArea);
    }

    @Override
    public void onTownDestroyed() {
        connection.emit(TownConnection.EVENT_TOWN_CLOSING, null);
        connection.disconnect(true);
    }

    @Override
    public String toString() {
        return "ConnectionTownListener{" + connection + '}';
    }
}
