package io.coveytown.server.core.handlers;

import io.coveytown.core.UserLocation;

import java.util.function.Consumer;

/**
 * A client's live connection to a town, as seen by {@link TownRequestHandlers#townSubscriptionHandler}.
 *
 * <p>Transports (WebSocket, Socket.IO, SSE, ...) implement this to bridge their wire format to the
 * town. Payloads passed to {@link #emit} are domain objects; serializing them is up to the
 * transport.
 */
public interface TownConnection {

    String EVENT_NEW_PLAYER = "newPlayer";
    String EVENT_PLAYER_MOVED = "playerMoved";
    String EVENT_PLAYER_DISCONNECT = "playerDisconnect";
    String EVENT_CONVERSATION_UPDATED = "conversationUpdated";
    String EVENT_CONVERSATION_DESTROYED = "conversationDestroyed";
    String EVENT_TOWN_CLOSING = "townClosing";

    /**
     * Town id presented by the client when connecting.
     */
    String townId();

    /**
     * Session token presented by the client when connecting.
     */
    String sessionToken();

    /**
     * Sends an event to the client.
     *
     * @param payload event payload, or null for events without one
     */
    void emit(String event, Object payload);

    /**
     * Terminates the connection.
     *
     * @param close whether to close the underlying transport connection as well
     */
    void disconnect(boolean close);

    /**
     * Registers the callback run when the client goes away.
     */
    void onDisconnect(Runnable handler);

    /**
     * Registers the callback run for each movement reported by the client.
     */
    void onPlayerMovement(Consumer<UserLocation> handler);
}
