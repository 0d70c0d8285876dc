package io.coveytown.server.core.handlers;

import io.coveytown.core.CoveyTownException;
import io.coveytown.server.core.ConversationArea;
import io.coveytown.server.core.Player;
import io.coveytown.server.core.PlayerSession;
import io.coveytown.server.core.TownState;
import io.coveytown.server.core.TownsStore;
import io.coveytown.server.spi.IdGenerator;
import io.coveytown.server.spi.VideoProvisioningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Framework-neutral request handlers for the town service.
 *
 * <p>Each handler validates its request against the {@link TownsStore}, performs at most one
 * operation on a town and reports the outcome as a {@link ResponseEnvelope}; expected failures
 * never surface as exceptions. HTTP or socket integrations adapt their requests to these records.
 */
public final class TownRequestHandlers {

    private static final Logger LOGGER = LoggerFactory.getLogger(TownRequestHandlers.class);

    private final TownsStore store;
    private final IdGenerator ids;

    public TownRequestHandlers(TownsStore store, IdGenerator ids) {
        this.store = Objects.requireNonNull(store, "store");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public ResponseEnvelope<TownJoinResponse> townJoinHandler(TownJoinRequest request) {
        Optional<TownState> found = store.getControllerForTown(request.coveyTownID());
        if (found.isEmpty()) {
            return ResponseEnvelope.error("Error: No such town");
        }
        if (request.userName() == null || request.userName().isBlank()) {
            return ResponseEnvelope.error("Error: userName must be specified");
        }
        TownState town = found.get();
        PlayerSession session;
        try {
            session = town.join(new Player(ids.playerId(), request.userName()));
        } catch (VideoProvisioningException e) {
            LOGGER.warn("Video provisioning failed for a player joining town {}", town.townId(), e);
            return ResponseEnvelope.error("Error: unable to provision video: " + e.getMessage());
        }
        return ResponseEnvelope.ok(new TownJoinResponse(
                session.player().id(),
                session.sessionToken(),
                session.videoToken(),
                town.players(),
                town.friendlyName(),
                town.isPubliclyListed(),
                town.conversationAreas()));
    }

    public ResponseEnvelope<TownListResponse> townListHandler() {
        return ResponseEnvelope.ok(new TownListResponse(store.getTowns()));
    }

    public ResponseEnvelope<TownCreateResponse> townCreateHandler(TownCreateRequest request) {
        if (request.friendlyName() == null || request.friendlyName().isEmpty()) {
            return ResponseEnvelope.error("FriendlyName must be specified");
        }
        TownState town;
        try {
            town = store.createTown(request.friendlyName(), request.isPubliclyListed());
        } catch (CoveyTownException.DuplicateTown e) {
            return ResponseEnvelope.error(e.getMessage());
        }
        return ResponseEnvelope.ok(new TownCreateResponse(town.townId(), town.townUpdatePassword()));
    }

    public ResponseEnvelope<Void> townDeleteHandler(TownDeleteRequest request) {
        boolean success = store.deleteTown(request.coveyTownID(), request.coveyTownPassword());
        return new ResponseEnvelope<>(success, success ? null : "Invalid password. Please double check your town update password.", null);
    }

    public ResponseEnvelope<Void> townUpdateHandler(TownUpdateRequest request) {
        boolean success = store.updateTown(
                request.coveyTownID(),
                request.coveyTownPassword(),
                request.friendlyName(),
                request.isPubliclyListed());
        return new ResponseEnvelope<>(success, success ? null : "Invalid password or update values specified. Please double check your town update password.", null);
    }

    /**
     * Opens a conversation area on behalf of a player holding a live session in the town.
     */
    public ResponseEnvelope<Void> conversationAreaCreateHandler(ConversationCreateRequest request) {
        String failure = "Unable to create conversation area " + request.label() + " with topic " + request.topic();
        Optional<TownState> town = store.getControllerForTown(request.coveyTownID());
        if (town.isEmpty() || town.get().getSessionByToken(request.sessionToken()).isEmpty()) {
            return ResponseEnvelope.error(failure);
        }
        boolean created = town.get().addConversationArea(
                new ConversationArea(request.label(), request.topic(), request.boundingBox()));
        return created ? ResponseEnvelope.ok(null) : ResponseEnvelope.error(failure);
    }

    /**
     * Attaches a client connection to its town.
     *
     * <p>Connections presenting an unknown town id or session token are disconnected. Otherwise
     * the connection receives every town event until it goes away, at which point its listener
     * is removed and its session destroyed.
     */
    public void townSubscriptionHandler(TownConnection connection) {
        Objects.requireNonNull(connection, "connection");
        Optional<TownState> town = store.getControllerForTown(connection.townId());
        Optional<PlayerSession> session = town.flatMap(t -> t.getSessionByToken(connection.sessionToken()));
        if (town.isEmpty() || session.isEmpty()) {
            LOGGER.debug("Rejecting connection to town {}: invalid town or session", connection.townId());
            connection.disconnect(true);
            return;
        }
        TownState townState = town.get();
        PlayerSession playerSession = session.get();
        ConnectionTownListener listener = new ConnectionTownListener(connection);
        townState.addTownListener(listener);

        connection.onDisconnect(() -> {
            townState.removeTownListener(listener);
            townState.destroySession(playerSession);
        });
        connection.onPlayerMovement(location -> {
            try {
                townState.updatePlayerLocation(playerSession.player(), location);
            } catch (CoveyTownException.UnknownPlayer e) {
                // late frames can arrive after the disconnect hook has run
                LOGGER.debug("Dropping movement of departed player {} in town {}",
                        playerSession.player().id(), townState.townId());
            }
        });
    }
}
