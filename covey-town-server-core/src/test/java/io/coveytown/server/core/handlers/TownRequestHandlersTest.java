package io.coveytown.server.core.handlers;

import io.coveytown.core.BoundingBox;
import io.coveytown.core.Direction;
import io.coveytown.core.UserLocation;
import io.coveytown.server.core.ConversationArea;
import io.coveytown.server.core.NanoIdGenerator;
import io.coveytown.server.core.Player;
import io.coveytown.server.core.PlayerSession;
import io.coveytown.server.core.TownState;
import io.coveytown.server.core.TownsStore;
import io.coveytown.server.spi.VideoProvisioningException;
import io.coveytown.server.spi.VideoTokenProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class TownRequestHandlersTest {

    private boolean videoDown;
    private TownsStore store;
    private TownRequestHandlers handlers;

    @BeforeEach
    void setUp() {
        VideoTokenProvider video = (townId, playerId) -> {
            if (videoDown) throw new VideoProvisioningException("video service unavailable");
            return "video:" + playerId;
        };
        NanoIdGenerator ids = new NanoIdGenerator();
        store = new TownsStore(video, ids, TownsStore.Config.defaults());
        handlers = new TownRequestHandlers(store, ids);
    }

    @Test
    void createThenListThenDelete() {
        ResponseEnvelope<TownCreateResponse> created = handlers.townCreateHandler(new TownCreateRequest("Plaza", true));
        assertThat(created.isOK()).isTrue();
        String townId = created.response().coveyTownID();
        String password = created.response().coveyTownPassword();

        ResponseEnvelope<TownListResponse> listed = handlers.townListHandler();
        assertThat(listed.response().towns())
                .extracting(l -> l.coveyTownID() + "/" + l.friendlyName())
                .containsExactly(townId + "/Plaza");

        ResponseEnvelope<Void> badDelete = handlers.townDeleteHandler(new TownDeleteRequest(townId, "nope"));
        assertThat(badDelete.isOK()).isFalse();
        assertThat(badDelete.message()).startsWith("Invalid password");

        assertThat(handlers.townDeleteHandler(new TownDeleteRequest(townId, password)).isOK()).isTrue();
        assertThat(handlers.townListHandler().response().towns()).isEmpty();
    }

    @Test
    void createRequiresAFriendlyName() {
        ResponseEnvelope<TownCreateResponse> response = handlers.townCreateHandler(new TownCreateRequest("", true));

        assertThat(response.isOK()).isFalse();
        assertThat(response.message()).isEqualTo("FriendlyName must be specified");
    }

    @Test
    void updateChangesNameAndVisibility() {
        TownState town = store.createTown("Old", true);

        ResponseEnvelope<Void> rejected = handlers.townUpdateHandler(
                new TownUpdateRequest(town.townId(), "wrong", "New", false));
        assertThat(rejected.isOK()).isFalse();
        assertThat(rejected.message()).startsWith("Invalid password or update values specified");

        ResponseEnvelope<Void> accepted = handlers.townUpdateHandler(
                new TownUpdateRequest(town.townId(), town.townUpdatePassword(), "New", false));
        assertThat(accepted.isOK()).isTrue();
        assertThat(town.friendlyName()).isEqualTo("New");
        assertThat(handlers.townListHandler().response().towns()).isEmpty();
    }

    @Test
    void joinUnknownTownFails() {
        ResponseEnvelope<TownJoinResponse> response = handlers.townJoinHandler(new TownJoinRequest("alice", "missing"));

        assertThat(response.isOK()).isFalse();
        assertThat(response.message()).isEqualTo("Error: No such town");
    }

    @Test
    void joinReturnsSessionAndTownSnapshot() {
        TownState town = store.createTown("Plaza", false);
        town.addConversationArea(new ConversationArea("Area", "Topic", new BoundingBox(50, 50, 4, 4)));

        ResponseEnvelope<TownJoinResponse> response = handlers.townJoinHandler(new TownJoinRequest("alice", town.townId()));

        assertThat(response.isOK()).isTrue();
        TownJoinResponse join = response.response();
        assertThat(join.friendlyName()).isEqualTo("Plaza");
        assertThat(join.isPubliclyListed()).isFalse();
        assertThat(join.providerVideoToken()).isEqualTo("video:" + join.coveyUserID());
        assertThat(join.currentPlayers()).extracting(Player::userName).containsExactly("alice");
        assertThat(join.conversationAreas()).extracting(ConversationArea::label).containsExactly("Area");
        assertThat(town.getSessionByToken(join.coveySessionToken()))
                .map(s -> s.player().id())
                .contains(join.coveyUserID());
    }

    @Test
    void joinReportsVideoFailureWithoutAddingThePlayer() {
        TownState town = store.createTown("Plaza", false);
        videoDown = true;

        ResponseEnvelope<TownJoinResponse> response = handlers.townJoinHandler(new TownJoinRequest("alice", town.townId()));

        assertThat(response.isOK()).isFalse();
        assertThat(response.message()).contains("unavailable");
        assertThat(town.players()).isEmpty();
    }

    @Test
    void conversationAreaCreationChecksTheSession() {
        TownState town = store.createTown("Plaza", false);
        String token = handlers.townJoinHandler(new TownJoinRequest("alice", town.townId())).response().coveySessionToken();
        BoundingBox box = new BoundingBox(1, 1, 1, 1);

        ResponseEnvelope<Void> badSession = handlers.conversationAreaCreateHandler(
                new ConversationCreateRequest(town.townId(), "bogus", "Area 1", "Topic 1", box));
        assertThat(badSession.isOK()).isFalse();
        assertThat(badSession.message()).isEqualTo("Unable to create conversation area Area 1 with topic Topic 1");
        assertThat(town.conversationAreas()).isEmpty();

        ResponseEnvelope<Void> badTown = handlers.conversationAreaCreateHandler(
                new ConversationCreateRequest("missing", token, "Area 1", "Topic 1", box));
        assertThat(badTown.isOK()).isFalse();

        assertThat(handlers.conversationAreaCreateHandler(
                new ConversationCreateRequest(town.townId(), token, "Area 1", "Topic 1", box)).isOK()).isTrue();
        assertThat(town.conversationAreas()).extracting(ConversationArea::label).containsExactly("Area 1");

        ResponseEnvelope<Void> duplicate = handlers.conversationAreaCreateHandler(
                new ConversationCreateRequest(town.townId(), token, "Area 1", "Other", new BoundingBox(20, 20, 1, 1)));
        assertThat(duplicate.isOK()).isFalse();
    }

    @Nested
    class Subscription {

        private TownState town;
        private PlayerSession session;

        @BeforeEach
        void joinTown() throws Exception {
            town = store.createTown("Sockets", false);
            session = town.join(new Player("p1", "alice"));
        }

        @Test
        void unknownTownIsDisconnected() {
            FakeConnection connection = new FakeConnection("missing", session.sessionToken());

            handlers.townSubscriptionHandler(connection);

            assertThat(connection.disconnected).containsExactly(true);
            assertThat(town.occupancy()).isZero();
        }

        @Test
        void unknownSessionIsDisconnected() {
            FakeConnection connection = new FakeConnection(town.townId(), "bogus");

            handlers.townSubscriptionHandler(connection);

            assertThat(connection.disconnected).containsExactly(true);
            assertThat(town.occupancy()).isZero();
        }

        @Test
        void townEventsAreRelayed() throws Exception {
            FakeConnection connection = subscribe();
            Player bob = new Player("p2", "bob");

            PlayerSession bobSession = town.join(bob);
            town.updatePlayerLocation(bob, new UserLocation(5, 5, Direction.RIGHT, true, null));
            town.destroySession(bobSession);

            assertThat(connection.emitted).containsExactly(
                    new Emitted(TownConnection.EVENT_NEW_PLAYER, bob),
                    new Emitted(TownConnection.EVENT_PLAYER_MOVED, bob),
                    new Emitted(TownConnection.EVENT_PLAYER_DISCONNECT, bob));
            assertThat(connection.disconnected).isEmpty();
        }

        @Test
        void conversationEventsAreRelayed() {
            FakeConnection connection = subscribe();
            ConversationArea area = new ConversationArea("Area", "Topic", new BoundingBox(10, 10, 5, 5));
            town.addConversationArea(area);

            connection.move(new UserLocation(10, 10, Direction.FRONT, false, "Area"));
            connection.move(new UserLocation(40, 40, Direction.FRONT, false, null));

            assertThat(connection.emitted).extracting(Emitted::event).containsExactly(
                    TownConnection.EVENT_CONVERSATION_UPDATED,
                    TownConnection.EVENT_CONVERSATION_UPDATED,
                    TownConnection.EVENT_PLAYER_MOVED,
                    TownConnection.EVENT_CONVERSATION_DESTROYED,
                    TownConnection.EVENT_PLAYER_MOVED);
        }

        @Test
        void movementFromTheConnectionMovesThePlayer() {
            FakeConnection connection = subscribe();
            UserLocation location = new UserLocation(12, 34, Direction.BACK, true, null);

            connection.move(location);

            assertThat(session.player().location()).isEqualTo(location);
            assertThat(connection.emitted).containsExactly(new Emitted(TownConnection.EVENT_PLAYER_MOVED, session.player()));
        }

        @Test
        void closingTheTownDisconnectsTheClient() {
            FakeConnection connection = subscribe();

            town.disconnectAllPlayers();

            assertThat(connection.emitted).containsExactly(new Emitted(TownConnection.EVENT_TOWN_CLOSING, null));
            assertThat(connection.disconnected).containsExactly(true);
        }

        @Test
        void clientDisconnectRemovesListenerAndSession() throws Exception {
            FakeConnection connection = subscribe();

            connection.drop();
            town.join(new Player("p2", "should not be notified"));

            assertThat(connection.emitted).isEmpty();
            assertThat(town.occupancy()).isZero();
            assertThat(town.getSessionByToken(session.sessionToken())).isEmpty();
            assertThat(town.players()).extracting(Player::id).containsExactly("p2");

            FakeConnection reconnect = new FakeConnection(town.townId(), session.sessionToken());
            handlers.townSubscriptionHandler(reconnect);
            assertThat(reconnect.disconnected).containsExactly(true);
        }

        @Test
        void movementAfterDisconnectIsIgnored() {
            FakeConnection connection = subscribe();
            connection.drop();

            connection.move(new UserLocation(1, 1, Direction.LEFT, false, null));

            assertThat(session.player().location()).isEqualTo(UserLocation.origin());
        }

        @Test
        void movementRacingASessionTeardownIsDropped() {
            FakeConnection connection = subscribe();
            town.destroySession(session);
            connection.emitted.clear();

            assertThatCode(() -> connection.move(new UserLocation(1, 1, Direction.LEFT, false, null)))
                    .doesNotThrowAnyException();

            assertThat(session.player().location()).isEqualTo(UserLocation.origin());
            assertThat(connection.emitted).isEmpty();
        }

        private FakeConnection subscribe() {
            FakeConnection connection = new FakeConnection(town.townId(), session.sessionToken());
            handlers.townSubscriptionHandler(connection);
            assertThat(connection.disconnected).isEmpty();
            assertThat(town.occupancy()).isEqualTo(1);
            return connection;
        }
    }

    record Emitted(String event, Object payload) {}

    private static final class FakeConnection implements TownConnection {
        private final String townId;
        private final String sessionToken;
        final List<Emitted> emitted = new ArrayList<>();
        final List<Boolean> disconnected = new ArrayList<>();
        private Runnable onDisconnect;
        private Consumer<UserLocation> onMovement;

        FakeConnection(String townId, String sessionToken) {
            this.townId = townId;
            this.sessionToken = sessionToken;
        }

        @Override
        public String townId() {
            return townId;
        }

        @Override
        public String sessionToken() {
            return sessionToken;
        }

        @Override
        public void emit(String event, Object payload) {
            emitted.add(new Emitted(event, payload));
        }

        @Override
        public void disconnect(boolean close) {
            disconnected.add(close);
        }

        @Override
        public void onDisconnect(Runnable handler) {
            this.onDisconnect = handler;
        }

        @Override
        public void onPlayerMovement(Consumer<UserLocation> handler) {
            this.onMovement = handler;
        }

        void drop() {
            onDisconnect.run();
        }

        void move(UserLocation location) {
            onMovement.accept(location);
        }
    }
}
