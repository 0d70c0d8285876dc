package io.coveytown.server.core;

import io.coveytown.core.CoveyTownException;
import io.coveytown.core.UserLocation;
import io.coveytown.server.spi.IdGenerator;
import io.coveytown.server.spi.VideoProvisioningException;
import io.coveytown.server.spi.VideoTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Authoritative state of one town: its roster, sessions, conversation areas and listeners.
 *
 * <p>Every public operation runs under a single per-town lock, including the video provisioning
 * call made by {@link #join(Player)}, so no operation ever observes another one half done.
 * Listeners are notified synchronously before the triggering operation returns.
 *
 * <p>Use {@link #builder(String, VideoTokenProvider)} to create instances:
 * <pre>{@code
 * TownState town = TownState.builder("Lobby", videoProvider)
 *     .publiclyListed(true)
 *     .idGenerator(new NanoIdGenerator())
 *     .build();
 * PlayerSession session = town.join(new Player(playerId, "alice"));
 * }</pre>
 */
public final class TownState {

    private static final Logger LOGGER = LoggerFactory.getLogger(TownState.class);

    /**
     * Maximum occupancy advertised for a town unless configured otherwise.
     */
    public static final int DEFAULT_CAPACITY = 50;

    private final ReentrantLock lock = new ReentrantLock();

    private final String townId;
    private final String townUpdatePassword;
    private final int capacity;
    private final VideoTokenProvider videoClient;
    private final IdGenerator ids;

    private final List<Player> players = new ArrayList<>();
    private final Map<String, PlayerSession> sessions = new LinkedHashMap<>();
    private final Set<String> issuedTokens = new HashSet<>();
    private final ConversationAreaIndex conversationAreas = new ConversationAreaIndex();
    private final TownListeners listeners;

    private volatile String friendlyName;
    private volatile boolean publiclyListed;

    /**
     * Creates a new builder.
     *
     * @param friendlyName display name of the town (required)
     * @param videoClient provider of video tokens for joining players (required)
     */
    public static Builder builder(String friendlyName, VideoTokenProvider videoClient) {
        return new Builder(friendlyName, videoClient);
    }

    private TownState(Builder builder) {
        this.friendlyName = Objects.requireNonNull(builder.friendlyName, "friendlyName");
        this.videoClient = Objects.requireNonNull(builder.videoClient, "videoClient");
        this.ids = builder.ids != null ? builder.ids : new NanoIdGenerator();
        this.townId = builder.townId != null ? builder.townId : ids.townId();
        this.townUpdatePassword = ids.townUpdatePassword();
        this.capacity = builder.capacity > 0 ? builder.capacity : DEFAULT_CAPACITY;
        this.publiclyListed = builder.publiclyListed;
        this.listeners = new TownListeners(townId);
    }

    public String townId() {
        return townId;
    }

    public String townUpdatePassword() {
        return townUpdatePassword;
    }

    public String friendlyName() {
        return friendlyName;
    }

    public void friendlyName(String friendlyName) {
        this.friendlyName = Objects.requireNonNull(friendlyName, "friendlyName");
    }

    public boolean isPubliclyListed() {
        return publiclyListed;
    }

    public void publiclyListed(boolean publiclyListed) {
        this.publiclyListed = publiclyListed;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Number of subscribed listeners, used as the count of connected clients.
     */
    public int occupancy() {
        return listeners.size();
    }

    public List<Player> players() {
        lock.lock();
        try {
            return List.copyOf(players);
        } finally {
            lock.unlock();
        }
    }

    public List<ConversationArea> conversationAreas() {
        lock.lock();
        try {
            return conversationAreas.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Admits a player, provisioning its session token and video credential.
     *
     * <p>Nothing is committed unless provisioning succeeds.
     *
     * @param newPlayer the player to add; no player with the same id may already be in this town
     * @return the new session
     * @throws VideoProvisioningException if the video provider cannot issue a token
     */
    public PlayerSession join(Player newPlayer) throws VideoProvisioningException {
        Objects.requireNonNull(newPlayer, "newPlayer");
        lock.lock();
        try {
            if (hasPlayerId(newPlayer.id())) {
                throw new IllegalArgumentException(newPlayer + " already joined town " + townId);
            }
            String sessionToken = nextSessionToken();
            String videoToken = videoClient.getTokenForTown(townId, newPlayer.id());
            PlayerSession session = new PlayerSession(newPlayer, sessionToken, videoToken);

            issuedTokens.add(sessionToken);
            players.add(newPlayer);
            sessions.put(sessionToken, session);
            LOGGER.debug("Player {} joined town {}", newPlayer.id(), townId);

            listeners.broadcast("playerJoined", l -> l.onPlayerJoined(newPlayer));
            return session;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fetch a live session by its token.
     *
     * @return the session, or empty if the token is unknown or its session was destroyed
     */
    public Optional<PlayerSession> getSessionByToken(String token) {
        if (token == null) return Optional.empty();
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(token));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the session's player from the town and from its conversation area.
     *
     * <p>Sessions that are no longer live are ignored.
     */
    public void destroySession(PlayerSession session) {
        Objects.requireNonNull(session, "session");
        lock.lock();
        try {
            if (sessions.get(session.sessionToken()) != session) {
                LOGGER.debug("Ignoring destroy of stale session in town {}", townId);
                return;
            }
            Player player = session.player();
            players.removeIf(p -> p == player);
            ConversationArea area = player.activeConversationArea();
            if (area != null) {
                leaveConversationArea(player, area);
            }
            sessions.remove(session.sessionToken());
            LOGGER.debug("Player {} left town {}", player.id(), townId);

            listeners.broadcast("playerDisconnected", l -> l.onPlayerDisconnected(player));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a player's new location and updates conversation membership.
     *
     * <p>Membership follows the conversation label reported in {@code location}: a label naming an
     * active area puts the player in that area wherever it stands; no label (or an unknown one)
     * takes the player out of any area. Each area whose occupants change produces one
     * {@link TownListener#onConversationAreaUpdated}, or {@link TownListener#onConversationAreaDestroyed}
     * if the change left it empty.
     *
     * @throws CoveyTownException.UnknownPlayer if the player is not in this town
     */
    public void updatePlayerLocation(Player player, UserLocation location) {
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(location, "location");
        lock.lock();
        try {
            if (!isMember(player)) {
                throw new CoveyTownException.UnknownPlayer(player.id());
            }
            ConversationArea previous = player.activeConversationArea();
            ConversationArea next = location.conversationLabel().flatMap(conversationAreas::find).orElse(null);

            player.updateLocation(location);
            if (previous != null && previous != next) {
                leaveConversationArea(player, previous);
            }
            if (next != null) {
                enterConversationArea(player, next);
            }

            listeners.broadcast("playerMoved", l -> l.onPlayerMoved(player));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Activates a conversation area and pulls in every unattached player standing inside it.
     *
     * <p>Players strictly inside the new area who already occupy another conversation area stay
     * where they are; a player is never in more than one area.
     *
     * @param candidate area to add; its label and topic must be non-empty, its bounding box
     *                  well formed, its label unused and its region clear of every active area
     * @return true if the area was added, false if it was rejected (nothing changes)
     */
    public boolean addConversationArea(ConversationArea candidate) {
        Objects.requireNonNull(candidate, "candidate");
        lock.lock();
        try {
            Optional<String> rejection = conversationAreas.rejectionReason(candidate);
            if (rejection.isPresent()) {
                LOGGER.debug("Rejected conversation area {} in town {}: {}", candidate.label(), townId, rejection.get());
                return false;
            }
            conversationAreas.add(candidate);
            for (Player player : players) {
                if (player.activeConversationArea() == null && candidate.boundingBox().contains(player.location())) {
                    player.activeConversationArea(candidate);
                    candidate.addOccupant(player.id());
                }
            }
            LOGGER.debug("Created conversation area {} in town {} with {} occupant(s)",
                    candidate.label(), townId, candidate.occupantsById().size());

            listeners.broadcast("conversationAreaUpdated", l -> l.onConversationAreaUpdated(candidate));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Subscribe to events from this town. Adding a listener that is already subscribed is a no-op.
     */
    public void addTownListener(TownListener listener) {
        listeners.add(listener);
    }

    /**
     * Unsubscribe from events in this town. Takes effect immediately, including for a broadcast
     * that is currently being delivered. No-op for unknown listeners.
     */
    public void removeTownListener(TownListener listener) {
        listeners.remove(listener);
    }

    /**
     * Tells every listener the town is closing. The roster is left untouched; transports are
     * expected to drop their connections in response.
     */
    public void disconnectAllPlayers() {
        lock.lock();
        try {
            LOGGER.debug("Closing town {}", townId);
            listeners.broadcast("townDestroyed", TownListener::onTownDestroyed);
        } finally {
            lock.unlock();
        }
    }

    private void enterConversationArea(Player player, ConversationArea area) {
        player.activeConversationArea(area);
        if (area.addOccupant(player.id())) {
            listeners.broadcast("conversationAreaUpdated", l -> l.onConversationAreaUpdated(area));
        }
    }

    private void leaveConversationArea(Player player, ConversationArea area) {
        player.activeConversationArea(null);
        if (!area.removeOccupant(player.id())) {
            return;
        }
        if (area.isEmpty()) {
            conversationAreas.remove(area);
            LOGGER.debug("Conversation area {} in town {} ended", area.label(), townId);
            listeners.broadcast("conversationAreaDestroyed", l -> l.onConversationAreaDestroyed(area));
        } else {
            listeners.broadcast("conversationAreaUpdated", l -> l.onConversationAreaUpdated(area));
        }
    }

    private boolean isMember(Player player) {
        for (Player p : players) {
            if (p == player) return true;
        }
        return false;
    }

    private boolean hasPlayerId(String playerId) {
        for (Player p : players) {
            if (p.id().equals(playerId)) return true;
        }
        return false;
    }

    private String nextSessionToken() {
        String token = ids.sessionToken();
        while (issuedTokens.contains(token)) {
            token = ids.sessionToken();
        }
        return token;
    }

    /**
     * Builder for {@link TownState}.
     */
    public static final class Builder {
        private final String friendlyName;
        private final VideoTokenProvider videoClient;
        private boolean publiclyListed;
        private String townId;
        private int capacity;
        private IdGenerator ids;

        private Builder(String friendlyName, VideoTokenProvider videoClient) {
            this.friendlyName = friendlyName;
            this.videoClient = videoClient;
        }

        public Builder publiclyListed(boolean publiclyListed) {
            this.publiclyListed = publiclyListed;
            return this;
        }

        /**
         * Uses a fixed town id instead of generating one.
         */
        public Builder townId(String townId) {
            this.townId = townId;
            return this;
        }

        /**
         * Advertised maximum occupancy. Defaults to {@link #DEFAULT_CAPACITY}.
         */
        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        /**
         * Source of ids, passwords and session tokens. Defaults to {@link NanoIdGenerator}.
         */
        public Builder idGenerator(IdGenerator ids) {
            this.ids = ids;
            return this;
        }

        public TownState build() {
            return new TownState(this);
        }
    }
}
