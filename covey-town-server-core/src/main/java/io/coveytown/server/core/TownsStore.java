package io.coveytown.server.core;

import io.coveytown.core.CoveyTownException;
import io.coveytown.server.spi.IdGenerator;
import io.coveytown.server.spi.VideoTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide registry of towns.
 *
 * <p>Owns the lifetime of every {@link TownState}: towns are created here, looked up by id for
 * transports and handlers, and removed when deleted with their update password.
 */
public final class TownsStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(TownsStore.class);

    private final Map<String, TownState> towns = new ConcurrentHashMap<>();
    private final VideoTokenProvider videoClient;
    private final IdGenerator ids;
    private final Config config;

    public TownsStore(VideoTokenProvider videoClient) {
        this(videoClient, new NanoIdGenerator(), Config.defaults());
    }

    public TownsStore(VideoTokenProvider videoClient, IdGenerator ids, Config config) {
        this.videoClient = Objects.requireNonNull(videoClient, "videoClient");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Creates and registers a town.
     *
     * @throws CoveyTownException.DuplicateTown if the configured demo town already exists
     */
    public TownState createTown(String friendlyName, boolean isPubliclyListed) {
        Objects.requireNonNull(friendlyName, "friendlyName");
        TownState.Builder builder = TownState.builder(friendlyName, videoClient)
                .publiclyListed(isPubliclyListed)
                .capacity(config.capacity())
                .idGenerator(ids);
        if (friendlyName.equals(config.demoTownId())) {
            builder.townId(friendlyName);
        }
        TownState town = builder.build();
        if (towns.putIfAbsent(town.townId(), town) != null) {
            throw new CoveyTownException.DuplicateTown(town.townId());
        }
        LOGGER.info("Created town {} ({}, public={})", town.townId(), friendlyName, isPubliclyListed);
        return town;
    }

    public Optional<TownState> getControllerForTown(String townId) {
        if (townId == null) return Optional.empty();
        return Optional.ofNullable(towns.get(townId));
    }

    /**
     * Listings of all publicly listed towns.
     */
    public List<TownListing> getTowns() {
        return towns.values().stream()
                .filter(TownState::isPubliclyListed)
                .map(TownListing::of)
                .toList();
    }

    /**
     * Renames a town and/or changes its visibility.
     *
     * @param friendlyName new name, ignored when null or empty
     * @param makePublic new visibility, ignored when null
     * @return false if the town does not exist or the password is wrong
     */
    public boolean updateTown(String townId, String townUpdatePassword, String friendlyName, Boolean makePublic) {
        Optional<TownState> found = authorized(townId, townUpdatePassword);
        if (found.isEmpty()) return false;
        TownState town = found.get();
        if (friendlyName != null && !friendlyName.isEmpty()) {
            town.friendlyName(friendlyName);
        }
        if (makePublic != null) {
            town.publiclyListed(makePublic);
        }
        return true;
    }

    /**
     * Closes and unregisters a town.
     *
     * @return false if the town does not exist or the password is wrong
     */
    public boolean deleteTown(String townId, String townUpdatePassword) {
        Optional<TownState> found = authorized(townId, townUpdatePassword);
        if (found.isEmpty()) return false;
        TownState town = found.get();
        if (!towns.remove(townId, town)) return false;
        town.disconnectAllPlayers();
        LOGGER.info("Deleted town {}", townId);
        return true;
    }

    private Optional<TownState> authorized(String townId, String password) {
        return getControllerForTown(townId)
                .filter(town -> password != null && constantTimeEquals(town.townUpdatePassword(), password));
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Registry settings.
     *
     * @param demoTownId friendly name that is also used verbatim as its town's id (may be null)
     * @param capacity advertised maximum occupancy for new towns
     */
    public record Config(String demoTownId, int capacity) {
        public Config {
            if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        }

        public static Config defaults() {
            return new Config(null, TownState.DEFAULT_CAPACITY);
        }

        /**
         * Reads {@code DEMO_TOWN_ID} from the process environment.
         */
        public static Config fromEnvironment() {
            return fromEnvironment(System.getenv());
        }

        static Config fromEnvironment(Map<String, String> env) {
            String demo = env.get("DEMO_TOWN_ID");
            return new Config(demo == null || demo.isBlank() ? null : demo, TownState.DEFAULT_CAPACITY);
        }
    }
}
