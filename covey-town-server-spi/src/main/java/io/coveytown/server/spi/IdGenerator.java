package io.coveytown.server.spi;

/**
 * Source of the identifiers and secrets a town hands out.
 *
 * <p>Injected into towns and registries so tests can substitute deterministic values.
 * Session tokens and update passwords must be unguessable; ids only need to be unique.
 */
public interface IdGenerator {

    /**
     * Short, human-friendly town id.
     */
    String townId();

    /**
     * Secret required to update or delete a town.
     */
    String townUpdatePassword();

    /**
     * Opaque bearer token for a new session. Never returns a value returned before.
     */
    String sessionToken();

    /**
     * Unique id for a new player.
     */
    String playerId();
}
