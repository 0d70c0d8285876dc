package io.coveytown.server.spi;

/**
 * Issues video-conferencing credentials for players joining a town.
 *
 * <p>Consulted exactly once per join. Implementations usually perform network I/O and should be
 * thread-safe; towns call them while holding their own lock, never concurrently for one town.
 */
@FunctionalInterface
public interface VideoTokenProvider {

    /**
     * Obtain an access token that lets {@code playerId} join the video room of {@code townId}.
     *
     * @param townId id of the town being joined
     * @param playerId id of the joining player
     * @return an opaque access token
     * @throws VideoProvisioningException if the provider cannot issue a token
     */
    String getTokenForTown(String townId, String playerId) throws VideoProvisioningException;
}
