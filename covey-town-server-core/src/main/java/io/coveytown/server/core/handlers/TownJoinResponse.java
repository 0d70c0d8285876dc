package io.coveytown.server.core.handlers;

import io.coveytown.server.core.ConversationArea;
import io.coveytown.server.core.Player;

import java.util.List;

/**
 * Everything a client needs right after joining a town.
 */
public record TownJoinResponse(
        String coveyUserID,
        String coveySessionToken,
        String providerVideoToken,
        List<Player> currentPlayers,
        String friendlyName,
        boolean isPubliclyListed,
        List<ConversationArea> conversationAreas
) {
    public TownJoinResponse {
        currentPlayers = List.copyOf(currentPlayers);
        conversationAreas = List.copyOf(conversationAreas);
    }
}
