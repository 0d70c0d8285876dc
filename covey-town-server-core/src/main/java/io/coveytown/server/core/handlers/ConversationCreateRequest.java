package io.coveytown.server.core.handlers;

import io.coveytown.core.BoundingBox;

/**
 * Request to open a conversation area, authenticated by a session token of the same town.
 */
public record ConversationCreateRequest(
        String coveyTownID,
        String sessionToken,
        String label,
        String topic,
        BoundingBox boundingBox
) {
}
