package io.coveytown.server.core.handlers;

/**
 * @param coveyTownID id of the new town
 * @param coveyTownPassword secret needed to update or delete it
 */
public record TownCreateResponse(String coveyTownID, String coveyTownPassword) {
}
