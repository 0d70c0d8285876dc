package io.coveytown.server.core.handlers;

/**
 * @param userName name the player wants to be shown as
 * @param coveyTownID town to join
 */
public record TownJoinRequest(String userName, String coveyTownID) {
}
