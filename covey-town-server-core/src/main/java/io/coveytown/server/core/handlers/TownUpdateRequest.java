package io.coveytown.server.core.handlers;

/**
 * @param friendlyName new name, or null to keep the current one
 * @param isPubliclyListed new visibility, or null to keep the current one
 */
public record TownUpdateRequest(String coveyTownID, String coveyTownPassword, String friendlyName, Boolean isPubliclyListed) {
}
