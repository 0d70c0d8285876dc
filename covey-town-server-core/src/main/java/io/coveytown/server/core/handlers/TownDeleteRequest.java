package io.coveytown.server.core.handlers;

public record TownDeleteRequest(String coveyTownID, String coveyTownPassword) {
}
