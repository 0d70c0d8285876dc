package io.coveytown.server.core.handlers;

public record TownCreateRequest(String friendlyName, boolean isPubliclyListed) {
}
