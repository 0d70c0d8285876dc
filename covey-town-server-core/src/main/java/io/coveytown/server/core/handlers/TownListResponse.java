package io.coveytown.server.core.handlers;

import io.coveytown.server.core.TownListing;

import java.util.List;

public record TownListResponse(List<TownListing> towns) {
    public TownListResponse {
        towns = List.copyOf(towns);
    }
}
