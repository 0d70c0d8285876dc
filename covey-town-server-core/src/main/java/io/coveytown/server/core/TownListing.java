package io.coveytown.server.core;

import java.util.Objects;

/**
 * Public summary of a town, as shown in the town directory.
 *
 * @param friendlyName display name
 * @param coveyTownID town id
 * @param currentOccupancy connected clients
 * @param maximumOccupancy advertised capacity
 */
public record TownListing(String friendlyName, String coveyTownID, int currentOccupancy, int maximumOccupancy) {
    public TownListing {
        Objects.requireNonNull(friendlyName, "friendlyName");
        Objects.requireNonNull(coveyTownID, "coveyTownID");
    }

    static TownListing of(TownState town) {
        return new TownListing(town.friendlyName(), town.townId(), town.occupancy(), town.capacity());
    }
}
