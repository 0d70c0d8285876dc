package io.coveytown.server.core;

import io.coveytown.core.BoundingBox;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Active conversation areas of one town. Not thread-safe; guarded by the town's lock.
 *
 * <p>Invariants: labels are unique and no two areas overlap.
 */
final class ConversationAreaIndex {

    private final List<ConversationArea> areas = new ArrayList<>();

    Optional<ConversationArea> find(String label) {
        for (ConversationArea area : areas) {
            if (area.label().equals(label)) return Optional.of(area);
        }
        return Optional.empty();
    }

    /**
     * Why {@code candidate} cannot be added, or empty if it can.
     */
    Optional<String> rejectionReason(ConversationArea candidate) {
        if (isEmpty(candidate.label())) return Optional.of("missing label");
        if (isEmpty(candidate.topic())) return Optional.of("missing topic");
        BoundingBox box = candidate.boundingBox();
        if (box == null || !box.isWellFormed()) return Optional.of("malformed bounding box " + box);
        for (ConversationArea existing : areas) {
            if (existing == candidate) return Optional.of("area is already active");
            if (existing.label().equals(candidate.label())) {
                return Optional.of("label already in use");
            }
            if (existing.boundingBox().overlaps(box)) {
                return Optional.of("overlaps area " + existing.label());
            }
        }
        return Optional.empty();
    }

    void add(ConversationArea area) {
        areas.add(area);
    }

    boolean remove(ConversationArea area) {
        return areas.removeIf(a -> a == area);
    }

    List<ConversationArea> snapshot() {
        return List.copyOf(areas);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
