package io.coveytown.server.core;

import io.coveytown.core.BoundingBox;

import java.util.ArrayList;
import java.util.List;

/**
 * A labelled rectangular region; the players inside it form one conversation.
 *
 * <p>Instances are created by callers as candidates and handed to
 * {@link TownState#addConversationArea(ConversationArea)}, which validates them. The occupant list
 * starts empty and is maintained by the town; it keeps join order.
 */
public final class ConversationArea {

    private final String label;
    private volatile String topic;
    private final BoundingBox boundingBox;
    private final List<String> occupantsById = new ArrayList<>();

    /**
     * @param label unique label within the town; an empty or null label is rejected on creation
     * @param topic display topic; an empty or null topic is rejected on creation
     * @param boundingBox region of the area; a null or malformed box is rejected on creation
     */
    public ConversationArea(String label, String topic, BoundingBox boundingBox) {
        this.label = label;
        this.topic = topic;
        this.boundingBox = boundingBox;
    }

    public String label() {
        return label;
    }

    public String topic() {
        return topic;
    }

    /**
     * Changes the display topic of this area.
     *
     * @throws IllegalArgumentException if {@code topic} is null or empty
     */
    public void topic(String topic) {
        if (topic == null || topic.isEmpty()) {
            throw new IllegalArgumentException("topic must not be empty");
        }
        this.topic = topic;
    }

    public BoundingBox boundingBox() {
        return boundingBox;
    }

    /**
     * Snapshot of the occupant ids, in the order they entered.
     */
    public synchronized List<String> occupantsById() {
        return List.copyOf(occupantsById);
    }

    synchronized boolean addOccupant(String playerId) {
        if (occupantsById.contains(playerId)) return false;
        return occupantsById.add(playerId);
    }

    synchronized boolean removeOccupant(String playerId) {
        return occupantsById.remove(playerId);
    }

    synchronized boolean isEmpty() {
        return occupantsById.isEmpty();
    }

    @Override
    public String toString() {
        return "ConversationArea{label=" + label + ", topic=" + topic + ", boundingBox=" + boundingBox + '}';
    }
}
