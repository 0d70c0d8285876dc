package io.coveytown.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Subscriber list of one town and its fan-out.
 *
 * <p>Each broadcast walks a snapshot in registration order. A listener removed while a broadcast
 * is running is skipped for the rest of it; a listener that throws is logged and the remaining
 * listeners are still notified.
 */
final class TownListeners {

    private static final Logger LOGGER = LoggerFactory.getLogger(TownListeners.class);

    private final List<TownListener> listeners = new CopyOnWriteArrayList<>();
    private final String townId;

    TownListeners(String townId) {
        this.townId = townId;
    }

    /**
     * @return false if the listener was already subscribed
     */
    boolean add(TownListener listener) {
        Objects.requireNonNull(listener, "listener");
        synchronized (listeners) {
            if (isSubscribed(listener)) return false;
            listeners.add(listener);
            return true;
        }
    }

    boolean remove(TownListener listener) {
        synchronized (listeners) {
            return listeners.removeIf(l -> l == listener);
        }
    }

    int size() {
        return listeners.size();
    }

    void broadcast(String event, Consumer<TownListener> delivery) {
        for (TownListener listener : listeners) {
            if (!isSubscribed(listener)) continue;
            try {
                delivery.accept(listener);
            } catch (RuntimeException e) {
                LOGGER.warn("Listener {} failed handling {} in town {}", listener, event, townId, e);
            }
        }
    }

    private boolean isSubscribed(TownListener listener) {
        for (TownListener l : listeners) {
            if (l == listener) return true;
        }
        return false;
    }
}
