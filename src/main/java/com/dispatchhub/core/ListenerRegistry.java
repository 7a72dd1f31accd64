package com.dispatchhub.core;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Typed list of listeners for one event kind.
 *
 * <p>Events are delivered synchronously on the publishing thread, in registration order,
 * once per registered listener. A listener that throws is logged and skipped; it never
 * prevents delivery to the remaining listeners or disturbs the publisher.</p>
 *
 * <p><b>Thread Safety:</b> Backed by a {@link CopyOnWriteArrayList}, so listeners may
 * subscribe or unsubscribe while an event is being published.</p>
 *
 * @param <T> the event payload type
 */
public class ListenerRegistry<T> {
    private static final Logger logger = Logger.getLogger(ListenerRegistry.class.getName());

    private final String eventName;
    private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param eventName name used in log messages when a listener fails
     */
    public ListenerRegistry(String eventName) {
        this.eventName = eventName;
    }

    /**
     * Register a listener.
     *
     * @param listener callback invoked for every published event
     * @return subscription that removes this registration
     */
    public Subscription subscribe(Consumer<? super T> listener) {
        if (listener == null) {
            throw new NullPointerException("listener");
        }
        // Wrap so the same callback registered twice gets two independent subscriptions
        Consumer<? super T> registration = listener::accept;
        listeners.add(registration);
        return () -> listeners.remove(registration);
    }

    /**
     * Deliver an event to every registered listener.
     */
    public void publish(T event) {
        for (Consumer<? super T> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Listener for " + eventName + " threw", e);
            }
        }
    }
}
