package com.blockscope.indexer.feed;

import com.blockscope.domain.ChainEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe feed for chain events. Delivery is synchronous on the publishing thread,
 * to the subscribers registered at publish time. Nothing is persisted.
 */
@Slf4j
@Component
public class ChainEventFeed {

    private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();

    public <E extends ChainEvent> Subscription subscribe(Class<E> type, Consumer<? super E> handler) {
        Registration<E> registration = new Registration<>(type, handler);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    /**
     * Delivers to every matching subscriber. A failing handler is logged and does not stop delivery to the rest.
     */
    public void publish(ChainEvent event) {
        for (Registration<?> r : registrations) {
            try {
                r.deliver(event);
            } catch (RuntimeException e) {
                log.warn("Chain event handler failed for {}: {}", event, e.getMessage(), e);
            }
        }
    }

    public int subscriberCount() {
        return registrations.size();
    }

    /** Handle returned by subscribe; cancel is idempotent. */
    @FunctionalInterface
    public interface Subscription {
        void cancel();
    }

    private record Registration<E extends ChainEvent>(Class<E> type, Consumer<? super E> handler) {
        void deliver(ChainEvent event) {
            if (type.isInstance(event)) {
                handler.accept(type.cast(event));
            }
        }
    }
}
