package com.launchpad.core.registry;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, immutable table of the handlers a launch runs. The list order is the authoritative
 * execution order across all phases.
 */
public final class HandlerRegistry {

    private final List<HandlerSpec> handlers;

    public HandlerRegistry(List<HandlerSpec> handlers) {
        if (handlers == null || handlers.isEmpty()) {
            throw new IllegalArgumentException("Handler registry needs at least one handler");
        }
        var seen = new HashSet<String>();
        for (HandlerSpec handler : handlers) {
            if (!seen.add(handler.name())) {
                throw new IllegalArgumentException("Duplicate handler name: " + handler.name());
            }
        }
        this.handlers = List.copyOf(handlers);
    }

    public static HandlerRegistry of(HandlerSpec... handlers) {
        return new HandlerRegistry(List.of(handlers));
    }

    public List<HandlerSpec> orderedHandlers() {
        return handlers;
    }

    public int size() {
        return handlers.size();
    }

    public HandlerSpec handlerAt(int index) {
        return handlers.get(index);
    }

    public Optional<HandlerSpec> find(String name) {
        return handlers.stream().filter(h -> h.name().equals(name)).findFirst();
    }

    /**
     * Registry position of the named handler, or -1 when unknown.
     */
    public int indexOf(String name) {
        for (int i = 0; i < handlers.size(); i++) {
            if (handlers.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public boolean isLast(HandlerSpec handler) {
        return handlers.get(handlers.size() - 1).name().equals(handler.name());
    }

    public Optional<HandlerSpec> next(HandlerSpec handler) {
        int index = indexOf(handler.name());
        if (index < 0 || index + 1 >= handlers.size()) {
            return Optional.empty();
        }
        return Optional.of(handlers.get(index + 1));
    }
}
