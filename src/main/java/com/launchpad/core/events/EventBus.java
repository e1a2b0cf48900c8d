package com.launchpad.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans out {@link LaunchEvent}s as the state machine records them.
 * <p>
 * A listener either watches one launch (the CLI's live progress view) or every launch.
 * Listeners run on the publishing thread, in registration order; one that throws is logged
 * and skipped, and the run carries on.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<LaunchEvent>>> watchersByLaunch = new ConcurrentHashMap<>();
    private final List<Consumer<LaunchEvent>> allLaunchWatchers = new CopyOnWriteArrayList<>();

    public void publish(LaunchEvent event) {
        log.debug("{} on launch {}", event.eventType(), event.launchId());

        List<Consumer<LaunchEvent>> watchers = watchersByLaunch.get(event.launchId());
        if (watchers != null) {
            watchers.forEach(watcher -> notify(watcher, event));
        }
        allLaunchWatchers.forEach(watcher -> notify(watcher, event));
    }

    /**
     * Watches a single launch until the returned subscription is closed. Closing the last
     * watcher of a launch drops its entry.
     */
    public Subscription subscribe(String launchId, Consumer<LaunchEvent> watcher) {
        watchersByLaunch.computeIfAbsent(launchId, id -> new CopyOnWriteArrayList<>()).add(watcher);
        log.debug("Watching launch {}", launchId);
        return () -> watchersByLaunch.computeIfPresent(launchId, (id, watchers) -> {
            watchers.remove(watcher);
            return watchers.isEmpty() ? null : watchers;
        });
    }

    public Subscription subscribeAll(Consumer<LaunchEvent> watcher) {
        allLaunchWatchers.add(watcher);
        return () -> allLaunchWatchers.remove(watcher);
    }

    int watcherCount(String launchId) {
        List<Consumer<LaunchEvent>> watchers = watchersByLaunch.get(launchId);
        return watchers == null ? 0 : watchers.size();
    }

    /**
     * Closeable handle returned by the subscribe methods; usable in try-with-resources.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private static void notify(Consumer<LaunchEvent> watcher, LaunchEvent event) {
        try {
            watcher.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for launch {}: {}",
                    event.eventType(), event.launchId(), e.getMessage(), e);
        }
    }
}
