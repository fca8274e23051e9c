package com.dcruver.zettel.watch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds back changed paths until they stop changing.
 *
 * Each path is released once no event has arrived for it during a full
 * quiescence window; a new event for a pending path restarts its window.
 * Paths that are due together are released as one batch, in the order they
 * first arrived. Not thread-safe: owned by the watcher thread.
 */
public class ChangeDebouncer {

    private final long windowMillis;
    // Path to the time of its latest event
    private final Map<Path, Long> pending = new LinkedHashMap<>();

    public ChangeDebouncer(long windowMillis) {
        this.windowMillis = windowMillis;
    }

    public void offer(Path path, long nowMillis) {
        pending.put(path, nowMillis);
    }

    public boolean isAccumulating() {
        return !pending.isEmpty();
    }

    /**
     * Milliseconds until the next path becomes quiet; 0 when idle or overdue
     */
    public long remainingMillis(long nowMillis) {
        long remaining = Long.MAX_VALUE;
        for (long lastEvent : pending.values()) {
            remaining = Math.min(remaining, lastEvent + windowMillis - nowMillis);
        }
        return pending.isEmpty() ? 0 : Math.max(0, remaining);
    }

    /**
     * The paths that have been quiet for a full window; never an empty batch
     */
    public Optional<List<Path>> drainIfDue(long nowMillis) {
        List<Path> batch = new ArrayList<>();
        Iterator<Map.Entry<Path, Long>> it = pending.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Path, Long> entry = it.next();
            if (nowMillis - entry.getValue() >= windowMillis) {
                batch.add(entry.getKey());
                it.remove();
            }
        }
        return batch.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(batch));
    }
}
