/* (C)2026 */
package com.ammann.dockerdashboard.service;

import com.ammann.dockerdashboard.dto.ContainerRecord;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Caches which containers of a listing are running.
 *
 * <p>The cache is keyed on the <em>identity</em> of the list passed to {@link #ensure(List)},
 * not its contents. A classification is reused when the same list instance is passed again
 * within the TTL. Consequently callers must either pass a new list whenever container
 * statuses change, or call {@link #clear()} after changing statuses in place; otherwise the
 * old classification is served until the TTL runs out.
 *
 * <p>Expiry is evaluated against the injected {@link Clock} on each call; there is no
 * background timer. Not thread-safe: the dashboard refresh loop is single-threaded.
 */
public class RunningSetCache {

    private final Clock clock;
    private final Duration ttl;

    private List<ContainerRecord> source;
    private long computedAtMillis;
    private Set<String> runningIds = Set.of();

    /**
     * Creates an empty cache.
     *
     * @param clock the time source for expiry checks
     * @param ttl   how long a classification may be reused for the same list instance
     */
    public RunningSetCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Returns the ids of the running containers in {@code items}, reclassifying unless the
     * cached result belongs to this very list instance and is younger than the TTL.
     *
     * @param items the container listing
     * @return an unmodifiable set of running container ids
     */
    public Set<String> ensure(List<ContainerRecord> items) {
        long now = clock.millis();
        boolean fresh = now - computedAtMillis < ttl.toMillis();
        if (fresh && source == items) {
            return runningIds;
        }

        Set<String> running = new HashSet<>();
        for (ContainerRecord item : items) {
            if (item.isRunning()) {
                running.add(item.id());
            }
        }

        runningIds = Collections.unmodifiableSet(running);
        source = items;
        computedAtMillis = now;
        return runningIds;
    }

    /**
     * Returns whether the container was running at the last classification.
     *
     * @param containerId the container id
     * @return {@code true} if the id is in the cached running set
     */
    public boolean isRunning(String containerId) {
        return runningIds.contains(containerId);
    }

    /** Drops the cached classification; the next {@link #ensure(List)} always recomputes. */
    public void clear() {
        runningIds = Set.of();
        source = null;
        computedAtMillis = 0;
    }
}
