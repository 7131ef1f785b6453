/* (C)2026 */
package com.ammann.dockerdashboard.service;

import com.ammann.dockerdashboard.config.DashboardConfig;
import com.ammann.dockerdashboard.dto.ComposeRecord;
import com.ammann.dockerdashboard.dto.ContainerRecord;
import com.ammann.dockerdashboard.dto.FilterState;
import com.ammann.dockerdashboard.dto.ImageRecord;
import com.ammann.dockerdashboard.dto.StatRecord;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Applies the dashboard search and state filters to the record lists.
 *
 * <p>The search is a case-insensitive substring match over the fields shown for each kind.
 * Container state filtering goes through a {@link RunningSetCache} owned by this bean, so
 * repeated filtering of the same listing (e.g. while typing a search) does not reclassify
 * every container.
 */
@ApplicationScoped
public class RecordFilter {

    @Inject DashboardConfig config;

    @Inject Clock clock;

    @Inject Logger logger;

    RunningSetCache runningCache;

    @PostConstruct
    void init() {
        runningCache = new RunningSetCache(clock, config.runningCache().ttl());
        logger.debugf(
                "Running-set cache initialised with TTL of %d ms",
                config.runningCache().ttlMillis());
    }

    /**
     * Filters containers by search text over name, id, status and ports, then by state.
     *
     * @param items   the full container listing
     * @param filters the active filters
     * @return the matching containers in listing order
     */
    public List<ContainerRecord> filterContainers(List<ContainerRecord> items, FilterState filters) {
        Set<String> running = runningCache.ensure(items);
        String search = filters.normalizedSearch();

        return items.stream()
                .filter(
                        item ->
                                matches(search, item.name(), item.id(), item.status(), item.ports()))
                .filter(
                        item ->
                                switch (filters.status()) {
                                    case RUNNING -> running.contains(item.id());
                                    case EXITED -> !running.contains(item.id());
                                    case ALL -> true;
                                })
                .toList();
    }

    /**
     * Filters images by search text over repository, tag and id.
     *
     * @param items   the full image listing
     * @param filters the active filters; the state filter does not apply to images
     * @return the matching images in listing order
     */
    public List<ImageRecord> filterImages(List<ImageRecord> items, FilterState filters) {
        String search = filters.normalizedSearch();
        return items.stream()
                .filter(item -> matches(search, item.repository(), item.tag(), item.id()))
                .toList();
    }

    public List<StatRecord> filterStats(List<StatRecord> items, FilterState filters) {
        String search = filters.normalizedSearch();
        return items.stream().filter(item -> matches(search, item.name())).toList();
    }

    public List<ComposeRecord> filterCompose(List<ComposeRecord> items, FilterState filters) {
        String search = filters.normalizedSearch();
        return items.stream()
                .filter(item -> matches(search, item.name(), item.status(), item.configFiles()))
                .toList();
    }

    /**
     * Forgets the cached running classification. Call this whenever container statuses may
     * have changed without a new listing instance, e.g. after a fresh {@code ps} result.
     */
    public void clearRunningCache() {
        runningCache.clear();
    }

    private static boolean matches(String search, String... fields) {
        if (search.isEmpty()) {
            return true;
        }
        for (String field : fields) {
            if (field != null && field.toLowerCase(Locale.ROOT).contains(search)) {
                return true;
            }
        }
        return false;
    }
}
