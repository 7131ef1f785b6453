/* (C)2026 */
package com.ammann.dockerdashboard.service;

import com.ammann.dockerdashboard.dto.ActionState;
import com.ammann.dockerdashboard.dto.DashboardSnapshot;
import com.ammann.dockerdashboard.dto.FilterState;
import com.ammann.dockerdashboard.dto.Selection;
import com.ammann.dockerdashboard.dto.SelectionEntry;
import com.ammann.dockerdashboard.model.DashboardView;
import com.ammann.dockerdashboard.model.DockerAction;
import com.ammann.dockerdashboard.model.SelectionKind;
import com.ammann.dockerdashboard.parser.TableParser;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Resolves what the user can select in the active view and what an action would target.
 *
 * <p>Entries are built from the same filtered lists the view displays, so a selection can
 * only ever point at a visible row. Targets are sanitized before they leave this class:
 * they are passed to the command runner as arguments.
 */
@ApplicationScoped
public class SelectionResolver {

    private static final String DIGEST_PREFIX = "sha256:";

    /** Characters allowed in an image target; everything else is stripped. */
    private static final Pattern DISALLOWED_TARGET_CHARS = Pattern.compile("[^a-zA-Z0-9._-]");

    static final String REASON_PENDING = "A command is already running";
    static final String REASON_UNSUPPORTED_KIND = "The selected item does not support this action";
    static final String REASON_MISSING_TARGET = "No valid target";

    @Inject RecordFilter recordFilter;

    @Inject Logger logger;

    /**
     * Lists the selectable entries of a view after applying the filters.
     *
     * @param view     the active view
     * @param snapshot the current dashboard snapshot
     * @param filters  the active filters
     * @return the entries in display order
     */
    public List<SelectionEntry> getEntries(
            DashboardView view, DashboardSnapshot snapshot, FilterState filters) {
        Objects.requireNonNull(view, "view");
        return switch (view) {
            case CONTAINERS -> recordFilter.filterContainers(snapshot.containers(), filters).stream()
                    .map(
                            item ->
                                    new SelectionEntry(
                                            SelectionKind.CONTAINER,
                                            item.id(),
                                            item.name(),
                                            item.status(),
                                            item.name()))
                    .toList();
            case IMAGES -> recordFilter.filterImages(snapshot.images(), filters).stream()
                    .map(
                            item ->
                                    new SelectionEntry(
                                            SelectionKind.IMAGE,
                                            item.id(),
                                            item.repository() + ":" + item.tag(),
                                            item.size() + " · " + item.id(),
                                            normalizeImageTarget(item.id())))
                    .toList();
            case STATS -> recordFilter.filterStats(snapshot.stats(), filters).stream()
                    .map(
                            item ->
                                    new SelectionEntry(
                                            SelectionKind.STAT,
                                            item.name(),
                                            item.name(),
                                            "CPU " + item.cpuText() + " · MEM " + item.memUsageText(),
                                            null))
                    .toList();
            case COMPOSE -> recordFilter.filterCompose(snapshot.compose(), filters).stream()
                    .map(
                            item ->
                                    new SelectionEntry(
                                            SelectionKind.COMPOSE,
                                            item.name(),
                                            item.name(),
                                            item.status(),
                                            null))
                    .toList();
        };
    }

    /**
     * Keeps the previous selection if it still names a visible entry of this view, otherwise
     * selects the first entry.
     *
     * @param view     the active view
     * @param snapshot the current dashboard snapshot
     * @param filters  the active filters
     * @param previous the selection before the refresh, may be {@code null}
     * @return the selection to show, or empty if the view has no entries
     */
    public Optional<Selection> normalizeSelection(
            DashboardView view,
            DashboardSnapshot snapshot,
            FilterState filters,
            Selection previous) {
        List<SelectionEntry> entries = getEntries(view, snapshot, filters);
        if (entries.isEmpty()) {
            return Optional.empty();
        }

        if (previous != null
                && previous.kind() == view.selectionKind()
                && entries.stream().anyMatch(entry -> entry.key().equals(previous.key()))) {
            return Optional.of(previous);
        }
        return Optional.of(entries.get(0).toSelection());
    }

    /**
     * Finds the visible entry a selection points at.
     *
     * @param view      the active view
     * @param snapshot  the current dashboard snapshot
     * @param filters   the active filters
     * @param selection the current selection, may be {@code null}
     * @return the entry, or empty if nothing visible matches
     */
    public Optional<SelectionEntry> findEntry(
            DashboardView view,
            DashboardSnapshot snapshot,
            FilterState filters,
            Selection selection) {
        if (selection == null) {
            return Optional.empty();
        }
        return getEntries(view, snapshot, filters).stream()
                .filter(
                        entry ->
                                entry.kind() == selection.kind()
                                        && entry.key().equals(selection.key()))
                .findFirst();
    }

    /**
     * Resolves the command argument for an action on the current selection.
     *
     * @param action    the requested action
     * @param view      the active view
     * @param snapshot  the current dashboard snapshot
     * @param filters   the active filters
     * @param selection the current selection, may be {@code null}
     * @return the sanitized target, or {@code null} if the selection is missing, not visible,
     *     or of a kind the action does not accept; callers disable the action in that case
     */
    public String resolveActionTarget(
            DockerAction action,
            DashboardView view,
            DashboardSnapshot snapshot,
            FilterState filters,
            Selection selection) {
        Objects.requireNonNull(action, "action");
        Optional<SelectionEntry> entry = findEntry(view, snapshot, filters, selection);
        if (entry.isEmpty()) {
            return null;
        }
        if (!action.supports(entry.get().kind())) {
            logger.debugf(
                    "Action %s does not apply to %s %s",
                    action.command(), entry.get().kind(), entry.get().key());
            return null;
        }
        return entry.get().target();
    }

    /**
     * Decides whether an action button is enabled.
     *
     * @param action        the action
     * @param selectionKind the kind of the current selection, may be {@code null}
     * @param target        the resolved target, may be {@code null}
     * @param pendingAction the label of a command still running, or {@code null}
     * @return the enabled state together with the reason when disabled
     */
    public ActionState resolveActionState(
            DockerAction action, SelectionKind selectionKind, String target, String pendingAction) {
        Objects.requireNonNull(action, "action");
        if (pendingAction != null) {
            return ActionState.disabled(REASON_PENDING, target);
        }
        if (!action.supports(selectionKind)) {
            return ActionState.disabled(REASON_UNSUPPORTED_KIND, target);
        }
        if (action.requiresTarget() && (target == null || target.isEmpty())) {
            return ActionState.disabled(REASON_MISSING_TARGET, target);
        }
        return ActionState.enabled(target);
    }

    /**
     * Turns an image id into a safe command argument.
     *
     * <p>Strips a leading {@code sha256:} and removes every character outside letters, digits,
     * {@code .}, {@code _} and {@code -}.
     *
     * @param rawId the image id as listed
     * @return the sanitized id, or {@code null} if nothing usable remains
     */
    static String normalizeImageTarget(String rawId) {
        if (rawId == null) {
            return null;
        }
        String trimmed = rawId.trim();
        if (trimmed.isEmpty() || TableParser.MISSING.equals(trimmed)) {
            return null;
        }
        String withoutDigest =
                trimmed.startsWith(DIGEST_PREFIX)
                        ? trimmed.substring(DIGEST_PREFIX.length())
                        : trimmed;
        String sanitized = DISALLOWED_TARGET_CHARS.matcher(withoutDigest).replaceAll("");
        return sanitized.isEmpty() ? null : sanitized;
    }
}
