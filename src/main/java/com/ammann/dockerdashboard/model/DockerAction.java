/* (C)2026 */
package com.ammann.dockerdashboard.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Commands the dashboard can dispatch against a selected record.
 *
 * <p>Every action declares the record kinds it can target. Image actions ({@code run},
 * {@code rmi}) only accept image selections, lifecycle actions only accept containers.
 */
public enum DockerAction {
    RUN(RiskLevel.SAFE, EnumSet.of(SelectionKind.IMAGE)),
    START(RiskLevel.SAFE, EnumSet.of(SelectionKind.CONTAINER)),
    STOP(RiskLevel.SAFE, EnumSet.of(SelectionKind.CONTAINER)),
    RESTART(RiskLevel.SAFE, EnumSet.of(SelectionKind.CONTAINER)),
    LOGS(RiskLevel.SAFE, EnumSet.of(SelectionKind.CONTAINER)),
    RM(RiskLevel.DANGER, EnumSet.of(SelectionKind.CONTAINER)),
    RMI(RiskLevel.DANGER, EnumSet.of(SelectionKind.IMAGE));

    private final RiskLevel risk;
    private final Set<SelectionKind> supportedKinds;

    DockerAction(RiskLevel risk, Set<SelectionKind> supportedKinds) {
        this.risk = risk;
        this.supportedKinds = supportedKinds;
    }

    public RiskLevel risk() {
        return risk;
    }

    public boolean isDangerous() {
        return risk == RiskLevel.DANGER;
    }

    /** All actions currently dispatch a command against a concrete target. */
    public boolean requiresTarget() {
        return true;
    }

    /**
     * Determines whether the action may be applied to a record of the given kind.
     *
     * @param kind the kind of the selected record, may be {@code null}
     * @return {@code true} if the kind belongs to the action's target family
     */
    public boolean supports(SelectionKind kind) {
        return kind != null && supportedKinds.contains(kind);
    }

    /** Returns the command verb, e.g. {@code "rmi"}. */
    public String command() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up an action by its command verb.
     *
     * @param command the verb, case-insensitive
     * @return the matching action, or empty if the verb is unknown
     */
    public static Optional<DockerAction> fromCommand(String command) {
        if (command == null) {
            return Optional.empty();
        }
        String normalized = command.trim().toUpperCase(Locale.ROOT);
        for (DockerAction action : values()) {
            if (action.name().equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
