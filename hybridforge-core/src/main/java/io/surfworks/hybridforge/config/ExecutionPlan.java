package io.surfworks.hybridforge.config;

import io.surfworks.hybridforge.stage.Location;
import io.surfworks.hybridforge.stage.Stage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable per-run plan: where each remote-eligible stage runs, plus the
 * paths, SSH settings and commands the run needs.
 *
 * <p>Plans are normally loaded with {@link ExecutionPlanLoader}; the
 * {@code withX} methods exist for tests and programmatic callers.
 *
 * @param locations location of each remote-eligible stage
 * @param paths     artifact paths and remote working directory
 * @param ssh       remote host settings (null when no stage is remote)
 * @param commands  stage process launch settings
 */
public record ExecutionPlan(
        Map<Stage, Location> locations,
        PathTable paths,
        SshConfig ssh,
        CommandConfig commands
) {

    public ExecutionPlan {
        Objects.requireNonNull(locations, "locations cannot be null");
        Objects.requireNonNull(paths, "paths cannot be null");
        commands = commands == null ? CommandConfig.defaults() : commands;

        EnumMap<Stage, Location> copy = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.remoteEligible()) {
            Location location = locations.get(stage);
            if (location == null) {
                throw new IllegalArgumentException("No location for stage " + stage.reportName());
            }
            copy.put(stage, location);
        }
        for (Stage stage : locations.keySet()) {
            if (!stage.isRemoteEligible()) {
                throw new IllegalArgumentException("Stage " + stage.reportName() + " always runs locally");
            }
        }
        locations = Collections.unmodifiableMap(copy);

        if (copy.containsValue(Location.REMOTE)) {
            if (ssh == null) {
                throw new IllegalArgumentException("ssh settings are required when a stage runs remotely");
            }
            if (paths.remoteWorkdir() == null) {
                throw new IllegalArgumentException("remote_workdir is required when a stage runs remotely");
            }
        }
    }

    /**
     * Creates a plan that runs every stage locally.
     */
    public static ExecutionPlan allLocal(PathTable paths, CommandConfig commands) {
        EnumMap<Stage, Location> locations = new EnumMap<>(Stage.class);
        Stage.remoteEligible().forEach(stage -> locations.put(stage, Location.LOCAL));
        return new ExecutionPlan(locations, paths, null, commands);
    }

    /**
     * Returns where the given stage runs; pre-stages are always local.
     */
    public Location locationOf(Stage stage) {
        return stage.isRemoteEligible() ? locations.get(stage) : Location.LOCAL;
    }

    /**
     * Returns true if at least one stage runs on the remote host.
     */
    public boolean requiresRemote() {
        return locations.containsValue(Location.REMOTE);
    }

    /**
     * Returns a new plan with one stage moved to the given location.
     */
    public ExecutionPlan with(Stage stage, Location location) {
        EnumMap<Stage, Location> updated = new EnumMap<>(locations);
        updated.put(stage, location);
        return new ExecutionPlan(updated, paths, ssh, commands);
    }

    /**
     * Returns a new plan with the specified SSH settings.
     */
    public ExecutionPlan withSsh(SshConfig sshConfig) {
        return new ExecutionPlan(locations, paths, sshConfig, commands);
    }
}
