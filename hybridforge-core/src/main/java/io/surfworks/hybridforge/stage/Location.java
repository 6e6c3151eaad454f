package io.surfworks.hybridforge.stage;

import java.util.Locale;

/**
 * Where a stage runs.
 */
public enum Location {

    LOCAL,
    REMOTE;

    /**
     * Returns the tag used in configuration files and timing reports.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a location tag ({@code "local"} or {@code "remote"}, case-insensitive).
     *
     * @throws IllegalArgumentException if the tag is not recognized
     */
    public static Location fromTag(String tag) {
        if (tag != null) {
            for (Location location : values()) {
                if (location.tag().equalsIgnoreCase(tag.trim())) {
                    return location;
                }
            }
        }
        throw new IllegalArgumentException("Unknown location: " + tag + " (expected 'local' or 'remote')");
    }
}
