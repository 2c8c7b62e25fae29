package org.Aayush.alns.acceptance;

import java.util.Locale;

/**
 * Budget that drives threshold decay in {@link LinearRecordToRecordTravel}.
 */
public enum MainTerminationCriterion {
    ITERATIONS("iterations"),
    TIME("time");

    private final String configName;

    MainTerminationCriterion(String configName) {
        this.configName = configName;
    }

    /**
     * @return lower-case name used in JSON configuration.
     */
    public String configName() {
        return configName;
    }

    /**
     * Resolves a configuration name, case-insensitively.
     *
     * @return matching criterion, or null when the name is unknown.
     */
    public static MainTerminationCriterion fromConfigName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (MainTerminationCriterion criterion : values()) {
            if (criterion.configName.equals(normalized)) {
                return criterion;
            }
        }
        return null;
    }
}
