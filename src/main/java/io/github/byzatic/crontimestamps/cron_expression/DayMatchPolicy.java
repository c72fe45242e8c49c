package io.github.byzatic.crontimestamps.cron_expression;

import io.github.byzatic.crontimestamps.base_exceptions.InvalidConfigurationException;
import org.jetbrains.annotations.NotNull;

/**
 * Rule used to pick a {@link DayMatchMode} for each expression.
 * <p>
 * See <a href="https://crontab.guru/cron-bug.html">crontab.guru/cron-bug</a> for the history behind
 * {@link #VIXIE}.
 */
public enum DayMatchPolicy {
    /** Intersect when either raw day field starts with {@code *}, union otherwise. */
    VIXIE("vixie"),
    /** Intersect when either raw day field contains a {@code *} anywhere, union otherwise. */
    CONTAINS("contains"),
    /** Always union. */
    UNION("union"),
    /** Always intersect. */
    INTERSECT("intersect");

    private final String configName;

    DayMatchPolicy(String configName) {
        this.configName = configName;
    }

    public @NotNull String configName() {
        return configName;
    }

    /**
     * Looks up a policy by its configuration name: exactly one of {@code vixie}, {@code contains},
     * {@code union}, {@code intersect}, lower case with no surrounding blanks.
     *
     * @throws InvalidConfigurationException for any other value
     */
    public static @NotNull DayMatchPolicy fromConfigName(String name) throws InvalidConfigurationException {
        for (DayMatchPolicy p : values()) {
            if (p.configName.equals(name)) return p;
        }
        throw new InvalidConfigurationException("Unknown day match mode '" + name
                + "', expected one of vixie, contains, union, intersect");
    }
}
