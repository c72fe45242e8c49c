package io.github.byzatic.crontimestamps.cron_expression;

/**
 * How the day of month and day of week constraints of one expression combine.
 */
public enum DayMatchMode {
    /** Either field matching is enough. */
    UNION,
    /** Both fields must match. */
    INTERSECT
}
