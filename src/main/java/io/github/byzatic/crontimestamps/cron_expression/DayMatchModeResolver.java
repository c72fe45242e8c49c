package io.github.byzatic.crontimestamps.cron_expression;

import org.jetbrains.annotations.NotNull;

/**
 * Decides once per expression, from the raw field text, whether its day fields union or intersect.
 * Expanded values are never consulted.
 */
public final class DayMatchModeResolver {
    private static final char WILDCARD = '*';

    private DayMatchModeResolver() {
    }

    public static @NotNull DayMatchMode resolve(@NotNull CronExpression cron, @NotNull DayMatchPolicy policy) {
        switch (policy) {
            case UNION:
                return DayMatchMode.UNION;
            case INTERSECT:
                return DayMatchMode.INTERSECT;
            case CONTAINS:
                return containsWildcard(cron.dayOfMonth()) || containsWildcard(cron.dayOfWeek())
                        ? DayMatchMode.INTERSECT
                        : DayMatchMode.UNION;
            case VIXIE:
            default:
                // first character only: "1,*" does not count as a wildcard field
                return startsWithWildcard(cron.dayOfMonth()) || startsWithWildcard(cron.dayOfWeek())
                        ? DayMatchMode.INTERSECT
                        : DayMatchMode.UNION;
        }
    }

    static boolean startsWithWildcard(String field) {
        return !field.isEmpty() && field.charAt(0) == WILDCARD;
    }

    static boolean containsWildcard(String field) {
        return field.indexOf(WILDCARD) >= 0;
    }
}
