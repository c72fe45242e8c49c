package io.github.byzatic.crontimestamps.cron_expression;

import org.jetbrains.annotations.NotNull;

import java.time.LocalDate;

/**
 * Keeps or drops a candidate date according to the day of month and day of week matches of one expression.
 * The caller has already checked the month.
 */
public final class DayFilter {

    private DayFilter() {
    }

    public static boolean matches(@NotNull LocalDate date, @NotNull MatchedValues daysOfMonth,
                                  @NotNull MatchedValues daysOfWeek, @NotNull DayMatchMode mode) {
        boolean domMatch = daysOfMonth.contains(date.getDayOfMonth());
        boolean dowMatch = daysOfWeek.contains(dayOfWeekNumber(date));
        return mode == DayMatchMode.UNION ? domMatch || dowMatch : domMatch && dowMatch;
    }

    /**
     * Cron numbering of the weekday: Sunday = 0 ... Saturday = 6.
     */
    public static int dayOfWeekNumber(@NotNull LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }
}
