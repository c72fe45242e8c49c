package io.github.byzatic.crontimestamps.expansion.window;

import io.github.byzatic.crontimestamps.base_exceptions.InvalidWindowException;
import io.github.byzatic.crontimestamps.base_exceptions.WindowTooLargeException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Bounds one expansion: which calendar days are walked and which constructed timestamps are kept.
 */
public interface ExpansionWindow {

    /**
     * First candidate date, inclusive.
     */
    @NotNull LocalDate firstDate();

    /**
     * Last candidate date, inclusive. Before {@link #firstDate()} when the window holds no day at all.
     */
    @NotNull LocalDate lastDate();

    /**
     * Number of candidate dates walked, compared against the configured maximum date range.
     */
    long candidateDays();

    /**
     * Whether a timestamp built on one of the candidate dates lies inside the window.
     */
    boolean accepts(@NotNull LocalDateTime timestamp);

    /**
     * Key attached to the produced timestamps, or {@code null} when the window carries none.
     */
    @Nullable String keyFor(@NotNull String cron);

    /**
     * @throws InvalidWindowException  if the bounds are inverted or negative
     * @throws WindowTooLargeException if more than {@code maxDateRange} days would be walked
     */
    void validate(int maxDateRange) throws InvalidWindowException, WindowTooLargeException;
}
