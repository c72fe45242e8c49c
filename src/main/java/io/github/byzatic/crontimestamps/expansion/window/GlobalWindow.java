package io.github.byzatic.crontimestamps.expansion.window;

import io.github.byzatic.crontimestamps.base_exceptions.InvalidWindowException;
import io.github.byzatic.crontimestamps.base_exceptions.WindowTooLargeException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One window shared by every expression: {@code daysForward} whole days starting at {@code startDate},
 * i.e. {@code startDate .. startDate + daysForward - 1}. Zero days yields nothing.
 */
public final class GlobalWindow implements ExpansionWindow {
    private final LocalDate startDate;
    private final int daysForward;

    public GlobalWindow(@NotNull LocalDate startDate, int daysForward) {
        this.startDate = Objects.requireNonNull(startDate);
        this.daysForward = daysForward;
    }

    public @NotNull LocalDate startDate() {
        return startDate;
    }

    public int daysForward() {
        return daysForward;
    }

    @Override
    public @NotNull LocalDate firstDate() {
        return startDate;
    }

    @Override
    public @NotNull LocalDate lastDate() {
        return startDate.plusDays(daysForward - 1L);
    }

    @Override
    public long candidateDays() {
        return Math.max(0, daysForward);
    }

    @Override
    public boolean accepts(@NotNull LocalDateTime timestamp) {
        LocalDate date = timestamp.toLocalDate();
        return !date.isBefore(firstDate()) && !date.isAfter(lastDate());
    }

    @Override
    public @Nullable String keyFor(@NotNull String cron) {
        return null;
    }

    @Override
    public void validate(int maxDateRange) throws InvalidWindowException, WindowTooLargeException {
        if (daysForward < 0) {
            throw new InvalidWindowException("daysForward must be >= 0, got " + daysForward);
        }
        if (daysForward > maxDateRange) {
            throw new WindowTooLargeException(daysForward, maxDateRange);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GlobalWindow)) return false;
        GlobalWindow that = (GlobalWindow) o;
        return daysForward == that.daysForward && startDate.equals(that.startDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startDate, daysForward);
    }

    @Override
    public String toString() {
        return "GlobalWindow{" + startDate + " +" + daysForward + "d}";
    }
}
