package io.github.byzatic.crontimestamps.expansion.window;

import io.github.byzatic.crontimestamps.base_exceptions.InvalidWindowException;
import io.github.byzatic.crontimestamps.base_exceptions.WindowTooLargeException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A window owned by a single expression. Both bounds are inclusive and compared at timestamp
 * precision: {@code startAt <= t <= endAt}.
 * <p>
 * Timestamps are keyed by the caller's id when one is given, otherwise by
 * {@code cron + "-" + date(startAt) + "-" + date(endAt)}.
 */
public final class EntryWindow implements ExpansionWindow {
    private final LocalDateTime startAt;
    private final LocalDateTime endAt;
    private final @Nullable String id;

    public EntryWindow(@NotNull LocalDateTime startAt, @NotNull LocalDateTime endAt) {
        this(startAt, endAt, null);
    }

    public EntryWindow(@NotNull LocalDateTime startAt, @NotNull LocalDateTime endAt, @Nullable String id) {
        this.startAt = Objects.requireNonNull(startAt);
        this.endAt = Objects.requireNonNull(endAt);
        this.id = id;
    }

    public @NotNull LocalDateTime startAt() {
        return startAt;
    }

    public @NotNull LocalDateTime endAt() {
        return endAt;
    }

    public @Nullable String id() {
        return id;
    }

    @Override
    public @NotNull LocalDate firstDate() {
        return startAt.toLocalDate();
    }

    @Override
    public @NotNull LocalDate lastDate() {
        return endAt.toLocalDate();
    }

    @Override
    public long candidateDays() {
        return Math.max(0, ChronoUnit.DAYS.between(firstDate(), lastDate()) + 1);
    }

    @Override
    public boolean accepts(@NotNull LocalDateTime timestamp) {
        return !timestamp.isBefore(startAt) && !timestamp.isAfter(endAt);
    }

    @Override
    public @NotNull String keyFor(@NotNull String cron) {
        if (id != null) {
            return id;
        }
        return cron + "-" + firstDate() + "-" + lastDate();
    }

    @Override
    public void validate(int maxDateRange) throws InvalidWindowException, WindowTooLargeException {
        if (!startAt.isBefore(endAt)) {
            throw new InvalidWindowException("Window start " + startAt + " is not before end " + endAt);
        }
        long days = candidateDays();
        if (days > maxDateRange) {
            throw new WindowTooLargeException(days, maxDateRange);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntryWindow)) return false;
        EntryWindow that = (EntryWindow) o;
        return startAt.equals(that.startAt) && endAt.equals(that.endAt) && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startAt, endAt, id);
    }

    @Override
    public String toString() {
        return "EntryWindow{" + (id != null ? id + ": " : "") + startAt + " .. " + endAt + "}";
    }
}
