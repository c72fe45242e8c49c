package io.github.byzatic.crontimestamps.expansion;

import io.github.byzatic.crontimestamps.expansion.window.EntryWindow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Input row of a per-entry expansion: a cron expression with its own {@code [startAt, endAt]} window and
 * an optional caller id used to trace results back.
 */
public final class WindowEntry {
    private final @Nullable String id;
    private final String cron;
    private final LocalDateTime startAt;
    private final LocalDateTime endAt;

    public WindowEntry(@Nullable String id, @NotNull String cron, @NotNull LocalDateTime startAt,
                       @NotNull LocalDateTime endAt) {
        this.id = id;
        this.cron = Objects.requireNonNull(cron);
        this.startAt = Objects.requireNonNull(startAt);
        this.endAt = Objects.requireNonNull(endAt);
    }

    public static @NotNull WindowEntry of(@NotNull String cron, @NotNull LocalDateTime startAt,
                                          @NotNull LocalDateTime endAt) {
        return new WindowEntry(null, cron, startAt, endAt);
    }

    public @Nullable String id() {
        return id;
    }

    public @NotNull String cron() {
        return cron;
    }

    public @NotNull LocalDateTime startAt() {
        return startAt;
    }

    public @NotNull LocalDateTime endAt() {
        return endAt;
    }

    public @NotNull EntryWindow window() {
        return new EntryWindow(startAt, endAt, id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WindowEntry)) return false;
        WindowEntry that = (WindowEntry) o;
        return Objects.equals(id, that.id) && cron.equals(that.cron)
                && startAt.equals(that.startAt) && endAt.equals(that.endAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, cron, startAt, endAt);
    }

    @Override
    public String toString() {
        return "WindowEntry{id=" + id + ", cron='" + cron + "', " + startAt + " .. " + endAt + "}";
    }
}
