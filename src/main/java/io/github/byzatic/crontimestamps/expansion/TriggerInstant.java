package io.github.byzatic.crontimestamps.expansion;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.Objects;

/**
 * One firing of a cron expression: the expression, the key of the window it was produced for (if any)
 * and the wall clock timestamp, always at second 0.
 */
public final class TriggerInstant {
    /**
     * Timestamp first, then cron text, then window key (keyless first).
     */
    public static final Comparator<TriggerInstant> CHRONOLOGICAL = Comparator
            .comparing(TriggerInstant::triggerAt)
            .thenComparing(TriggerInstant::cron)
            .thenComparing(TriggerInstant::windowKey, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    private final String cron;
    private final @Nullable String windowKey;
    private final LocalDateTime triggerAt;

    public TriggerInstant(@NotNull String cron, @Nullable String windowKey, @NotNull LocalDateTime triggerAt) {
        this.cron = Objects.requireNonNull(cron);
        this.windowKey = windowKey;
        this.triggerAt = Objects.requireNonNull(triggerAt);
    }

    public @NotNull String cron() {
        return cron;
    }

    public @Nullable String windowKey() {
        return windowKey;
    }

    public @NotNull LocalDateTime triggerAt() {
        return triggerAt;
    }

    /**
     * The timestamp read as wall clock time in {@code zone}.
     */
    public @NotNull Instant toInstant(@NotNull ZoneId zone) {
        return triggerAt.atZone(zone).toInstant();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TriggerInstant)) return false;
        TriggerInstant that = (TriggerInstant) o;
        return cron.equals(that.cron) && Objects.equals(windowKey, that.windowKey) && triggerAt.equals(that.triggerAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cron, windowKey, triggerAt);
    }

    @Override
    public String toString() {
        return "TriggerInstant{cron='" + cron + "'" + (windowKey != null ? ", key='" + windowKey + "'" : "")
                + ", at=" + triggerAt + "}";
    }
}
