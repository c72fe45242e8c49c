package io.github.byzatic.crontimestamps.expansion;

import com.google.common.collect.ImmutableSet;
import io.github.byzatic.crontimestamps.base_exceptions.CronExpansionException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of expanding one expression inside a batch: its timestamps, or the error that stopped it.
 */
public final class EntryResult {
    private final String cron;
    private final @Nullable String id;
    private final @Nullable String windowKey;
    private final ImmutableSet<TriggerInstant> triggers;
    private final @Nullable CronExpansionException error;

    private EntryResult(String cron, @Nullable String id, @Nullable String windowKey,
                        ImmutableSet<TriggerInstant> triggers, @Nullable CronExpansionException error) {
        this.cron = Objects.requireNonNull(cron);
        this.id = id;
        this.windowKey = windowKey;
        this.triggers = triggers;
        this.error = error;
    }

    public static @NotNull EntryResult success(@NotNull String cron, @Nullable String id, @Nullable String windowKey,
                                               @NotNull ImmutableSet<TriggerInstant> triggers) {
        return new EntryResult(cron, id, windowKey, Objects.requireNonNull(triggers), null);
    }

    public static @NotNull EntryResult failure(@NotNull String cron, @Nullable String id, @Nullable String windowKey,
                                               @NotNull CronExpansionException error) {
        return new EntryResult(cron, id, windowKey, ImmutableSet.of(), Objects.requireNonNull(error));
    }

    public @NotNull String cron() {
        return cron;
    }

    public @Nullable String id() {
        return id;
    }

    public @Nullable String windowKey() {
        return windowKey;
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Produced timestamps; empty for a failed entry.
     */
    public @NotNull ImmutableSet<TriggerInstant> triggers() {
        return triggers;
    }

    public @NotNull Optional<CronExpansionException> error() {
        return Optional.ofNullable(error);
    }

    public @NotNull ImmutableSet<TriggerInstant> triggersOrThrow() throws CronExpansionException {
        if (error != null) {
            throw error;
        }
        return triggers;
    }

    @Override
    public String toString() {
        return "EntryResult{cron='" + cron + "'" + (id != null ? ", id=" + id : "")
                + (error == null ? ", triggers=" + triggers.size() : ", error=" + error.getMessage()) + "}";
    }
}
