package io.github.byzatic.crontimestamps.expansion;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.byzatic.crontimestamps.base_exceptions.CronExpansionException;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Results of a batch, one {@link EntryResult} per input in input order.
 */
public final class ExpansionReport {
    private final ImmutableList<EntryResult> results;

    public ExpansionReport(@NotNull List<EntryResult> results) {
        this.results = ImmutableList.copyOf(results);
    }

    public @NotNull ImmutableList<EntryResult> results() {
        return results;
    }

    /**
     * Distinct timestamps of all successful entries.
     */
    public @NotNull ImmutableSet<TriggerInstant> triggers() {
        ImmutableSet.Builder<TriggerInstant> out = ImmutableSet.builder();
        for (EntryResult r : results) {
            out.addAll(r.triggers());
        }
        return out.build();
    }

    /**
     * {@link #triggers()} ordered by {@link TriggerInstant#CHRONOLOGICAL}.
     */
    public @NotNull ImmutableList<TriggerInstant> sortedTriggers() {
        return ImmutableList.sortedCopyOf(TriggerInstant.CHRONOLOGICAL, triggers());
    }

    public @NotNull ImmutableList<EntryResult> failures() {
        ImmutableList.Builder<EntryResult> out = ImmutableList.builder();
        for (EntryResult r : results) {
            if (!r.isSuccess()) out.add(r);
        }
        return out.build();
    }

    public boolean hasFailures() {
        for (EntryResult r : results) {
            if (!r.isSuccess()) return true;
        }
        return false;
    }

    /**
     * All timestamps, or the error of the first failed entry.
     */
    public @NotNull ImmutableSet<TriggerInstant> triggersOrThrow() throws CronExpansionException {
        for (EntryResult r : results) {
            r.triggersOrThrow();
        }
        return triggers();
    }

    @Override
    public String toString() {
        return "ExpansionReport{entries=" + results.size() + ", failures=" + failures().size() + "}";
    }
}
