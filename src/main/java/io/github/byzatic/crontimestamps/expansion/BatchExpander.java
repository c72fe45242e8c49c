package io.github.byzatic.crontimestamps.expansion;

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.crontimestamps.base_exceptions.CronExpansionException;
import io.github.byzatic.crontimestamps.cron_expression.CronSchedule;
import io.github.byzatic.crontimestamps.cron_expression.DayMatchMode;
import io.github.byzatic.crontimestamps.expansion.window.ExpansionWindow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Expands many {@code (cron, window)} pairs. Each pair is independent: a malformed expression or a bad
 * window fails only its own {@link EntryResult}.
 * <p>
 * With an executor the pairs are fanned out over its threads, otherwise they run on the calling thread.
 * The executor is borrowed, never shut down here.
 */
@ThreadSafe
public final class BatchExpander {
    private final static Logger logger = LoggerFactory.getLogger(BatchExpander.class);

    private final TimestampExpander expander;
    private final @Nullable ExecutorService executor;

    public BatchExpander(@NotNull TimestampExpander expander) {
        this(expander, null);
    }

    public BatchExpander(@NotNull TimestampExpander expander, @Nullable ExecutorService executor) {
        this.expander = Objects.requireNonNull(expander);
        this.executor = executor;
    }

    /**
     * One unit of a batch.
     */
    public static final class Task {
        final String cron;
        final @Nullable String id;
        final ExpansionWindow window;

        public Task(@NotNull String cron, @Nullable String id, @NotNull ExpansionWindow window) {
            this.cron = Objects.requireNonNull(cron);
            this.id = id;
            this.window = Objects.requireNonNull(window);
        }
    }

    public @NotNull ExpansionReport expandAll(@NotNull List<Task> tasks) {
        if (executor == null) {
            List<EntryResult> out = new ArrayList<>(tasks.size());
            for (Task t : tasks) out.add(expandOne(t));
            return report(out);
        }

        List<Future<EntryResult>> futures = new ArrayList<>(tasks.size());
        for (Task t : tasks) {
            futures.add(executor.submit(() -> expandOne(t)));
        }
        List<EntryResult> out = new ArrayList<>(tasks.size());
        try {
            for (Future<EntryResult> f : futures) {
                out.add(f.get());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new CancellationException("Interrupted while waiting for batch expansion");
        } catch (ExecutionException ee) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = ee.getCause();
            logger.error("Unexpected failure in batch expansion worker", cause);
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException(cause);
        }
        return report(out);
    }

    @NotNull EntryResult expandOne(Task task) {
        String key = task.window.keyFor(task.cron.trim());
        try {
            CronSchedule schedule = CronSchedule.compile(task.cron);
            DayMatchMode mode = expander.resolveMode(schedule);
            ImmutableSet<TriggerInstant> triggers = expander.expand(schedule, task.window, mode);
            return EntryResult.success(task.cron, task.id, key, triggers);
        } catch (CronExpansionException e) {
            logger.warn("Cron '{}' ({}) not expanded: {}", task.cron, task.window, e.getMessage());
            return EntryResult.failure(task.cron, task.id, key, e);
        }
    }

    private static ExpansionReport report(List<EntryResult> results) {
        ExpansionReport report = new ExpansionReport(results);
        logger.debug("Batch expanded: {}", report);
        return report;
    }
}
