package io.github.byzatic.crontimestamps;

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.crontimestamps.base_exceptions.CronExpansionException;
import io.github.byzatic.crontimestamps.base_exceptions.InvalidConfigurationException;
import io.github.byzatic.crontimestamps.base_exceptions.InvalidWindowException;
import io.github.byzatic.crontimestamps.base_exceptions.WindowTooLargeException;
import io.github.byzatic.crontimestamps.cron_expression.CronSchedule;
import io.github.byzatic.crontimestamps.cron_expression.DayMatchPolicy;
import io.github.byzatic.crontimestamps.expansion.BatchExpander;
import io.github.byzatic.crontimestamps.expansion.ExpansionConfig;
import io.github.byzatic.crontimestamps.expansion.ExpansionReport;
import io.github.byzatic.crontimestamps.expansion.TimestampExpander;
import io.github.byzatic.crontimestamps.expansion.TriggerInstant;
import io.github.byzatic.crontimestamps.expansion.WindowEntry;
import io.github.byzatic.crontimestamps.expansion.window.ExpansionWindow;
import io.github.byzatic.crontimestamps.expansion.window.GlobalWindow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Entry point: expands cron expressions into the timestamps they fire at inside a bounded window.
 *
 * <h3>Window strategies</h3>
 * <ul>
 *   <li>{@link #expandGlobalWindow} - one {@code (startDate, daysForward)} window shared by all expressions;</li>
 *   <li>{@link #expandPerEntryWindow} - every expression carries its own {@code [startAt, endAt]} and an
 *       optional id.</li>
 * </ul>
 * Both return an {@link ExpansionReport} with one result per expression, so a single bad expression does
 * not fail the batch.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * try (CronTimestamps cron = new CronTimestamps.Builder().build()) {
 *     Set<TriggerInstant> at = cron
 *             .expandGlobalWindow(List.of("0 9 * * 1-5"), LocalDate.of(2024, 1, 1), 30)
 *             .triggersOrThrow();
 * }
 * }</pre>
 */
@ThreadSafe
public final class CronTimestamps implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(CronTimestamps.class);

    private final ExpansionConfig config;
    private final @Nullable ThreadPoolExecutor executor;
    private final boolean ownsExecutor;
    private final TimestampExpander expander;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private CronTimestamps(ExpansionConfig config, @Nullable ThreadPoolExecutor executor, boolean ownsExecutor) {
        this.config = config;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.expander = new TimestampExpander(config);
    }

    public static final class Builder {
        private ExpansionConfig.Builder config = new ExpansionConfig.Builder();
        private ThreadPoolExecutor executor;
        private boolean parallel = false;

        public Builder config(ExpansionConfig config) {
            this.config = Objects.requireNonNull(config).toBuilder();
            return this;
        }

        public Builder maxDateRange(int maxDateRange) {
            config.maxDateRange(maxDateRange);
            return this;
        }

        public Builder dayMatchPolicy(DayMatchPolicy policy) {
            config.dayMatchPolicy(policy);
            return this;
        }

        public Builder dayMatchMode(String name) throws InvalidConfigurationException {
            config.dayMatchMode(name);
            return this;
        }

        public Builder zone(ZoneId zone) {
            config.zone(zone);
            return this;
        }

        public Builder maxTriggers(long maxTriggers) {
            config.maxTriggers(maxTriggers);
            return this;
        }

        /**
         * Provide your own thread pool for batch expansion. It is not shut down on {@link #close()}.
         */
        public Builder executor(ThreadPoolExecutor executor) {
            this.executor = Objects.requireNonNull(executor);
            return this;
        }

        /**
         * Fan batches out over a default pool sized to the machine; the pool is closed with this instance.
         */
        public Builder parallel() {
            this.parallel = true;
            return this;
        }

        public CronTimestamps build() {
            if (executor != null) {
                return new CronTimestamps(config.build(), executor, false);
            }
            if (!parallel) {
                return new CronTimestamps(config.build(), null, false);
            }
            ThreadPoolExecutor pool = new ThreadPoolExecutor(
                    Math.max(2, Runtime.getRuntime().availableProcessors()),
                    Math.max(2, Runtime.getRuntime().availableProcessors()),
                    60, TimeUnit.SECONDS,
                    new LinkedBlockingQueue<>(),
                    r -> {
                        Thread t = new Thread(r, "cron-expand-" + UUID.randomUUID());
                        t.setDaemon(true);
                        t.setUncaughtExceptionHandler((th, ex) ->
                                logger.error("Uncaught in {}", th.getName(), ex));
                        return t;
                    },
                    new ThreadPoolExecutor.CallerRunsPolicy()
            );
            pool.allowCoreThreadTimeOut(true);
            return new CronTimestamps(config.build(), pool, true);
        }
    }

    // ======== Public API ========

    public @NotNull ExpansionConfig config() {
        return config;
    }

    public @NotNull ZoneId zone() {
        return config.zone();
    }

    /**
     * Same as {@link #expandGlobalWindow(List, LocalDate, int, DayMatchPolicy)} with the configured policy.
     */
    public @NotNull ExpansionReport expandGlobalWindow(@NotNull List<String> crons, @NotNull LocalDate startDate,
                                                       int daysForward)
            throws InvalidWindowException, WindowTooLargeException {
        return expandGlobalWindow(crons, startDate, daysForward, config.dayMatchPolicy());
    }

    public @NotNull ExpansionReport expandGlobalWindow(@NotNull List<String> crons, @NotNull LocalDate startDate,
                                                       int daysForward, @NotNull String dayMatchMode)
            throws InvalidConfigurationException, InvalidWindowException, WindowTooLargeException {
        return expandGlobalWindow(crons, startDate, daysForward, DayMatchPolicy.fromConfigName(dayMatchMode));
    }

    /**
     * Expands every distinct expression over {@code daysForward} days starting at {@code startDate}.
     * Timestamps carry no window key.
     *
     * @throws InvalidWindowException  if {@code daysForward} is negative
     * @throws WindowTooLargeException if {@code daysForward} exceeds the configured maximum date range
     */
    public @NotNull ExpansionReport expandGlobalWindow(@NotNull List<String> crons, @NotNull LocalDate startDate,
                                                       int daysForward, @NotNull DayMatchPolicy policy)
            throws InvalidWindowException, WindowTooLargeException {
        ensureOpen();
        GlobalWindow window = new GlobalWindow(startDate, daysForward);
        window.validate(config.maxDateRange());

        Set<String> distinct = new LinkedHashSet<>(crons);
        List<BatchExpander.Task> tasks = new ArrayList<>(distinct.size());
        for (String cron : distinct) {
            tasks.add(new BatchExpander.Task(cron, null, window));
        }
        logger.debug("Expanding {} crons over {} ({})", tasks.size(), window, policy.configName());
        return batch(config.toBuilder().dayMatchPolicy(policy).build()).expandAll(tasks);
    }

    /**
     * Per-entry expansion with the configured maximum date range and policy.
     */
    public @NotNull ExpansionReport expandPerEntryWindow(@NotNull List<WindowEntry> entries) {
        return expandPerEntryWindow(entries, config.maxDateRange(), config.dayMatchPolicy());
    }

    public @NotNull ExpansionReport expandPerEntryWindow(@NotNull List<WindowEntry> entries, int maxDateRange,
                                                         @NotNull String dayMatchMode)
            throws InvalidConfigurationException {
        return expandPerEntryWindow(entries, maxDateRange, DayMatchPolicy.fromConfigName(dayMatchMode));
    }

    /**
     * Expands each entry over its own inclusive {@code [startAt, endAt]}. Window errors (inverted bounds,
     * span over {@code maxDateRange}) fail only their entry. Timestamps are keyed by the entry id, or by
     * {@code cron-startDate-endDate} when the entry has none.
     */
    public @NotNull ExpansionReport expandPerEntryWindow(@NotNull List<WindowEntry> entries, int maxDateRange,
                                                         @NotNull DayMatchPolicy policy) {
        ensureOpen();
        List<BatchExpander.Task> tasks = new ArrayList<>(entries.size());
        for (WindowEntry e : entries) {
            tasks.add(new BatchExpander.Task(e.cron(), e.id(), e.window()));
        }
        logger.debug("Expanding {} per-entry windows (maxDateRange={}, {})", tasks.size(), maxDateRange,
                policy.configName());
        ExpansionConfig callConfig = config.toBuilder().maxDateRange(maxDateRange).dayMatchPolicy(policy).build();
        return batch(callConfig).expandAll(tasks);
    }

    /**
     * Expands a single expression, failing on the first error.
     */
    public @NotNull ImmutableSet<TriggerInstant> expand(@NotNull String cron, @NotNull ExpansionWindow window)
            throws CronExpansionException {
        ensureOpen();
        return expander.expand(CronSchedule.compile(cron), window);
    }

    /**
     * Lazy form of {@link #expand(String, ExpansionWindow)}; not subject to the {@code maxTriggers} cap.
     */
    public @NotNull Stream<TriggerInstant> stream(@NotNull String cron, @NotNull ExpansionWindow window)
            throws CronExpansionException {
        ensureOpen();
        CronSchedule schedule = CronSchedule.compile(cron);
        return expander.stream(schedule, window, expander.resolveMode(schedule));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        if (executor == null || !ownsExecutor) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    // ======== Internal ========

    private BatchExpander batch(ExpansionConfig callConfig) {
        return new BatchExpander(new TimestampExpander(callConfig), executor);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("CronTimestamps is closed");
        }
    }
}
