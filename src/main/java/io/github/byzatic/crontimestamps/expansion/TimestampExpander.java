package io.github.byzatic.crontimestamps.expansion;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.crontimestamps.base_exceptions.InvalidWindowException;
import io.github.byzatic.crontimestamps.base_exceptions.ResultTooLargeException;
import io.github.byzatic.crontimestamps.base_exceptions.WindowTooLargeException;
import io.github.byzatic.crontimestamps.cron_expression.CronSchedule;
import io.github.byzatic.crontimestamps.cron_expression.DayFilter;
import io.github.byzatic.crontimestamps.cron_expression.DayMatchMode;
import io.github.byzatic.crontimestamps.cron_expression.DayMatchModeResolver;
import io.github.byzatic.crontimestamps.cron_expression.MatchedValues;
import io.github.byzatic.crontimestamps.expansion.window.ExpansionWindow;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Walks the days of a window and produces every timestamp a compiled expression fires at.
 *
 * <h3>Order of work</h3>
 * <ol>
 *   <li>validate the window against {@code maxDateRange};</li>
 *   <li>walk candidate dates month by month, skipping months the expression does not match;</li>
 *   <li>drop day of month values past the month's last day (day 30 never matches in February),
 *       then apply the {@link DayFilter};</li>
 *   <li>fan each surviving date over matched hours x matched minutes at second 0;</li>
 *   <li>keep only timestamps the window {@linkplain ExpansionWindow#accepts accepts}.</li>
 * </ol>
 * Dates and hour/minute pairs are each visited once, so a single expression never yields duplicates.
 * <p>
 * Stateless apart from its configuration; one instance may serve any number of threads.
 */
@ThreadSafe
public final class TimestampExpander {
    private final static Logger logger = LoggerFactory.getLogger(TimestampExpander.class);

    private final ExpansionConfig config;

    public TimestampExpander(@NotNull ExpansionConfig config) {
        this.config = Objects.requireNonNull(config);
    }

    public @NotNull ExpansionConfig config() {
        return config;
    }

    /**
     * Expands with the day match mode the configured policy resolves for this expression.
     */
    public @NotNull ImmutableSet<TriggerInstant> expand(@NotNull CronSchedule schedule, @NotNull ExpansionWindow window)
            throws InvalidWindowException, WindowTooLargeException, ResultTooLargeException {
        return expand(schedule, window, resolveMode(schedule));
    }

    /**
     * Eagerly collects the timestamps of one expression.
     *
     * @throws ResultTooLargeException if more than {@code maxTriggers} timestamps would be produced
     */
    public @NotNull ImmutableSet<TriggerInstant> expand(@NotNull CronSchedule schedule, @NotNull ExpansionWindow window,
                                                        @NotNull DayMatchMode mode)
            throws InvalidWindowException, WindowTooLargeException, ResultTooLargeException {
        String cron = schedule.expression().expression();
        Set<TriggerInstant> out = new LinkedHashSet<>();
        try (Stream<TriggerInstant> triggers = stream(schedule, window, mode)) {
            Iterator<TriggerInstant> it = triggers.iterator();
            while (it.hasNext()) {
                out.add(it.next());
                if (out.size() > config.maxTriggers()) {
                    throw new ResultTooLargeException(cron, config.maxTriggers());
                }
            }
        }
        logger.debug("Cron '{}' expanded over {} in {} mode: {} timestamps", cron, window, mode, out.size());
        return ImmutableSet.copyOf(out);
    }

    /**
     * Lazily produces the timestamps of one expression. The window is validated up front; no cap on the
     * number of elements is applied.
     */
    public @NotNull Stream<TriggerInstant> stream(@NotNull CronSchedule schedule, @NotNull ExpansionWindow window,
                                                  @NotNull DayMatchMode mode)
            throws InvalidWindowException, WindowTooLargeException {
        window.validate(config.maxDateRange());
        String cron = schedule.expression().expression();
        String key = window.keyFor(cron);
        int[] hours = schedule.hours().toArray();
        int[] minutes = schedule.minutes().toArray();

        return matchingDates(schedule, window, mode).stream()
                .flatMap(date -> Arrays.stream(hours).boxed()
                        .flatMap(h -> Arrays.stream(minutes).mapToObj(m -> date.atTime(h, m))))
                .filter(window::accepts)
                .map(t -> new TriggerInstant(cron, key, t));
    }

    public @NotNull DayMatchMode resolveMode(@NotNull CronSchedule schedule) {
        return DayMatchModeResolver.resolve(schedule.expression(), config.dayMatchPolicy());
    }

    /**
     * Candidate dates of the window that pass the month filter and the day filter, ascending.
     */
    @NotNull ImmutableList<LocalDate> matchingDates(CronSchedule schedule, ExpansionWindow window, DayMatchMode mode) {
        LocalDate first = window.firstDate();
        LocalDate last = window.lastDate();
        ImmutableList.Builder<LocalDate> out = ImmutableList.builder();
        if (last.isBefore(first)) {
            return out.build();
        }

        MatchedValues months = schedule.months();
        MatchedValues daysOfWeek = schedule.daysOfWeek();
        YearMonth firstMonth = YearMonth.from(first);
        YearMonth lastMonth = YearMonth.from(last);

        for (YearMonth ym = firstMonth; !ym.isAfter(lastMonth); ym = ym.plusMonths(1)) {
            if (!months.contains(ym.getMonthValue())) {
                continue;
            }
            int lastDay = ym.lengthOfMonth();
            MatchedValues daysOfMonth = schedule.daysOfMonth().upTo(lastDay);
            int fromDay = ym.equals(firstMonth) ? first.getDayOfMonth() : 1;
            int toDay = ym.equals(lastMonth) ? last.getDayOfMonth() : lastDay;
            for (int d = fromDay; d <= toDay; d++) {
                LocalDate date = ym.atDay(d);
                if (DayFilter.matches(date, daysOfMonth, daysOfWeek, mode)) {
                    out.add(date);
                }
            }
        }
        return out.build();
    }

    /**
     * Upper bound on what {@link #expand} can produce for this schedule and window, computed before any
     * timestamp is built. The window is validated the same way {@link #stream} validates it.
     */
    public long estimateSize(@NotNull CronSchedule schedule, @NotNull ExpansionWindow window, @NotNull DayMatchMode mode)
            throws InvalidWindowException, WindowTooLargeException {
        window.validate(config.maxDateRange());
        return (long) matchingDates(schedule, window, mode).size()
                * schedule.hours().size()
                * schedule.minutes().size();
    }

    /**
     * Convenience for a single timestamp check without building a window.
     */
    public static boolean fires(@NotNull CronSchedule schedule, @NotNull LocalDateTime timestamp,
                                @NotNull DayMatchMode mode) {
        LocalDate date = timestamp.toLocalDate();
        return timestamp.getSecond() == 0 && timestamp.getNano() == 0
                && schedule.minutes().contains(timestamp.getMinute())
                && schedule.hours().contains(timestamp.getHour())
                && schedule.months().contains(date.getMonthValue())
                && DayFilter.matches(date, schedule.daysOfMonth(), schedule.daysOfWeek(), mode);
    }
}
