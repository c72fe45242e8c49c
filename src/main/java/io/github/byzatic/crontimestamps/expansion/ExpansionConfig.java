package io.github.byzatic.crontimestamps.expansion;

import io.github.byzatic.crontimestamps.base_exceptions.InvalidConfigurationException;
import io.github.byzatic.crontimestamps.cron_expression.DayMatchPolicy;
import org.jetbrains.annotations.NotNull;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Settings shared by every expansion.
 *
 * <ul>
 *   <li>{@code maxDateRange} - most candidate days one window may cover (default 1095, three years);</li>
 *   <li>{@code dayMatchPolicy} - how day of month and day of week combine (default {@code vixie});</li>
 *   <li>{@code zone} - reference zone timestamps are read in when converted to instants (default UTC);</li>
 *   <li>{@code maxTriggers} - most timestamps one expression may produce eagerly (default 1,000,000).</li>
 * </ul>
 */
public final class ExpansionConfig {
    public static final int DEFAULT_MAX_DATE_RANGE = 1095;
    public static final long DEFAULT_MAX_TRIGGERS = 1_000_000L;

    private final int maxDateRange;
    private final DayMatchPolicy dayMatchPolicy;
    private final ZoneId zone;
    private final long maxTriggers;

    private ExpansionConfig(Builder b) {
        this.maxDateRange = b.maxDateRange;
        this.dayMatchPolicy = b.dayMatchPolicy;
        this.zone = b.zone;
        this.maxTriggers = b.maxTriggers;
    }

    public static @NotNull ExpansionConfig defaults() {
        return new Builder().build();
    }

    public int maxDateRange() {
        return maxDateRange;
    }

    public @NotNull DayMatchPolicy dayMatchPolicy() {
        return dayMatchPolicy;
    }

    public @NotNull ZoneId zone() {
        return zone;
    }

    public long maxTriggers() {
        return maxTriggers;
    }

    public @NotNull Builder toBuilder() {
        return new Builder()
                .maxDateRange(maxDateRange)
                .dayMatchPolicy(dayMatchPolicy)
                .zone(zone)
                .maxTriggers(maxTriggers);
    }

    @Override
    public String toString() {
        return "ExpansionConfig{maxDateRange=" + maxDateRange + ", dayMatchPolicy=" + dayMatchPolicy.configName()
                + ", zone=" + zone + ", maxTriggers=" + maxTriggers + "}";
    }

    public static final class Builder {
        private int maxDateRange = DEFAULT_MAX_DATE_RANGE;
        private DayMatchPolicy dayMatchPolicy = DayMatchPolicy.VIXIE;
        private ZoneId zone = ZoneOffset.UTC;
        private long maxTriggers = DEFAULT_MAX_TRIGGERS;

        public Builder maxDateRange(int maxDateRange) {
            if (maxDateRange < 1) {
                throw new IllegalArgumentException("maxDateRange must be >= 1, got " + maxDateRange);
            }
            this.maxDateRange = maxDateRange;
            return this;
        }

        public Builder dayMatchPolicy(DayMatchPolicy policy) {
            this.dayMatchPolicy = Objects.requireNonNull(policy);
            return this;
        }

        /**
         * Policy by configuration name, see {@link DayMatchPolicy#fromConfigName(String)}.
         */
        public Builder dayMatchMode(String name) throws InvalidConfigurationException {
            this.dayMatchPolicy = DayMatchPolicy.fromConfigName(name);
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone);
            return this;
        }

        public Builder maxTriggers(long maxTriggers) {
            if (maxTriggers < 1) {
                throw new IllegalArgumentException("maxTriggers must be >= 1, got " + maxTriggers);
            }
            this.maxTriggers = maxTriggers;
            return this;
        }

        public ExpansionConfig build() {
            return new ExpansionConfig(this);
        }
    }
}
