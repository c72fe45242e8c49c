package io.github.byzatic.crontimestamps.cron_expression;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * One comma separated unit of a field after wildcard and name substitution: every {@code step}-th value
 * from {@code rangeStart} up to {@code rangeEnd}, both inclusive.
 * <p>
 * Equality is by {@code (rangeStart, rangeEnd, step)}; {@link #text()} only keeps the normalized source
 * token for diagnostics.
 */
public final class FieldSubentry {
    private final int rangeStart;
    private final int rangeEnd;
    private final int step;
    private final String text;

    FieldSubentry(int rangeStart, int rangeEnd, int step, @NotNull String text) {
        if (rangeStart > rangeEnd) {
            throw new IllegalArgumentException("rangeStart > rangeEnd: " + rangeStart + " > " + rangeEnd);
        }
        if (step < 1) {
            throw new IllegalArgumentException("step must be >= 1, got " + step);
        }
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.step = step;
        this.text = Objects.requireNonNull(text);
    }

    public int rangeStart() {
        return rangeStart;
    }

    public int rangeEnd() {
        return rangeEnd;
    }

    public int step() {
        return step;
    }

    public @NotNull String text() {
        return text;
    }

    public boolean matches(int value) {
        return value >= rangeStart && value <= rangeEnd && (value - rangeStart) % step == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldSubentry)) return false;
        FieldSubentry that = (FieldSubentry) o;
        return rangeStart == that.rangeStart && rangeEnd == that.rangeEnd && step == that.step;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rangeStart, rangeEnd, step);
    }

    @Override
    public String toString() {
        return "FieldSubentry{" + rangeStart + "-" + rangeEnd + "/" + step + ", text='" + text + "'}";
    }
}
