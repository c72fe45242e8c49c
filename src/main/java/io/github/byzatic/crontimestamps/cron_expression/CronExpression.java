package io.github.byzatic.crontimestamps.cron_expression;

import com.google.common.collect.ImmutableList;
import io.github.byzatic.crontimestamps.base_exceptions.MalformedFieldException;
import org.jetbrains.annotations.NotNull;

/**
 * A five field cron expression: {@code minute hour day_of_month month day_of_week}.
 * <p>
 * Holds the raw field strings only. Identity is the trimmed original text, so {@code "*&#47;1 * * * *"} and
 * {@code "* * * * *"} are different expressions even though they fire at the same instants.
 */
public final class CronExpression {
    public static final int FIELD_COUNT = 5;

    private final String expression;
    private final ImmutableList<String> fields;

    private CronExpression(String expression, ImmutableList<String> fields) {
        this.expression = expression;
        this.fields = fields;
    }

    /**
     * Splits the expression on whitespace into its five fields. Field contents are not validated here,
     * see {@link CronSchedule#compile(CronExpression)}.
     *
     * @throws MalformedFieldException if the expression is blank or does not have exactly five fields
     */
    public static @NotNull CronExpression parse(String expression) throws MalformedFieldException {
        if (expression == null || expression.trim().isEmpty()) {
            throw new MalformedFieldException("Cron expression is empty");
        }
        String trimmed = expression.trim();
        String[] p = trimmed.split("\\s+");
        if (p.length != FIELD_COUNT) {
            throw new MalformedFieldException("Cron must have " + FIELD_COUNT + " fields, got " + p.length
                    + ": '" + trimmed + "'", null, null, trimmed, null);
        }
        return new CronExpression(trimmed, ImmutableList.copyOf(p));
    }

    public @NotNull String expression() {
        return expression;
    }

    public @NotNull String field(@NotNull FieldKind kind) {
        return fields.get(kind.position());
    }

    public @NotNull String minute() {
        return field(FieldKind.MINUTE);
    }

    public @NotNull String hour() {
        return field(FieldKind.HOUR);
    }

    public @NotNull String dayOfMonth() {
        return field(FieldKind.DAY_OF_MONTH);
    }

    public @NotNull String month() {
        return field(FieldKind.MONTH);
    }

    public @NotNull String dayOfWeek() {
        return field(FieldKind.DAY_OF_WEEK);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronExpression)) return false;
        return expression.equals(((CronExpression) o).expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
