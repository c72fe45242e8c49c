package io.github.byzatic.crontimestamps.cron_expression;

import com.google.common.collect.ImmutableSet;
import io.github.byzatic.crontimestamps.base_exceptions.MalformedFieldException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * A {@link CronExpression} with every field parsed and expanded to its matched values.
 */
public final class CronSchedule {
    private final static Logger logger = LoggerFactory.getLogger(CronSchedule.class);

    private final CronExpression expression;
    private final Map<FieldKind, ImmutableSet<FieldSubentry>> subentries;
    private final Map<FieldKind, MatchedValues> values;

    private CronSchedule(CronExpression expression,
                         Map<FieldKind, ImmutableSet<FieldSubentry>> subentries,
                         Map<FieldKind, MatchedValues> values) {
        this.expression = expression;
        this.subentries = subentries;
        this.values = values;
    }

    public static @NotNull CronSchedule compile(@NotNull String cron) throws MalformedFieldException {
        return compile(CronExpression.parse(cron));
    }

    /**
     * @throws MalformedFieldException if any field fails to parse; the error names the field and the cron
     */
    public static @NotNull CronSchedule compile(@NotNull CronExpression expression) throws MalformedFieldException {
        Map<FieldKind, ImmutableSet<FieldSubentry>> subentries = new EnumMap<>(FieldKind.class);
        Map<FieldKind, MatchedValues> values = new EnumMap<>(FieldKind.class);
        for (FieldKind kind : FieldKind.values()) {
            ImmutableSet<FieldSubentry> parsed;
            try {
                parsed = FieldParser.parseField(expression.field(kind), kind);
            } catch (MalformedFieldException e) {
                throw e.withCron(expression.expression());
            }
            subentries.put(kind, parsed);
            values.put(kind, ValueExpander.expandField(parsed, kind));
        }
        logger.trace("Compiled cron '{}': {}", expression, values.values());
        return new CronSchedule(expression, subentries, values);
    }

    public @NotNull CronExpression expression() {
        return expression;
    }

    public @NotNull ImmutableSet<FieldSubentry> subentries(@NotNull FieldKind kind) {
        return subentries.get(kind);
    }

    public @NotNull MatchedValues values(@NotNull FieldKind kind) {
        return values.get(kind);
    }

    public @NotNull MatchedValues minutes() {
        return values(FieldKind.MINUTE);
    }

    public @NotNull MatchedValues hours() {
        return values(FieldKind.HOUR);
    }

    public @NotNull MatchedValues daysOfMonth() {
        return values(FieldKind.DAY_OF_MONTH);
    }

    public @NotNull MatchedValues months() {
        return values(FieldKind.MONTH);
    }

    public @NotNull MatchedValues daysOfWeek() {
        return values(FieldKind.DAY_OF_WEEK);
    }

    @Override
    public String toString() {
        return "CronSchedule{" + expression + "}";
    }
}
