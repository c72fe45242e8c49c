package io.github.byzatic.crontimestamps.explain;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.byzatic.crontimestamps.cron_expression.CronExpression;
import io.github.byzatic.crontimestamps.cron_expression.DayMatchMode;
import io.github.byzatic.crontimestamps.cron_expression.FieldKind;
import org.jetbrains.annotations.NotNull;

import java.util.Optional;

public final class CronExplanation {
    private final CronExpression expression;
    private final DayMatchMode dayMatchMode;
    private final ImmutableMap<FieldKind, ImmutableList<FieldValueMatch>> fields;

    CronExplanation(CronExpression expression, DayMatchMode dayMatchMode,
                    ImmutableMap<FieldKind, ImmutableList<FieldValueMatch>> fields) {
        this.expression = expression;
        this.dayMatchMode = dayMatchMode;
        this.fields = fields;
    }

    public @NotNull CronExpression expression() {
        return expression;
    }

    public @NotNull DayMatchMode dayMatchMode() {
        return dayMatchMode;
    }

    public @NotNull ImmutableList<FieldValueMatch> matches(@NotNull FieldKind kind) {
        return fields.get(kind);
    }

    public @NotNull Optional<FieldValueMatch> match(@NotNull FieldKind kind, int value) {
        for (FieldValueMatch m : fields.get(kind)) {
            if (m.value() == value) return Optional.of(m);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CronExplanation{'").append(expression).append("', ")
                .append(dayMatchMode);
        fields.forEach((kind, matches) -> sb.append(", ").append(kind.fieldName()).append('=').append(matches));
        return sb.append('}').toString();
    }
}
