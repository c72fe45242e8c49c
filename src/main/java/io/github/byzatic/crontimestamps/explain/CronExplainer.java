package io.github.byzatic.crontimestamps.explain;

import com.google.common.annotations.Beta;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.byzatic.crontimestamps.base_exceptions.MalformedFieldException;
import io.github.byzatic.crontimestamps.cron_expression.CronExpression;
import io.github.byzatic.crontimestamps.cron_expression.DayMatchModeResolver;
import io.github.byzatic.crontimestamps.cron_expression.DayMatchPolicy;
import io.github.byzatic.crontimestamps.cron_expression.FieldKind;
import io.github.byzatic.crontimestamps.cron_expression.FieldParser;
import io.github.byzatic.crontimestamps.cron_expression.FieldSubentry;
import org.jetbrains.annotations.NotNull;

/**
 * Debug view of an expression: for every field value that matches, which comma subentries matched it.
 * Useful to see why {@code 5-29/2,31-59/4} fires at minute 31 but not at 30.
 * Not needed for expansion itself.
 */
@Beta
public final class CronExplainer {

    private CronExplainer() {
    }

    public static @NotNull CronExplanation explain(@NotNull String cron, @NotNull DayMatchPolicy policy)
            throws MalformedFieldException {
        CronExpression expression = CronExpression.parse(cron);
        ImmutableMap.Builder<FieldKind, ImmutableList<FieldValueMatch>> fields = ImmutableMap.builder();
        for (FieldKind kind : FieldKind.values()) {
            ImmutableList<FieldSubentry> subentries;
            try {
                subentries = FieldParser.parseSubentries(expression.field(kind), kind);
            } catch (MalformedFieldException e) {
                throw e.withCron(cron);
            }
            fields.put(kind, explainField(subentries, kind));
        }
        return new CronExplanation(expression, DayMatchModeResolver.resolve(expression, policy), fields.build());
    }

    static ImmutableList<FieldValueMatch> explainField(ImmutableList<FieldSubentry> subentries, FieldKind kind) {
        ImmutableList.Builder<FieldValueMatch> out = ImmutableList.builder();
        for (int v = kind.min(); v <= kind.max(); v++) {
            ImmutableList.Builder<String> matching = ImmutableList.builder();
            boolean any = false;
            for (FieldSubentry s : subentries) {
                if (s.matches(v)) {
                    matching.add(s.text());
                    any = true;
                }
            }
            if (any) out.add(new FieldValueMatch(v, matching.build()));
        }
        return out.build();
    }
}
