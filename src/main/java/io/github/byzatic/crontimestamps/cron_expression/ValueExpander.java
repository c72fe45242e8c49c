package io.github.byzatic.crontimestamps.cron_expression;

import com.google.common.collect.ImmutableSortedSet;
import org.jetbrains.annotations.NotNull;

import java.util.BitSet;
import java.util.Collection;

/**
 * Materializes the integers matched by parsed subentries. Subentries of one field are or-ed together.
 */
public final class ValueExpander {

    private ValueExpander() {
    }

    /**
     * All domain values {@code v} with {@code start <= v <= end} and {@code (v - start) % step == 0}.
     */
    public static @NotNull ImmutableSortedSet<Integer> expand(@NotNull FieldSubentry subentry, @NotNull FieldKind kind) {
        BitSet bits = new BitSet(kind.max() + 1);
        set(subentry, kind, bits);
        ImmutableSortedSet.Builder<Integer> out = ImmutableSortedSet.naturalOrder();
        bits.stream().forEach(out::add);
        return out.build();
    }

    public static @NotNull MatchedValues expandField(@NotNull Collection<FieldSubentry> subentries,
                                                     @NotNull FieldKind kind) {
        BitSet bits = new BitSet(kind.max() + 1);
        for (FieldSubentry subentry : subentries) {
            set(subentry, kind, bits);
        }
        return new MatchedValues(kind, bits);
    }

    private static void set(FieldSubentry subentry, FieldKind kind, BitSet out) {
        int from = Math.max(subentry.rangeStart(), kind.min());
        int to = Math.min(subentry.rangeEnd(), kind.max());
        for (int v = from; v <= to; v++) {
            if ((v - subentry.rangeStart()) % subentry.step() == 0) out.set(v);
        }
    }
}
