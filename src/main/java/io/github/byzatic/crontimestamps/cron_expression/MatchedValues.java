package io.github.byzatic.crontimestamps.cron_expression;

import com.google.common.collect.ImmutableSortedSet;
import org.jetbrains.annotations.NotNull;

import java.util.BitSet;
import java.util.Objects;

/**
 * The concrete values one cron field matches, stored as a bit per domain value.
 */
public final class MatchedValues {
    private final FieldKind kind;
    private final BitSet bits;

    MatchedValues(@NotNull FieldKind kind, @NotNull BitSet bits) {
        this.kind = Objects.requireNonNull(kind);
        this.bits = (BitSet) bits.clone();
    }

    public @NotNull FieldKind kind() {
        return kind;
    }

    public boolean contains(int value) {
        return value >= 0 && bits.get(value);
    }

    public boolean isEmpty() {
        return bits.isEmpty();
    }

    /**
     * {@code true} when every value of the field's domain matches.
     */
    public boolean isFull() {
        return bits.cardinality() == kind.max() - kind.min() + 1;
    }

    public int size() {
        return bits.cardinality();
    }

    /**
     * Matched values in ascending order.
     */
    public int[] toArray() {
        return bits.stream().toArray();
    }

    public @NotNull ImmutableSortedSet<Integer> asSet() {
        ImmutableSortedSet.Builder<Integer> out = ImmutableSortedSet.naturalOrder();
        bits.stream().forEach(out::add);
        return out.build();
    }

    /**
     * Copy keeping only values {@code <= maxValue}; used to drop days past the end of a month.
     */
    public @NotNull MatchedValues upTo(int maxValue) {
        if (maxValue >= kind.max()) {
            return this;
        }
        BitSet clipped = (BitSet) bits.clone();
        clipped.clear(Math.max(0, maxValue + 1), kind.max() + 1);
        return new MatchedValues(kind, clipped);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchedValues)) return false;
        MatchedValues that = (MatchedValues) o;
        return kind == that.kind && bits.equals(that.bits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bits);
    }

    @Override
    public String toString() {
        return kind.fieldName() + "=" + bits;
    }
}
