package io.github.byzatic.crontimestamps.explain;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * One matched value of a field together with the subentries (normalized text, comma order) that produced it.
 */
public final class FieldValueMatch {
    private final int value;
    private final ImmutableList<String> subentries;

    FieldValueMatch(int value, @NotNull ImmutableList<String> subentries) {
        this.value = value;
        this.subentries = Objects.requireNonNull(subentries);
    }

    public int value() {
        return value;
    }

    public @NotNull ImmutableList<String> subentries() {
        return subentries;
    }

    /**
     * Subentries joined with {@code ", "}, e.g. {@code "0-59/15, 30"}.
     */
    public @NotNull String matchingSubentriesList() {
        return String.join(", ", subentries);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldValueMatch)) return false;
        FieldValueMatch that = (FieldValueMatch) o;
        return value == that.value && subentries.equals(that.subentries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, subentries);
    }

    @Override
    public String toString() {
        return value + " <- [" + matchingSubentriesList() + "]";
    }
}
