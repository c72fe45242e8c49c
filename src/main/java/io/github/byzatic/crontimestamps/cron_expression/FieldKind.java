package io.github.byzatic.crontimestamps.cron_expression;

/**
 * The five positions of a cron expression, in order, with their value domains.
 */
public enum FieldKind {
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23),
    DAY_OF_MONTH("day_of_month", 1, 31),
    MONTH("month", 1, 12),
    DAY_OF_WEEK("day_of_week", 0, 6); // 0 = Sunday

    private final String fieldName;
    private final int min;
    private final int max;

    FieldKind(String fieldName, int min, int max) {
        this.fieldName = fieldName;
        this.min = min;
        this.max = max;
    }

    public String fieldName() {
        return fieldName;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    /**
     * Range text a bare {@code *} stands for, e.g. {@code 0-59} for minutes.
     */
    public String starRange() {
        return min + "-" + max;
    }

    public boolean inDomain(int value) {
        return value >= min && value <= max;
    }

    /**
     * Zero based position inside the expression.
     */
    public int position() {
        return ordinal();
    }
}
