package io.github.byzatic.crontimestamps.base_exceptions;

import io.github.byzatic.crontimestamps.cron_expression.FieldKind;
import org.jetbrains.annotations.Nullable;

/**
 * A cron field (or the expression as a whole) could not be parsed into ranges and steps.
 * Carries the offending field and, once known, the full cron string.
 */
public class MalformedFieldException extends CronExpansionException {
    private final @Nullable FieldKind fieldKind;
    private final @Nullable String fieldText;
    private final @Nullable String cron;

    public MalformedFieldException(String message) {
        this(message, null, null, null, null);
    }

    public MalformedFieldException(String message, Throwable cause) {
        this(message, null, null, null, cause);
    }

    public MalformedFieldException(String message, @Nullable FieldKind fieldKind, @Nullable String fieldText) {
        this(message, fieldKind, fieldText, null, null);
    }

    public MalformedFieldException(String message, @Nullable FieldKind fieldKind, @Nullable String fieldText,
                                   @Nullable String cron, @Nullable Throwable cause) {
        super(message, cause);
        this.fieldKind = fieldKind;
        this.fieldText = fieldText;
        this.cron = cron;
    }

    /**
     * Copy of this error bound to the expression it was raised for.
     */
    public MalformedFieldException withCron(String cron) {
        return new MalformedFieldException(getMessage() + " in cron '" + cron + "'", fieldKind, fieldText, cron, this);
    }

    public @Nullable FieldKind getFieldKind() {
        return fieldKind;
    }

    public @Nullable String getFieldText() {
        return fieldText;
    }

    public @Nullable String getCron() {
        return cron;
    }
}
