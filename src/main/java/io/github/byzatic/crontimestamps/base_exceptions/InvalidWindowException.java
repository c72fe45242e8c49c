package io.github.byzatic.crontimestamps.base_exceptions;

/**
 * Window bounds are inverted or empty ({@code start >= end}), or {@code daysForward} is negative.
 */
public class InvalidWindowException extends CronExpansionException {
    public InvalidWindowException(String message) {
        super(message);
    }

    public InvalidWindowException(Throwable cause) {
        super(cause);
    }

    public InvalidWindowException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidWindowException(Throwable cause, String message) {
        super(message, cause);
    }
}
