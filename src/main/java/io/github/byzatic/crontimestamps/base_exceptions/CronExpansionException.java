package io.github.byzatic.crontimestamps.base_exceptions;

/**
 * Base class of every failure raised while turning cron expressions into trigger timestamps.
 */
public class CronExpansionException extends Exception {
    public CronExpansionException(String message) {
        super(message);
    }

    public CronExpansionException(Throwable cause) {
        super(cause);
    }

    public CronExpansionException(String message, Throwable cause) {
        super(message, cause);
    }

    public CronExpansionException(Throwable cause, String message) {
        super(message, cause);
    }
}
