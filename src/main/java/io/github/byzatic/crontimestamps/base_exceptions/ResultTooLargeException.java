package io.github.byzatic.crontimestamps.base_exceptions;

/**
 * Eager expansion of a single expression produced more trigger timestamps than the configured cap.
 */
public class ResultTooLargeException extends CronExpansionException {
    private final String cron;
    private final long maxTriggers;

    public ResultTooLargeException(String cron, long maxTriggers) {
        super("Cron '" + cron + "' produces more than " + maxTriggers + " timestamps in the requested window");
        this.cron = cron;
        this.maxTriggers = maxTriggers;
    }

    public String getCron() {
        return cron;
    }

    public long getMaxTriggers() {
        return maxTriggers;
    }
}
