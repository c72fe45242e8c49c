package io.github.byzatic.crontimestamps.base_exceptions;

/**
 * The requested window covers more candidate days than the configured maximum date range.
 * Raised before any timestamp is produced.
 */
public class WindowTooLargeException extends CronExpansionException {
    private final long requestedDays;
    private final long maxDays;

    public WindowTooLargeException(long requestedDays, long maxDays) {
        super("Window spans " + requestedDays + " days, maximum allowed is " + maxDays);
        this.requestedDays = requestedDays;
        this.maxDays = maxDays;
    }

    public long getRequestedDays() {
        return requestedDays;
    }

    public long getMaxDays() {
        return maxDays;
    }
}
