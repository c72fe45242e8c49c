package io.github.byzatic.crontimestamps.base_exceptions;

/**
 * Unrecognized configuration value, e.g. an unknown day match mode.
 */
public class InvalidConfigurationException extends CronExpansionException {
    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(Throwable cause) {
        super(cause);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidConfigurationException(Throwable cause, String message) {
        super(message, cause);
    }
}
