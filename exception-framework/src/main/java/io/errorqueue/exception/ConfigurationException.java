package io.errorqueue.exception;

/**
 * Invalid reporter or connection settings, detected before anything touches the broker.
 */
public class ConfigurationException extends ErrorQueueException {

    public ConfigurationException(String property, Object value, String reason) {
        super(
            "INVALID_CONFIGURATION",
            String.format("Invalid value '%s' for '%s': %s", value, property, reason)
        );
        with("property", property);
        with("value", value);
    }

    public static ConfigurationException blank(String property) {
        return new ConfigurationException(property, "", "must not be blank");
    }

    public static ConfigurationException outOfRange(String property, long value, long min, long max) {
        return new ConfigurationException(property, value,
                String.format("must be between %d and %d", min, max));
    }
}
