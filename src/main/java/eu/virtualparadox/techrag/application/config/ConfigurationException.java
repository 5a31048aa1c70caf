package eu.virtualparadox.techrag.application.config;

/**
 * Invalid or incomplete configuration detected at startup.
 */
public class ConfigurationException extends IllegalStateException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
