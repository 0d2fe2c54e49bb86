package biz.kryukov.dev.svcwatch;

/**
 * Invalid engine configuration.
 */
public class ConfigurationException extends SvcWatchException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
