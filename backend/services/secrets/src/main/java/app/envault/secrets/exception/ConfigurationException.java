package app.envault.secrets.exception;

/**
 * Fatal startup misconfiguration, e.g. a missing or malformed master key.
 */
public class ConfigurationException extends SecretsException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
