package app.envault.secrets.exception;

/**
 * Base type for every failure raised by the secrets core.
 * <p>
 * Messages must never carry plaintext secret material or raw key bytes.
 */
public abstract class SecretsException extends RuntimeException {

    protected SecretsException(String message) {
        super(message);
    }

    protected SecretsException(String message, Throwable cause) {
        super(message, cause);
    }
}
