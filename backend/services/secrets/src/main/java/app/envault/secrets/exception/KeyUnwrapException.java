package app.envault.secrets.exception;

/**
 * An organization KEK could not be unwrapped with the master key.
 * Raised for corrupted wraps and for a master key that does not match the one the KEK was wrapped with.
 */
public class KeyUnwrapException extends SecretsException {

    public KeyUnwrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
