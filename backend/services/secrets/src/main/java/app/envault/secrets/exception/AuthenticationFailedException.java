package app.envault.secrets.exception;

/**
 * AES-GCM tag verification failed. No plaintext is ever produced alongside this exception.
 */
public class AuthenticationFailedException extends SecretsException {

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
