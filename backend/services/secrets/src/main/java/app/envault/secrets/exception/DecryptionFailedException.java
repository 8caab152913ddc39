package app.envault.secrets.exception;

public class DecryptionFailedException extends SecretsException {

    public DecryptionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
