package app.envault.secrets.exception;

public class ConflictException extends SecretsException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
