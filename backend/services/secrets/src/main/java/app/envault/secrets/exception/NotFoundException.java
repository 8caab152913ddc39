package app.envault.secrets.exception;

public class NotFoundException extends SecretsException {

    public NotFoundException(String message) {
        super(message);
    }
}
