package app.envault.secrets.domain.request;

import java.util.Objects;
import java.util.UUID;

/**
 * @param permanent {@code false} soft-deletes and keeps the version chain; {@code true} purges it irreversibly
 */
public record DeleteSecretRequest(
        SecretCoordinates coordinates,
        UUID actorId,
        boolean permanent
) {

    public DeleteSecretRequest {
        Objects.requireNonNull(coordinates, "coordinates are required");
        Objects.requireNonNull(actorId, "actorId is required");
    }
}
