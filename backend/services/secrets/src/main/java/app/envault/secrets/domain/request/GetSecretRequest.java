package app.envault.secrets.domain.request;

import java.util.Objects;
import java.util.UUID;

public record GetSecretRequest(
        SecretCoordinates coordinates,
        UUID actorId,
        boolean includeValue
) {

    public GetSecretRequest {
        Objects.requireNonNull(coordinates, "coordinates are required");
        Objects.requireNonNull(actorId, "actorId is required");
    }
}
