package app.envault.secrets.domain.request;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * @param description optional
 * @param tags        optional, blank entries are dropped
 */
public record CreateSecretRequest(
        SecretCoordinates coordinates,
        UUID actorId,
        String value,
        String description,
        List<String> tags
) {

    public CreateSecretRequest {
        Objects.requireNonNull(coordinates, "coordinates are required");
        Objects.requireNonNull(actorId, "actorId is required");
        Objects.requireNonNull(value, "value is required");
    }
}
