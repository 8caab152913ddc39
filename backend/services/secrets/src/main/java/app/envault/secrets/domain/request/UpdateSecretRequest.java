package app.envault.secrets.domain.request;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A {@code null} field is left unchanged. A non-null {@code value} appends a new version;
 * {@code description} and {@code tags} alone only touch the secret row.
 */
public record UpdateSecretRequest(
        SecretCoordinates coordinates,
        UUID actorId,
        String value,
        String description,
        List<String> tags
) {

    public UpdateSecretRequest {
        Objects.requireNonNull(coordinates, "coordinates are required");
        Objects.requireNonNull(actorId, "actorId is required");
    }

    public boolean changesValue() {
        return value != null;
    }

    public boolean changesMetadata() {
        return description != null || tags != null;
    }
}
