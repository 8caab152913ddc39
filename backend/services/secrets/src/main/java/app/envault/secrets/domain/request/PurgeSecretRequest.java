package app.envault.secrets.domain.request;

import java.util.Objects;
import java.util.UUID;

/**
 * Permanent removal by id, for active and soft-deleted secrets alike.
 */
public record PurgeSecretRequest(
        UUID organizationId,
        UUID secretId,
        UUID actorId
) {

    public PurgeSecretRequest {
        Objects.requireNonNull(organizationId, "organizationId is required");
        Objects.requireNonNull(secretId, "secretId is required");
        Objects.requireNonNull(actorId, "actorId is required");
    }
}
