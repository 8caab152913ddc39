package app.envault.secrets.domain.request;

import java.util.Objects;
import java.util.UUID;

public record RollbackSecretRequest(
        UUID organizationId,
        UUID secretId,
        int targetVersion,
        UUID actorId
) {

    public RollbackSecretRequest {
        Objects.requireNonNull(organizationId, "organizationId is required");
        Objects.requireNonNull(secretId, "secretId is required");
        Objects.requireNonNull(actorId, "actorId is required");
        if (targetVersion < 1) {
            throw new IllegalArgumentException("targetVersion must be >= 1");
        }
    }
}
