package app.envault.secrets.domain.request;

import java.util.Objects;
import java.util.UUID;

public record RotateKekRequest(
        UUID organizationId,
        UUID actorId
) {

    public RotateKekRequest {
        Objects.requireNonNull(organizationId, "organizationId is required");
        Objects.requireNonNull(actorId, "actorId is required");
    }
}
