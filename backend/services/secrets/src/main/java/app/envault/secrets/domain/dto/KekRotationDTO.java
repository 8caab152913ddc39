package app.envault.secrets.domain.dto;

import java.time.Instant;
import java.util.UUID;

public record KekRotationDTO(
        UUID organizationId,
        int previousVersion,
        int newVersion,
        int rewrappedDeks,
        Instant rotatedAt
) {
}
