package app.envault.secrets.domain.dto;

import java.time.Instant;
import java.util.UUID;

public record OrganizationDTO(
        UUID id,
        String name,
        int kekVersion,
        Instant createdAt,
        Instant kekRotatedAt
) {
}
