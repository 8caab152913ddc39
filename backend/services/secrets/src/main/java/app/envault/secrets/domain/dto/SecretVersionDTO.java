package app.envault.secrets.domain.dto;

import java.time.Instant;
import java.util.UUID;

public record SecretVersionDTO(
        UUID versionId,
        int version,
        int kekVersion,
        String algorithm,
        boolean current,
        UUID createdBy,
        Instant createdAt
) {
}
