package app.envault.secrets.domain.dto;

import java.util.List;

public record BulkUpsertResultDTO(
        int created,
        int updated,
        List<SecretDTO> secrets
) {
}
