package app.envault.secrets.vault;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlindIndexerTest {

    private static final BlindIndexProps CHEAP = new BlindIndexProps(1024, 8, 1);

    private final BlindIndexer indexer = new BlindIndexer(master("0123456789abcdef0123456789abcdef"), CHEAP);

    @Test
    void sameNameAndSaltGiveSameToken() {
        String salt = indexer.newOrganizationSalt();

        assertThat(indexer.createBlindIndex("DB_PASSWORD", salt))
                .isEqualTo(indexer.createBlindIndex("DB_PASSWORD", salt));
    }

    @Test
    void tokenIs32BytesOfBase64() {
        String token = indexer.createBlindIndex("API_KEY", indexer.newOrganizationSalt());

        assertThat(Base64.getDecoder().decode(token)).hasSize(32);
        assertThat(token).doesNotContain("API_KEY");
    }

    @Test
    void differentNamesGiveDifferentTokens() {
        String salt = indexer.newOrganizationSalt();

        assertThat(indexer.createBlindIndex("DB_PASSWORD", salt))
                .isNotEqualTo(indexer.createBlindIndex("DB_PASSWORD_2", salt));
    }

    @Test
    void differentOrganizationSaltsGiveDifferentTokens() {
        assertThat(indexer.createBlindIndex("DB_PASSWORD", indexer.newOrganizationSalt()))
                .isNotEqualTo(indexer.createBlindIndex("DB_PASSWORD", indexer.newOrganizationSalt()));
    }

    @Test
    void tokenDependsOnMasterKey() {
        BlindIndexer other = new BlindIndexer(master("fedcba9876543210fedcba9876543210"), CHEAP);
        String salt = indexer.newOrganizationSalt();

        assertThat(indexer.createBlindIndex("DB_PASSWORD", salt))
                .isNotEqualTo(other.createBlindIndex("DB_PASSWORD", salt));
    }

    @Test
    void newOrganizationSaltIsRandom16Bytes() {
        String first = indexer.newOrganizationSalt();

        assertThat(Base64.getDecoder().decode(first)).hasSize(16);
        assertThat(first).isNotEqualTo(indexer.newOrganizationSalt());
    }

    @Test
    void rejectsMissingSalt() {
        assertThatThrownBy(() -> indexer.createBlindIndex("DB_PASSWORD", " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static MasterKey master(String ascii) {
        return MasterKey.of(ascii.getBytes(StandardCharsets.US_ASCII), "test");
    }
}
