package app.envault.secrets.vault;

import app.envault.secrets.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MasterKeyTest {

    @Test
    void fromBase64_acceptsExactly32Bytes() {
        byte[] raw = new byte[32];
        new SecureRandom().nextBytes(raw);

        MasterKey key = MasterKey.fromBase64(Base64.getEncoder().encodeToString(raw), "prod-2026");

        assertThat(key.keyBytes()).isEqualTo(raw);
        assertThat(key.keyId()).isEqualTo("prod-2026");
    }

    @Test
    void fromBase64_defaultsKeyId() {
        MasterKey key = MasterKey.fromBase64(Base64.getEncoder().encodeToString(new byte[32]), null);

        assertThat(key.keyId()).isEqualTo("local-master");
    }

    @Test
    void fromBase64_rejectsMissingKey() {
        assertThatThrownBy(() -> MasterKey.fromBase64("  ", null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("required");
    }

    @Test
    void fromBase64_rejectsNonBase64() {
        assertThatThrownBy(() -> MasterKey.fromBase64("not base64 at all!", null))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void fromBase64_rejectsWrongLength() {
        assertThatThrownBy(() -> MasterKey.fromBase64(Base64.getEncoder().encodeToString(new byte[16]), null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("32 bytes");
    }

    @Test
    void toStringDoesNotLeakKey() {
        byte[] raw = new byte[32];
        raw[0] = 42;
        MasterKey key = MasterKey.of(raw, "k1");

        assertThat(key.toString()).isEqualTo("MasterKey[keyId=k1]");
    }
}
