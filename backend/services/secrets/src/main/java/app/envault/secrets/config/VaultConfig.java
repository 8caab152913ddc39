package app.envault.secrets.config;

import app.envault.secrets.vault.MasterKey;
import app.envault.secrets.vault.VaultProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class VaultConfig {

    private static final Logger log = LoggerFactory.getLogger(VaultConfig.class);

    // Fails context startup with ConfigurationException, so the process never serves traffic without a valid key.
    @Bean
    public MasterKey masterKey(VaultProps props) {
        MasterKey masterKey = MasterKey.fromBase64(props == null ? null : props.masterKey(), props == null ? null : props.keyId());
        log.info("Vault master key loaded keyId={}", masterKey.keyId());
        return masterKey;
    }
}
