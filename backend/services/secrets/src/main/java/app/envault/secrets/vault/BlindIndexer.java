package app.envault.secrets.vault;

import org.bouncycastle.crypto.generators.SCrypt;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Deterministic, memory-hard tokens for equality search over secret names.
 * <p>
 * The organization salt is first keyed with a master-key-derived index key, so a stolen database alone
 * is not enough to test name guesses. Salts must be unique per organization; see
 * {@link #newOrganizationSalt()}.
 */
@Component
public class BlindIndexer {

    private static final byte[] INDEX_KEY_LABEL = "envault/blind-index/v1".getBytes(StandardCharsets.UTF_8);
    private static final int TOKEN_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    private final byte[] indexKey;
    private final int cost;
    private final int blockSize;
    private final int parallelism;
    private final SecureRandom random = new SecureRandom();

    public BlindIndexer(MasterKey masterKey, BlindIndexProps props) {
        this.indexKey = hmac(masterKey.keyBytes(), INDEX_KEY_LABEL);
        this.cost = props.cost();
        this.blockSize = props.blockSize();
        this.parallelism = props.parallelism();
    }

    public String createBlindIndex(String name, String orgScopedSalt) {
        if (name == null) {
            throw new IllegalArgumentException("name is required");
        }
        if (orgScopedSalt == null || orgScopedSalt.isBlank()) {
            throw new IllegalArgumentException("organization salt is required");
        }
        byte[] keyedSalt = hmac(indexKey, orgScopedSalt.getBytes(StandardCharsets.UTF_8));
        try {
            byte[] token = SCrypt.generate(name.getBytes(StandardCharsets.UTF_8), keyedSalt, cost, blockSize, parallelism, TOKEN_LENGTH);
            return Base64.getEncoder().encodeToString(token);
        } finally {
            Arrays.fill(keyedSalt, (byte) 0);
        }
    }

    public String newOrganizationSalt() {
        byte[] salt = new byte[SALT_LENGTH];
        random.nextBytes(salt);
        return Base64.getEncoder().encodeToString(salt);
    }

    private static byte[] hmac(byte[] key, byte[] data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key, "HmacSHA256"));
            return mac.doFinal(data);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HmacSHA256 is not available", ex);
        }
    }
}
