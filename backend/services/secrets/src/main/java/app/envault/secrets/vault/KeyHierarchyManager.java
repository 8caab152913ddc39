package app.envault.secrets.vault;

import app.envault.secrets.exception.AuthenticationFailedException;
import app.envault.secrets.exception.KeyUnwrapException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates, unwraps and rotates organization KEKs under the master key.
 * <p>
 * Every raw key this class hands out is a {@link KeyMaterial} the caller must close; every raw key it
 * creates internally is wiped before returning, on success and on failure alike.
 */
@Component
public class KeyHierarchyManager {

    private static final Logger log = LoggerFactory.getLogger(KeyHierarchyManager.class);

    private final MasterKey masterKey;
    private final EnvelopeCrypto crypto;
    private final SecureRandom random = new SecureRandom();

    public KeyHierarchyManager(MasterKey masterKey, EnvelopeCrypto crypto) {
        this.masterKey = masterKey;
        this.crypto = crypto;
    }

    public GeneratedKek generateOrgKek() {
        KeyMaterial kek = KeyMaterial.random(random, EnvelopeCrypto.KEY_LENGTH);
        try {
            String encryptedKek = crypto.wrap(masterKey.keyBytes(), kek.bytes());
            return new GeneratedKek(kek, encryptedKek);
        } catch (RuntimeException ex) {
            kek.close();
            throw ex;
        }
    }

    /**
     * @throws KeyUnwrapException when the wrap is corrupt or was produced under a different master key
     */
    public KeyMaterial decryptOrgKek(String encryptedKek) {
        try {
            return crypto.unwrap(masterKey.keyBytes(), encryptedKek);
        } catch (AuthenticationFailedException | IllegalArgumentException ex) {
            log.warn("Organization KEK unwrap failed masterKeyId={} errorType={}", masterKey.keyId(), ex.getClass().getSimpleName());
            throw new KeyUnwrapException("Organization KEK could not be unwrapped with the configured master key", ex);
        }
    }

    /**
     * Re-wraps every DEK in {@code deks} from the current KEK to a newly generated one. Secret values are
     * never decrypted. Any failing DEK aborts the whole rotation.
     *
     * @param currentKekVersion version of {@code oldEncryptedKek}; the new KEK gets the next integer
     */
    public KekRotation rotateOrgKek(String oldEncryptedKek, int currentKekVersion, List<WrappedDek> deks) {
        try (KeyMaterial oldKek = decryptOrgKek(oldEncryptedKek);
             GeneratedKek next = generateOrgKek()) {
            List<WrappedDek> rewrapped = new ArrayList<>(deks.size());
            for (WrappedDek dek : deks) {
                rewrapped.add(new WrappedDek(dek.versionId(), rewrapDek(dek, oldKek, next.kek())));
            }
            return new KekRotation(next.encryptedKek(), rewrapped, currentKekVersion + 1);
        }
    }

    private String rewrapDek(WrappedDek dek, KeyMaterial oldKek, KeyMaterial newKek) {
        try (KeyMaterial raw = crypto.unwrap(oldKek.bytes(), dek.encryptedDek())) {
            return crypto.wrap(newKek.bytes(), raw.bytes());
        } catch (AuthenticationFailedException | IllegalArgumentException ex) {
            throw new KeyUnwrapException("DEK of secret version " + dek.versionId() + " is not wrapped by the current KEK", ex);
        }
    }
}
