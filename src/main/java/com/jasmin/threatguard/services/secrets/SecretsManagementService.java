package com.jasmin.threatguard.services.secrets;

import com.jasmin.threatguard.detectors.DetectorUtils;
import com.jasmin.threatguard.models.SecretRotationRecord;
import com.jasmin.threatguard.repositories.SecretRotationRepository;
import com.jasmin.threatguard.services.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * AES-256-GCM encryption under the master key, rotation of the signing secrets and API key helpers.
 */
@Service
@Slf4j
public class SecretsManagementService {

    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH_BYTES = 32;
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH = 16;
    private static final HexFormat HEX = HexFormat.of();

    private final SecretRotationRepository rotationRepository;
    private final AuditService auditService;
    private final SecretsProperties props;
    private final InstantSource clock;
    private final SecretKey masterKey;
    private final SecureRandom secureRandom = new SecureRandom();

    // Values in use by this process, never persisted
    private final Map<SecretType, String> current = new EnumMap<>(SecretType.class);

    public SecretsManagementService(SecretRotationRepository rotationRepository,
                                    AuditService auditService,
                                    SecretsProperties props,
                                    InstantSource clock) {
        this.rotationRepository = rotationRepository;
        this.auditService = auditService;
        this.props = props;
        this.clock = clock;
        this.masterKey = loadMasterKey(props.getMasterKey());
        props.getCurrent().forEach((type, value) -> {
            if (value != null && !value.isBlank()) current.put(type, value);
        });
    }

    private SecretKey loadMasterKey(String hex) {
        byte[] key;
        if (hex == null || hex.isBlank()) {
            key = new byte[KEY_LENGTH_BYTES];
            secureRandom.nextBytes(key);
            log.warn("No master key configured, generated a random key for this process. Encrypted data will not survive a restart");
        } else {
            try {
                key = HEX.parseHex(hex.trim());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("secrets.master-key must be hex encoded", e);
            }
            if (key.length != KEY_LENGTH_BYTES) {
                throw new IllegalStateException("secrets.master-key must be " + KEY_LENGTH_BYTES * 2 + " hex characters");
            }
        }
        return new SecretKeySpec(key, ALGORITHM);
    }

    /* ------------------------------ Encryption ------------------------------ */

    public EncryptedPayload encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext must not be null");
        }
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, masterKey, new GCMParameterSpec(TAG_LENGTH * 8, iv));

            // GCM appends the tag to the ciphertext
            byte[] out = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            byte[] ciphertext = Arrays.copyOfRange(out, 0, out.length - TAG_LENGTH);
            byte[] tag = Arrays.copyOfRange(out, out.length - TAG_LENGTH, out.length);
            return new EncryptedPayload(HEX.formatHex(ciphertext), HEX.formatHex(iv), HEX.formatHex(tag));
        } catch (GeneralSecurityException e) {
            throw new SecretsException("Encryption failed", e);
        }
    }

    /**
     * Decrypts and authenticates the payload. Any modification of the ciphertext, IV or tag fails with
     * {@link SecretsException}.
     */
    public String decrypt(EncryptedPayload payload) {
        try {
            byte[] ciphertext = HEX.parseHex(payload.getCiphertext());
            byte[] iv = HEX.parseHex(payload.getIv());
            byte[] tag = HEX.parseHex(payload.getAuthTag());
            if (iv.length != IV_LENGTH || tag.length != TAG_LENGTH) {
                throw new SecretsException("Malformed encrypted payload", null);
            }

            byte[] input = new byte[ciphertext.length + tag.length];
            System.arraycopy(ciphertext, 0, input, 0, ciphertext.length);
            System.arraycopy(tag, 0, input, ciphertext.length, tag.length);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, masterKey, new GCMParameterSpec(TAG_LENGTH * 8, iv));
            return new String(cipher.doFinal(input), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new SecretsException("Decryption failed", e);
        }
    }

    /* ------------------------------ Rotation ------------------------------ */

    public RotationResult rotateJwtSecret(String rotatedBy, String reason) {
        return rotate(SecretType.JWT_SECRET, rotatedBy, reason);
    }

    public RotationResult rotateSessionSecret(String rotatedBy, String reason) {
        return rotate(SecretType.SESSION_SECRET, rotatedBy, reason);
    }

    /**
     * Replaces the secret with a random one. The new value is only returned here; the history keeps hashes.
     */
    public synchronized RotationResult rotate(SecretType type, String rotatedBy, String reason) {
        try {
            String newSecret = randomHex(props.getSecretBytes());
            String oldSecret = current.get(type);
            Instant now = clock.instant();
            String newHash = DetectorUtils.sha256Hex(newSecret);

            rotationRepository.save(SecretRotationRecord.builder()
                    .secretType(type.value())
                    .rotatedAt(now)
                    .rotatedBy(rotatedBy)
                    .oldSecretHash(oldSecret == null ? null : DetectorUtils.sha256Hex(oldSecret))
                    .newSecretHash(newHash)
                    .reason(reason == null ? "scheduled_rotation" : reason)
                    .build());
            current.put(type, newSecret);

            auditService.record(type.value() + "_rotated", rotatedBy, null, Map.of("newSecretHash", newHash));
            log.warn("Secret rotated: type={} rotatedBy={}. Update the deployment configuration", type.value(), rotatedBy);
            return RotationResult.builder()
                    .secretType(type)
                    .success(true)
                    .newSecret(newSecret)
                    .rotatedAt(now)
                    .build();
        } catch (Exception e) {
            throw new SecretRotationException(type, e);
        }
    }

    /** Rotates every secret type that is due; a failure of one type does not stop the others. */
    public List<RotationResult> rotateAll(String rotatedBy) {
        List<RotationResult> results = new ArrayList<>();
        for (SecretType type : SecretType.values()) {
            if (!checkRotationNeeded(type)) continue;
            try {
                results.add(rotate(type, rotatedBy, "scheduled_rotation"));
            } catch (SecretRotationException e) {
                log.error("Failed to rotate secret: type={}", type.value(), e);
                results.add(RotationResult.builder()
                        .secretType(type)
                        .success(false)
                        .rotatedAt(clock.instant())
                        .error(e.getCause() == null ? e.getMessage() : e.getCause().getMessage())
                        .build());
            }
        }
        return results;
    }

    public boolean checkRotationNeeded(SecretType type) {
        Optional<SecretRotationRecord> latest = rotationRepository.findLatest(type.value());
        if (latest.isEmpty() || latest.get().getRotatedAt() == null) {
            return true;
        }
        Duration age = Duration.between(latest.get().getRotatedAt(), clock.instant());
        return age.compareTo(Duration.ofDays(props.getRotationIntervalDays())) >= 0;
    }

    public List<RotationStatus> getRotationStatus() {
        List<RotationStatus> statuses = new ArrayList<>();
        for (SecretType type : SecretType.values()) {
            Instant last = rotationRepository.findLatest(type.value()).map(SecretRotationRecord::getRotatedAt).orElse(null);
            statuses.add(new RotationStatus(type, last, checkRotationNeeded(type)));
        }
        return statuses;
    }

    public List<SecretRotationRecord> getRotationHistory(SecretType type, int limit) {
        return rotationRepository.findHistory(type == null ? null : type.value(), limit);
    }

    /* ------------------------------ API keys ------------------------------ */

    public String generateApiKey() {
        return props.getApiKeyPrefix() + randomHex(props.getApiKeyBytes());
    }

    public String hashApiKey(String apiKey) {
        return DetectorUtils.sha256Hex(apiKey);
    }

    public SecretStrength checkSecretStrength(String secret) {
        List<String> issues = new ArrayList<>();
        int score = 0;
        int length = secret == null ? 0 : secret.length();

        if (length >= 64) score += 30;
        else if (length >= 32) score += 20;
        else if (length >= 16) score += 10;
        else issues.add("Secret too short");

        long uniqueChars = secret == null ? 0 : secret.chars().distinct().count();
        if (uniqueChars >= 32) score += 30;
        else if (uniqueChars >= 16) score += 20;
        else issues.add("Low entropy");

        if (secret != null) {
            if (secret.chars().anyMatch(c -> c >= 'a' && c <= 'z')) score += 10;
            if (secret.chars().anyMatch(c -> c >= 'A' && c <= 'Z')) score += 10;
            if (secret.chars().anyMatch(c -> c >= '0' && c <= '9')) score += 10;
            if (secret.chars().anyMatch(c -> !isAsciiAlphanumeric(c))) score += 10;
        }
        return new SecretStrength(score, score >= props.getStrongScore() && issues.isEmpty(), issues);
    }

    private static boolean isAsciiAlphanumeric(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    private String randomHex(int bytes) {
        byte[] buf = new byte[bytes];
        secureRandom.nextBytes(buf);
        return HEX.formatHex(buf);
    }
}
