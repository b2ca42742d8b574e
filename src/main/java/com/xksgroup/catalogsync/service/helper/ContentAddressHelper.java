package com.xksgroup.catalogsync.service.helper;

import com.xksgroup.catalogsync.exception.InvalidResourceKindException;
import com.xksgroup.catalogsync.exception.MissingEpisodeIndexException;
import com.xksgroup.catalogsync.model.ResourceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;

/**
 * Derives object-storage keys from record identity.
 * <p>
 * Path segments are AES-CBC ciphertexts under a key and IV that are both fixed by the configured
 * secret, so the same title and id always land on the same key across processes and restarts.
 */
@Slf4j
@Component
public class ContentAddressHelper {

    private static final int AES_IV_SIZE = 16;  // 128 bits
    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
    private static final String COVER_FILE = "cover.jpg";

    private final SecretKeySpec aesKey;
    private final IvParameterSpec aesIv;
    private final String prefix;

    public ContentAddressHelper(@Value("${mirror.key-secret:default_key_12345}") String secret,
                                @Value("${mirror.key-prefix:video_data}") String prefix) {
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        this.aesKey = new SecretKeySpec(digest("SHA-256", secretBytes), "AES");
        this.aesIv = new IvParameterSpec(Arrays.copyOf(digest("MD5", secretBytes), AES_IV_SIZE));
        this.prefix = prefix.replaceAll("/+$", "");
        log.info("ContentAddressHelper initialized with key prefix '{}'", this.prefix);
    }

    /**
     * Cover key: {@code prefix/id/E(title|id)/cover.jpg}.
     */
    public String coverKey(String title, String externalId) {
        return derive(title, externalId, ResourceKind.COVER, null);
    }

    /**
     * Episode key: {@code prefix/id/E(title|id)/n/E(title|id|n)}, with {@code n} starting at 1.
     */
    public String mediaKey(String title, String externalId, int episodeIndex) {
        return derive(title, externalId, ResourceKind.MEDIA_SEGMENT, episodeIndex);
    }

    public String derive(String title, String externalId, ResourceKind kind, Integer episodeIndex) {
        if (kind == null) {
            throw new InvalidResourceKindException("Resource kind is required");
        }
        String vodSegment = encrypt(title + "|" + externalId);

        return switch (kind) {
            case COVER -> String.join("/", prefix, externalId, vodSegment, COVER_FILE);
            case MEDIA_SEGMENT -> {
                if (episodeIndex == null) {
                    throw new MissingEpisodeIndexException("Episode index is required for media keys (id: " + externalId + ")");
                }
                if (episodeIndex < 1) {
                    throw new MissingEpisodeIndexException("Episode index must start at 1, got " + episodeIndex);
                }
                String episodeSegment = encrypt(title + "|" + externalId + "|" + episodeIndex);
                yield String.join("/", prefix, externalId, vodSegment, String.valueOf(episodeIndex), episodeSegment);
            }
        };
    }

    /**
     * Parses a kind name as it appears in configuration or logs ({@code m3u8}, {@code cover}, or the enum name).
     */
    public static ResourceKind parseKind(String name) {
        if (name == null) {
            throw new InvalidResourceKindException("Resource kind is required");
        }
        return switch (name.trim().toLowerCase()) {
            case "m3u8", "media", "media_segment" -> ResourceKind.MEDIA_SEGMENT;
            case "cover" -> ResourceKind.COVER;
            default -> throw new InvalidResourceKindException("Unsupported resource kind: " + name);
        };
    }

    /**
     * Recovers the plaintext of an encrypted path segment. Used when tracing a stored object back to its record.
     */
    public String reveal(String segment) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, aesKey, aesIv);
            byte[] plain = cipher.doFinal(Base64.getUrlDecoder().decode(segment));
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Not a path segment produced by this key: " + segment, e);
        }
    }

    private String encrypt(String plaintext) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, aesKey, aesIv);
            byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(encrypted);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES is not available in this JVM", e);
        }
    }

    private static byte[] digest(String algorithm, byte[] input) {
        try {
            return MessageDigest.getInstance(algorithm).digest(input);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(algorithm + " is not available in this JVM", e);
        }
    }
}
