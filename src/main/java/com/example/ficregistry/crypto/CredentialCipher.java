package com.example.ficregistry.crypto;

import com.example.ficregistry.models.EncryptedField;
import com.example.ficregistry.models.PersonColumn;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;

/**
 * Field-level AES-256-GCM encryption. Tokens look like {@code enc:v1:<base64url>} where the
 * payload is {@code iv || ciphertext || tag}. Values that do not have that shape are
 * treated as legacy plaintext and pass through {@link #decrypt(String)} unchanged.
 *
 * <p>The key is read from (or created at) the key-store path on first use and held for the
 * life of the instance. There is no rotation.
 */
@Slf4j
public class CredentialCipher {

    public static final String TOKEN_PREFIX = "enc:v1:";

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH_BYTES = 32;
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 16;

    // prefix + base64url of iv, tag and at least one ciphertext byte
    private static final int MIN_TOKEN_LENGTH = TOKEN_PREFIX.length()
            + (int) Math.ceil((GCM_IV_LENGTH + GCM_TAG_LENGTH + 1) * 4 / 3.0);
    private static final Pattern BASE64URL = Pattern.compile("^[A-Za-z0-9_-]+={0,2}$");

    private static final Set<PosixFilePermission> KEY_FILE_PERMISSIONS = EnumSet.of(
            PosixFilePermission.OWNER_READ,
            PosixFilePermission.OWNER_WRITE
    );

    private final Path keyPath;
    private final SecureRandom secureRandom = new SecureRandom();
    private volatile SecretKey key;

    public CredentialCipher(Path keyPath) {
        this.keyPath = keyPath;
    }

    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return "";
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key(), new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] combined = ByteBuffer.allocate(iv.length + sealed.length)
                    .put(iv)
                    .put(sealed)
                    .array();
            return TOKEN_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(combined);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to encrypt field value", ex);
        }
    }

    /**
     * Wraps a stored value of a sensitive column, recording whether it is ciphertext.
     */
    public EncryptedField inspect(PersonColumn column, String storedValue) {
        return new EncryptedField(column, storedValue == null ? "" : storedValue.trim(), looksEncrypted(storedValue));
    }

    /**
     * Shape check only: marker prefix, length floor and base64url body. It cannot prove the
     * token was produced with the current key.
     */
    public boolean looksEncrypted(String token) {
        if (token == null) {
            return false;
        }
        String candidate = token.trim();
        if (candidate.length() < MIN_TOKEN_LENGTH || !candidate.startsWith(TOKEN_PREFIX)) {
            return false;
        }
        return BASE64URL.matcher(candidate.substring(TOKEN_PREFIX.length())).matches();
    }

    /**
     * Returns the plaintext for a token, the input unchanged when it is not ciphertext-shaped,
     * and the token unchanged (with a warning) when the key is unusable or authentication fails.
     */
    public String decrypt(String token) {
        if (token == null) {
            return "";
        }
        if (!looksEncrypted(token)) {
            return token;
        }
        String candidate = token.trim();
        SecretKey secretKey;
        try {
            secretKey = key();
        } catch (IllegalStateException | UncheckedIOException ex) {
            log.warn("Decryption degraded for token {}: key unavailable ({})",
                    Fingerprints.of(candidate), ex.getClass().getSimpleName());
            return token;
        }
        try {
            byte[] combined = Base64.getUrlDecoder().decode(candidate.substring(TOKEN_PREFIX.length()));
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey,
                    new GCMParameterSpec(GCM_TAG_LENGTH * 8, combined, 0, GCM_IV_LENGTH));
            byte[] plain = cipher.doFinal(combined, GCM_IV_LENGTH, combined.length - GCM_IV_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException ex) {
            log.warn("Decryption degraded for token {}: {}",
                    Fingerprints.of(candidate), ex.getClass().getSimpleName());
            return token;
        }
    }

    private SecretKey key() {
        SecretKey current = key;
        if (current == null) {
            synchronized (this) {
                current = key;
                if (current == null) {
                    current = new SecretKeySpec(loadOrCreateKey(), "AES");
                    key = current;
                }
            }
        }
        return current;
    }

    private byte[] loadOrCreateKey() {
        try {
            if (Files.exists(keyPath)) {
                byte[] bytes = Files.readAllBytes(keyPath);
                if (bytes.length != KEY_LENGTH_BYTES) {
                    throw new IllegalStateException("Key file " + keyPath + " has "
                            + bytes.length + " bytes, expected " + KEY_LENGTH_BYTES);
                }
                return bytes;
            }
            byte[] bytes = new byte[KEY_LENGTH_BYTES];
            secureRandom.nextBytes(bytes);
            writeKey(bytes);
            log.info("Generated new field encryption key at {}", keyPath);
            return bytes;
        } catch (FileAlreadyExistsException ex) {
            // another process created it first
            try {
                return Files.readAllBytes(keyPath);
            } catch (IOException readEx) {
                throw new UncheckedIOException("Failed to read key file " + keyPath, readEx);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to load key file " + keyPath, ex);
        }
    }

    private void writeKey(byte[] bytes) throws IOException {
        Path parent = keyPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (supportsPosix(parent)) {
            FileAttribute<Set<PosixFilePermission>> attr =
                    PosixFilePermissions.asFileAttribute(KEY_FILE_PERMISSIONS);
            Files.createFile(keyPath, attr);
        } else {
            Files.createFile(keyPath);
        }
        Files.write(keyPath, bytes);
    }

    private static boolean supportsPosix(Path dir) {
        return dir != null && dir.getFileSystem().supportedFileAttributeViews().contains("posix");
    }
}
