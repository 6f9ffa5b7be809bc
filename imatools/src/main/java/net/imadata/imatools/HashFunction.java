package net.imadata.imatools;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Checksums used in repository metadata. The {@link #getTypeName() type name} is what repomd.xml puts into the
 * {@code type} attribute of checksum elements.
 */
public enum HashFunction {
    SHA256("SHA-256", "sha256", 64);

    private final String algorithm;
    private final String typeName;
    private final int hexLength;

    HashFunction(String algorithm, String typeName, int hexLength) {
        this.algorithm = algorithm;
        this.typeName = typeName;
        this.hexLength = hexLength;
    }

    public String getTypeName() {
        return typeName;
    }

    public MessageDigest get() {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Missing mandatory digest algorithm " + algorithm, e);
        }
    }

    public String hash(Path file) throws IOException {
        MessageDigest digest = get();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int length;
            while ((length = in.read(buffer)) != -1) {
                digest.update(buffer, 0, length);
            }
        }
        return formatHash(digest);
    }

    public String hash(byte[] data) {
        MessageDigest digest = get();
        digest.update(data);
        return formatHash(digest);
    }

    public String formatHash(MessageDigest digest) {
        StringBuilder result = new StringBuilder(hexLength);
        for (byte b : digest.digest()) {
            result.append(Character.forDigit((b >> 4) & 0xF, 16));
            result.append(Character.forDigit(b & 0xF, 16));
        }
        return result.toString();
    }
}
