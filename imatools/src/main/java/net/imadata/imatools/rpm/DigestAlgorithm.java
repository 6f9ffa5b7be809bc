package net.imadata.imatools.rpm;

import org.jetbrains.annotations.Nullable;

/**
 * Hash algorithms a package can use for its file digest table, keyed by their OpenPGP algorithm id.
 */
public enum DigestAlgorithm {
    MD5(1, 16),
    SHA1(2, 20),
    SHA256(8, 32),
    SHA384(9, 48),
    SHA512(10, 64),
    SHA224(11, 28);

    private final int pgpId;
    private final int length;

    DigestAlgorithm(int pgpId, int length) {
        this.pgpId = pgpId;
        this.length = length;
    }

    public int getPgpId() {
        return pgpId;
    }

    /**
     * @return length of the digest in hex characters
     */
    public int getHexLength() {
        return length * 2;
    }

    @Nullable
    public static DigestAlgorithm byPgpId(int pgpId) {
        for (DigestAlgorithm algorithm : values()) {
            if (algorithm.pgpId == pgpId) {
                return algorithm;
            }
        }
        return null;
    }
}
