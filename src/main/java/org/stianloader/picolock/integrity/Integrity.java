package org.stianloader.picolock.integrity;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picolock.integrity.IntegrityException.Kind;

/**
 * A parsed integrity string of the form {@code <algorithm>-<encoded digest>}.
 *
 * <p>The encoded digest is kept as-is. For {@link Algorithm#SHA1} it is the padded base64
 * encoding of the 40 character hexadecimal digest text, for {@link Algorithm#SHA512} it is
 * the 128 character lowercase hexadecimal digest.
 */
public final class Integrity {

    @NotNull
    private final Algorithm algorithm;
    @NotNull
    private final String encodedDigest;

    private Integrity(@NotNull Algorithm algorithm, @NotNull String encodedDigest) {
        this.algorithm = algorithm;
        this.encodedDigest = encodedDigest;
    }

    /**
     * Parses an integrity string.
     *
     * @param integrity The integrity string, for example {@code sha512-cf83e1357eef...}
     * @return The parsed integrity
     * @throws IntegrityException With {@link Kind#HASH_PARSE} if the algorithm is unknown or the digest is malformed
     */
    @NotNull
    public static Integrity parse(@NotNull String integrity) throws IntegrityException {
        Objects.requireNonNull(integrity, "integrity may not be null");
        int separator = integrity.indexOf('-');
        if (separator == -1) {
            throw new IntegrityException(Kind.HASH_PARSE, "Integrity string \"" + integrity + "\" lacks an algorithm prefix");
        }

        String tag = integrity.substring(0, separator);
        Algorithm algorithm = Algorithm.byTag(tag).orElse(null);
        if (algorithm == null) {
            throw new IntegrityException(Kind.HASH_PARSE, "Unsupported algorithm \"" + tag + "\" in integrity string \"" + integrity + "\"");
        }

        String digest = integrity.substring(separator + 1);
        if (digest.length() != algorithm.getEncodedLength()) {
            throw new IntegrityException(Kind.HASH_PARSE, "Expected " + algorithm.getEncodedLength() + " digest characters for " + tag + ", got " + digest.length());
        }

        boolean wellFormed = algorithm == Algorithm.SHA1 ? Integrity.isEncodedHexText(digest) : Integrity.isLowerHex(digest);
        if (!wellFormed) {
            throw new IntegrityException(Kind.HASH_PARSE, "Malformed " + tag + " digest \"" + digest + "\"");
        }

        return new Integrity(algorithm, digest);
    }

    @Contract(pure = true)
    private static boolean isLowerHex(@NotNull String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c < '0' || c > '9') && (c < 'a' || c > 'f')) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks that the string is the padded base64 encoding of a 40 character lowercase hexadecimal text.
     */
    @Contract(pure = true)
    private static boolean isEncodedHexText(@NotNull String s) {
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(s);
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (decoded.length != 40) {
            return false;
        }
        return Integrity.isLowerHex(new String(decoded, StandardCharsets.US_ASCII));
    }

    @NotNull
    @Contract(pure = true)
    public Algorithm getAlgorithm() {
        return this.algorithm;
    }

    @NotNull
    @Contract(pure = true)
    public String getEncodedDigest() {
        return this.encodedDigest;
    }

    /**
     * Checks whether the given bytes have this integrity.
     *
     * @param data The bytes to verify, usually a freshly downloaded tarball
     * @return True if the digest of the data matches
     * @throws IntegrityException If the digest of the data cannot be computed
     */
    public boolean matches(byte @NotNull[] data) throws IntegrityException {
        return IntegrityCalculator.calculate(data, this.algorithm).equals(this.toString());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Integrity) {
            Integrity other = (Integrity) obj;
            return other.algorithm == this.algorithm && other.encodedDigest.equals(this.encodedDigest);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return this.algorithm.hashCode() * 31 + this.encodedDigest.hashCode();
    }

    @NotNull
    @Override
    @Contract(pure = true)
    public String toString() {
        return this.algorithm.getTag() + '-' + this.encodedDigest;
    }
}
