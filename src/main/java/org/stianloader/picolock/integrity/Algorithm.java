package org.stianloader.picolock.integrity;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The digest algorithms an integrity string can be computed with.
 */
public enum Algorithm {

    /**
     * The legacy algorithm. Its integrity strings are {@code sha1-} followed by the base64 encoding
     * of the lowercase hexadecimal SHA-1 digest text, so the digest is encoded twice.
     */
    SHA1("sha1", "SHA-1", 56),

    /**
     * The strong algorithm. Its integrity strings are {@code sha512-} followed by the lowercase
     * hexadecimal SHA-512 digest, without any base64 encoding.
     */
    SHA512("sha512", "SHA-512", 128);

    @NotNull
    private final String tag;
    @NotNull
    private final String jcaName;
    private final int encodedLength;

    Algorithm(@NotNull String tag, @NotNull String jcaName, int encodedLength) {
        this.tag = tag;
        this.jcaName = jcaName;
        this.encodedLength = encodedLength;
    }

    /**
     * Looks up an algorithm by the tag used as prefix of integrity strings.
     * Matching is case-sensitive.
     *
     * @param tag The tag, for example "sha512"
     * @return The algorithm, or an empty optional if the tag is not supported
     */
    @NotNull
    @Contract(pure = true)
    public static Optional<Algorithm> byTag(@NotNull String tag) {
        for (Algorithm algorithm : Algorithm.values()) {
            if (algorithm.tag.equals(tag)) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }

    @NotNull
    @Contract(pure = true)
    public String getTag() {
        return this.tag;
    }

    /**
     * The amount of characters following the "tag-" prefix of a well-formed integrity string.
     */
    @Contract(pure = true)
    int getEncodedLength() {
        return this.encodedLength;
    }

    @NotNull
    MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(this.jcaName);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-1 and SHA-512
            throw new AssertionError(this.jcaName + " is not available", e);
        }
    }
}
