package org.stianloader.picolock.integrity;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picolock.integrity.IntegrityException.Kind;
import org.stianloader.picolock.logging.LoggingAdapter;

/**
 * Computes the integrity strings stored in lock files.
 *
 * <p>The class holds no state and all methods may be invoked concurrently.
 *
 * <p><b>Legacy encoding:</b> the {@link Algorithm#SHA1} integrity string does not carry the
 * base64 encoded digest as one might expect, but the base64 encoding of the lowercase hexadecimal
 * digest <em>text</em>. Existing lock files depend on this, so it must not be "fixed".
 */
public final class IntegrityCalculator {

    private static final int BUFFER_SIZE = 8192;

    private IntegrityCalculator() {
        throw new AssertionError();
    }

    /**
     * Computes the integrity string of a byte array.
     *
     * @param data The bytes to digest
     * @param algorithm The algorithm to use
     * @return The integrity string, prefixed by the {@link Algorithm#getTag() algorithm tag}
     * @throws IntegrityException With {@link Kind#HASH_PARSE} if the produced string fails its self-check
     */
    @NotNull
    public static String calculate(byte @NotNull[] data, @NotNull Algorithm algorithm) throws IntegrityException {
        return IntegrityCalculator.calculate(new ByteArrayInputStream(Objects.requireNonNull(data, "data may not be null")), algorithm);
    }

    /**
     * Computes the integrity string of everything the stream yields. The stream is read until its end,
     * but is not closed.
     *
     * @param in The stream to digest
     * @param algorithm The algorithm to use
     * @return The integrity string, prefixed by the {@link Algorithm#getTag() algorithm tag}
     * @throws IntegrityException With {@link Kind#HASH_COPY} if reading the stream fails,
     * with {@link Kind#HASH_PARSE} if the produced string fails its self-check
     */
    @NotNull
    public static String calculate(@NotNull InputStream in, @NotNull Algorithm algorithm) throws IntegrityException {
        Objects.requireNonNull(in, "in may not be null");
        MessageDigest digest = Objects.requireNonNull(algorithm, "algorithm may not be null").newDigest();
        byte[] buffer = new byte[IntegrityCalculator.BUFFER_SIZE];
        try {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new IntegrityException(Kind.HASH_COPY, "Unable to feed input into the " + algorithm.getTag() + " digest", e);
        }

        String hex = HexFormat.of().formatHex(digest.digest());
        if (algorithm == Algorithm.SHA512) {
            return algorithm.getTag() + '-' + hex;
        }

        String legacy = algorithm.getTag() + '-' + Base64.getEncoder().encodeToString(hex.getBytes(StandardCharsets.US_ASCII));
        String reparsed = Integrity.parse(legacy).toString();
        if (!reparsed.equals(legacy)) {
            throw new IntegrityException(Kind.HASH_PARSE, "Integrity string \"" + legacy + "\" did not survive parsing, got \"" + reparsed + "\"");
        }
        return legacy;
    }

    /**
     * Computes the integrity string of a byte array for an algorithm given by name.
     *
     * <p>Unsupported algorithm names do not cause an exception. Instead an empty string is returned,
     * which callers must check for. Prefer {@link #calculate(byte[], Algorithm)} where the algorithm
     * is known in advance.
     *
     * @param data The bytes to digest
     * @param algorithmTag The {@link Algorithm#getTag() tag} of the algorithm, for example "sha1"
     * @return The integrity string, or an empty string if the algorithm is not supported
     * @throws IntegrityException With {@link Kind#HASH_PARSE} if the produced string fails its self-check
     */
    @NotNull
    public static String calculate(byte @NotNull[] data, @NotNull String algorithmTag) throws IntegrityException {
        Optional<Algorithm> algorithm = Algorithm.byTag(algorithmTag);
        if (!algorithm.isPresent()) {
            LoggingAdapter.getDefaultLogger().debug(IntegrityCalculator.class, "Unsupported integrity algorithm \"{}\", returning an empty integrity string", algorithmTag);
            return "";
        }
        return IntegrityCalculator.calculate(data, algorithm.get());
    }

    /**
     * Checks downloaded bytes against the integrity string recorded for them.
     *
     * @param data The bytes to verify
     * @param expectedIntegrity The expected integrity string, as stored in {@link org.stianloader.picolock.DependencyLock#integrity()}
     * @return True if the bytes match the integrity string
     * @throws IntegrityException With {@link Kind#HASH_PARSE} if the expected integrity string is malformed
     */
    @Contract(pure = true)
    public static boolean verify(byte @NotNull[] data, @NotNull String expectedIntegrity) throws IntegrityException {
        return Integrity.parse(expectedIntegrity).matches(data);
    }
}
