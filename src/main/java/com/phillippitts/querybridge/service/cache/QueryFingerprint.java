package com.phillippitts.querybridge.service.cache;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic cache key for query text.
 *
 * <p>Text is lower-cased, runs of whitespace collapse to one space and the result is trimmed,
 * so {@code "  What   IS\tthis "} and {@code "what is this"} share a key. The key is
 * {@code chat:} followed by the MD5 hex digest of the normalized text. It does not depend on
 * who asked.
 */
public final class QueryFingerprint {

    /** Prefix shared by every response cache key; {@link ResponseCache#clear()} only removes these. */
    public static final String PREFIX = "chat:";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QueryFingerprint() {
    }

    public static String of(String text) {
        Objects.requireNonNull(text, "text");
        return PREFIX + DigestUtils.md5DigestAsHex(normalize(text).getBytes(StandardCharsets.UTF_8));
    }

    static String normalize(String text) {
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}
