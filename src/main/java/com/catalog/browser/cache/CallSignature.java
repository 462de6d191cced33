package com.catalog.browser.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic key of one remote call: operation name plus its named parameters,
 * sorted by parameter name.
 *
 * <p>Only named parameters take part. Any other input the computation captures
 * (a client instance, a token, a positional argument) is deliberately ignored, so
 * every input that should distinguish cache entries must be passed by name.</p>
 *
 * <p>The canonical text has the form {@code search [(query, Yesterday), (types, [track])]}.
 * The {@link #slug()} used as file name is a lower-case ASCII slug of that text plus
 * an 8-character SHA-256 digest of the exact text, so values that differ only in case
 * or punctuation still map to different entries.</p>
 */
public final class CallSignature {

    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final int MAX_SLUG_LENGTH = 120;

    private final String operation;
    private final SortedMap<String, String> parameters;
    private final String canonical;

    private CallSignature(String operation, SortedMap<String, String> parameters) {
        this.operation = operation;
        this.parameters = Collections.unmodifiableSortedMap(parameters);
        this.canonical = operation + " " + parameters.entrySet().stream()
                .map(e -> "(" + e.getKey() + ", " + e.getValue() + ")")
                .collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * Creates a signature from an operation name and its named parameters.
     *
     * @param operation       remote operation name, e.g. {@code artist_albums}
     * @param namedParameters parameter name to value; iteration order is irrelevant
     */
    public static CallSignature of(String operation, Map<String, ?> namedParameters) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation is required");
        }
        SortedMap<String, String> sorted = new TreeMap<>();
        if (namedParameters != null) {
            namedParameters.forEach((name, value) ->
                    sorted.put(Objects.requireNonNull(name, "parameter name is required"), render(value)));
        }
        return new CallSignature(operation, sorted);
    }

    public static CallSignature of(String operation) {
        return of(operation, Map.of());
    }

    public String getOperation() {
        return operation;
    }

    public SortedMap<String, String> getParameters() {
        return parameters;
    }

    /**
     * Returns the canonical text this signature is derived from.
     */
    public String canonical() {
        return canonical;
    }

    /**
     * Returns a filesystem and URL safe name for this signature.
     */
    public String slug() {
        String ascii = MARKS.matcher(Normalizer.normalize(canonical, Normalizer.Form.NFKD)).replaceAll("");
        String slug = NON_ALNUM.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = trimDashes(slug);
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = trimDashes(slug.substring(0, MAX_SLUG_LENGTH));
        }
        return slug + "-" + digest(canonical);
    }

    private static String render(Object value) {
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
        }
        return String.valueOf(value);
    }

    private static String trimDashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '-') {
            end--;
        }
        return s.substring(start, end);
    }

    private static String digest(String text) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallSignature that)) return false;
        return canonical.equals(that.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return canonical;
    }
}
