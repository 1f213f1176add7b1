package com.onevault.observability;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keeps secrets out of log lines and exception messages.
 * <p>
 * Two tools: {@link #redact(Map)} masks values of sensitive-looking fields in a structured log
 * map, and {@link #reference(String)} turns a bearer secret such as a session token into a short,
 * stable reference that can be logged and correlated without being replayable.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "credential", "payload"
    );

    private static final HexFormat HEX = HexFormat.of();

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * @param patterns field name fragments to treat as sensitive (case-insensitive)
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream().map(Pattern::quote).toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code data} with sensitive values replaced by {@value #REDACTED}.
     * Null input returns an empty map.
     */
    public Map<String, Object> redact(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : value));
        return result;
    }

    public boolean isSensitive(String fieldName) {
        return fieldName != null && compiledPattern.matcher(fieldName).find();
    }

    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    /**
     * Short log-safe reference for a secret: {@code "ref:"} plus the first 12 hex characters of
     * its SHA-256. The same secret always yields the same reference.
     */
    public static String reference(String secret) {
        if (secret == null || secret.isEmpty()) {
            return REDACTED;
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
            return "ref:" + HEX.formatHex(digest).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
