package com.stepwright.orchestrator.telemetry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes secret material from anything that is persisted or sent out:
 * failure signatures, summaries, error messages, event payloads.
 *
 * Three passes:
 * <ol>
 *   <li>Known values: every environment variable whose name looks sensitive
 *       (token, secret, password, key, credential, auth), plus configured extras.</li>
 *   <li>Inline assignments such as {@code password="hunter22"} or {@code api_key: abcd}.</li>
 *   <li>Well-known token shapes (bearer headers, GitHub / OpenAI / AWS / Slack prefixes).</li>
 * </ol>
 * Map payloads additionally have values under sensitive keys masked outright.
 */
public class SecretScrubber {

    public static final String REDACTED = "[REDACTED]";

    private static final List<String> SENSITIVE_HINTS =
            List.of("token", "secret", "password", "passwd", "key", "credential", "auth");

    // Shorter values would redact ordinary words.
    private static final int MIN_SECRET_LENGTH = 4;

    private static final Pattern INLINE_ASSIGNMENT = Pattern.compile(
            "(?i)\\b(password|passwd|pwd|token|secret|api[_-]?key|access[_-]?key|auth)(\\s*[=:]\\s*)([\"']?)([^\\s\"',;]{4,})\\3");
    private static final Pattern BEARER = Pattern.compile(
            "(?i)\\bbearer\\s+[A-Za-z0-9._~+/=-]{8,}");
    private static final Pattern TOKEN_SHAPES = Pattern.compile(
            "\\b(ghp_[A-Za-z0-9]{20,}|github_pat_[A-Za-z0-9_]{20,}|sk-[A-Za-z0-9_-]{16,}|AKIA[0-9A-Z]{16}|xox[abpr]-[A-Za-z0-9-]{10,})");

    private final List<String> knownSecrets;

    public SecretScrubber(Map<String, String> environment, Collection<String> extraSecrets) {
        List<String> values = new ArrayList<>();
        environment.forEach((name, value) -> {
            if (isSensitiveKey(name) && value != null && value.strip().length() >= MIN_SECRET_LENGTH) {
                values.add(value.strip());
            }
        });
        for (String extra : extraSecrets) {
            if (extra != null && extra.strip().length() >= MIN_SECRET_LENGTH) {
                values.add(extra.strip());
            }
        }
        // Longest first so a secret containing another is replaced whole.
        values.sort(Comparator.comparingInt(String::length).reversed());
        this.knownSecrets = values.stream().distinct().toList();
    }

    public static SecretScrubber fromEnvironment(Collection<String> extraSecrets) {
        return new SecretScrubber(System.getenv(), extraSecrets);
    }

    // ------------------------------------------------------------------
    // Text
    // ------------------------------------------------------------------

    public String scrub(String text) {
        if (text == null || text.isEmpty()) return text;
        String out = text;
        for (String secret : knownSecrets) {
            out = out.replace(secret, REDACTED);
        }
        Matcher m = INLINE_ASSIGNMENT.matcher(out);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String replacement = m.group(1) + m.group(2) + m.group(3) + REDACTED + m.group(3);
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        out = sb.toString();
        out = BEARER.matcher(out).replaceAll("Bearer " + REDACTED);
        out = TOKEN_SHAPES.matcher(out).replaceAll(REDACTED);
        return out;
    }

    // ------------------------------------------------------------------
    // Structured payloads
    // ------------------------------------------------------------------

    /** Deep copy of {@code payload} with sensitive keys masked and every string scrubbed. */
    public Map<String, Object> scrubPayload(Map<String, ?> payload) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (payload == null) return out;
        payload.forEach((key, value) ->
                out.put(key, isSensitiveKey(key) && value != null ? REDACTED : scrubValue(value)));
        return out;
    }

    @SuppressWarnings("unchecked")
    private Object scrubValue(Object value) {
        if (value instanceof String s) return scrub(s);
        if (value instanceof Map<?, ?> map) return scrubPayload((Map<String, ?>) map);
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            for (Object item : items) copy.add(scrubValue(item));
            return copy;
        }
        return value;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) return false;
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) return true;
        }
        return false;
    }
}
