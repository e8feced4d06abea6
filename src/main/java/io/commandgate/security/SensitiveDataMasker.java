package io.commandgate.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credential-like entries before command data reaches the audit log.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential", "private_key"
    );
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{24,}$");

    private SensitiveDataMasker() {
    }

    public static Map<String, Object> masked(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : input.entrySet()) {
            String key = entry.getKey();
            if (isSensitiveKey(key)) {
                out.put(key, MASK);
            } else {
                out.put(key, maskedValue(entry.getValue()));
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object maskedValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return masked((Map<String, ?>) map);
        }
        if (value instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(maskedValue(item));
            }
            return out;
        }
        if (value instanceof String text && likelySecretValue(text)) {
            return MASK;
        }
        return value;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        if (v.length() < 24 || v.indexOf(' ') >= 0) {
            return false;
        }
        // Long opaque strings with mixed letters and digits look like tokens.
        boolean hasDigit = false;
        boolean hasLetter = false;
        for (int i = 0; i < v.length(); i++) {
            char ch = v.charAt(i);
            hasDigit |= Character.isDigit(ch);
            hasLetter |= Character.isLetter(ch);
        }
        return hasDigit && hasLetter && OPAQUE_TOKEN.matcher(v).matches();
    }
}
