package io.agentwarden.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentwarden.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scrubs activity details before they hit disk. Whole values are masked under secret-looking
 * keys; inside free text (generated code kept for audit) only the secret itself is replaced.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Pattern INLINE_ASSIGNMENT = Pattern.compile(
            "(?i)\\b(password|passwd|secret|api[_-]?key|access[_-]?token|auth[_-]?token)(\\s*[:=]\\s*)(['\"])[^'\"\\s]{4,}\\3"
    );
    private static final Pattern PRIVATE_KEY = Pattern.compile(
            "-----BEGIN ([A-Z ]*)PRIVATE KEY-----.*?-----END \\1PRIVATE KEY-----", Pattern.DOTALL
    );
    private static final Pattern HEX_DIGEST = Pattern.compile("^[0-9a-f]{32,128}$");
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_]{24,}$");
    private static final Pattern AWS_KEY_ID = Pattern.compile("\\bAKIA[0-9A-Z]{16}\\b");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                if (isSensitiveKey(key)) {
                    out.put(key, MASK);
                } else {
                    out.set(key, masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            if (likelySecretValue(text)) {
                return Jsons.mapper().valueToTree(MASK);
            }
            String scrubbed = maskInline(text);
            return scrubbed.equals(text) ? input : Jsons.mapper().valueToTree(scrubbed);
        }
        return input;
    }

    public static String maskInline(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = PRIVATE_KEY.matcher(text).replaceAll("-----BEGIN $1PRIVATE KEY----- " + MASK + " -----END $1PRIVATE KEY-----");
        out = INLINE_ASSIGNMENT.matcher(out).replaceAll("$1$2$3" + MASK + "$3");
        return AWS_KEY_ID.matcher(out).replaceAll(MASK);
    }

    private static boolean isSensitiveKey(String rawKey) {
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
        if (v.length() < 24) {
            return false;
        }
        if (HEX_DIGEST.matcher(v).matches()) {
            return false;
        }
        // Long opaque tokens with no separators; ids like tsk_<uuid> contain '-' groups and stay readable.
        return OPAQUE_TOKEN.matcher(v).matches();
    }
}
