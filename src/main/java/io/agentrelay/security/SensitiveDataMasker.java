package io.agentrelay.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentrelay.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks audit details before they are written. Payment references keep their last four
 * characters so an operator can still correlate them; credentials are replaced outright; free-text
 * error messages are scrubbed of bearer tokens and long opaque blobs. Message, task and agent ids
 * are left readable.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";

    private static final Set<String> REFERENCE_FIELDS = Set.of("transaction_hash", "transaction_ref");
    private static final Set<String> CREDENTIAL_FIELDS = Set.of(
            "signature", "authorization", "secret", "token", "api_key", "password"
    );
    private static final Set<String> FREE_TEXT_FIELDS = Set.of("error_message", "content");
    private static final int REFERENCE_VISIBLE_TAIL = 4;

    private static final Pattern BEARER = Pattern.compile("(?i)\\bbearer\\s+\\S+");
    private static final Pattern OPAQUE_RUN = Pattern.compile("[A-Za-z0-9+/=]{32,}");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = input.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                out.set(field.getKey(), maskField(normalize(field.getKey()), field.getValue()));
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode item : input) {
                out.add(masked(item));
            }
            return out;
        }
        return input;
    }

    private static JsonNode maskField(String key, JsonNode value) {
        if (value == null || value.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (CREDENTIAL_FIELDS.contains(key)) {
            return text(MASK);
        }
        if (REFERENCE_FIELDS.contains(key) && value.isValueNode()) {
            return text(maskReference(value.asText("")));
        }
        if (FREE_TEXT_FIELDS.contains(key) && value.isTextual()) {
            return text(scrubText(value.asText("")));
        }
        return masked(value);
    }

    static String maskReference(String reference) {
        String v = reference == null ? "" : reference.trim();
        if (v.length() <= REFERENCE_VISIBLE_TAIL * 2) {
            return MASK;
        }
        return MASK + v.substring(v.length() - REFERENCE_VISIBLE_TAIL);
    }

    static String scrubText(String text) {
        String out = BEARER.matcher(text).replaceAll("Bearer " + MASK);
        return OPAQUE_RUN.matcher(out).replaceAll(MASK);
    }

    private static String normalize(String key) {
        return key == null ? "" : key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    private static JsonNode text(String value) {
        return Jsons.mapper().getNodeFactory().textNode(value);
    }
}
