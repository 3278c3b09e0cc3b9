package io.github.yok.itgluemigrate.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for reading destination API responses.
 *
 * @author Yasuharu.Okawauchi
 */
public final class ApiResponses {

    private ApiResponses() {
        // Utility class; do not instantiate.
    }

    /**
     * Returns the elements of a list response, which is either a bare array or a page object
     * with an {@code items} array.
     *
     * @param response response body
     * @return the elements; empty for any other shape
     */
    public static List<JsonNode> items(JsonNode response) {
        List<JsonNode> out = new ArrayList<>();
        if (response == null) {
            return out;
        }
        JsonNode array = response.isArray() ? response : response.path("items");
        if (array.isArray()) {
            array.forEach(out::add);
        }
        return out;
    }

    /**
     * Returns a text field of a response object.
     *
     * @param node response object
     * @param field field name
     * @return the text, or {@code null} if absent, null, or empty
     */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
