package app.walkupmusic.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Extracts a human-readable message from Spotify error payloads.
 *
 * <p>The Web API answers {@code {"error": {"status": 400, "message": "..."}}} while the accounts service answers
 * {@code {"error": "invalid_grant", "error_description": "..."}}. Both shapes are handled; anything else falls back
 * to the raw body text.</p>
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static String message(InputStream bodyStream) throws IOException {
        if (bodyStream == null) {
            return null;
        }

        return message(bodyStream.readAllBytes());
    }

    public static String message(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            JsonNode error = node.path("error");
            if (error.isObject() && error.hasNonNull("message")) {
                return error.get("message").asText();
            }
            if (node.hasNonNull("error_description")) {
                return node.get("error_description").asText();
            }
            if (error.isTextual()) {
                return error.asText();
            }
            return null;
        } catch (IOException ex) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }
}
