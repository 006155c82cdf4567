package app.walkupmusic.sdk.internal;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Helper methods for issuing the two request shapes Spotify uses: form-encoded POSTs to the accounts service and
 * bearer-authenticated GETs to the Web API.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    /**
     * Encodes parameters as {@code application/x-www-form-urlencoded}, preserving iteration order.
     */
    public static String formEncode(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }

    public static HttpResponse<InputStream> postForm(HttpClient client, String url, Map<String, String> form, Duration timeout)
        throws IOException, InterruptedException {

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .timeout(timeout)
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofInputStream());
    }

    public static HttpResponse<InputStream> getJson(HttpClient client, String url, String bearerToken, Duration timeout)
        throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .GET()
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .timeout(timeout);

        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }

        return client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    }
}
