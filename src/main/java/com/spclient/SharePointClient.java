package com.spclient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import com.spclient.odata.ODataUrls;
import com.spclient.sites.Site;
import com.spclient.webs.Web;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous HTTP transport for the SharePoint REST API.
 *
 * <p>Resource references ({@link Web}, {@link Site} and everything reachable from them) only
 * build URLs and bodies; every request they issue is sent through {@link #executeAsync}.
 */
public class SharePointClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SharePointClient.class);

    static final String ACCEPT = "application/json";
    static final String VERBOSE_CONTENT_TYPE = "application/json;odata=verbose;charset=utf-8";

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String authToken;
    private final ObjectMapper objectMapper;

    public SharePointClient(String baseUrl, String authToken) {
        this(baseUrl, authToken, HttpClient.newHttpClient());
    }

    public SharePointClient(String baseUrl, String authToken, HttpClient httpClient) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL is mandatory for SharePointClient.");
        }
        if (!baseUrl.startsWith("https://")) {
            log.warn("Base URL {} does not use HTTPS. All communication should occur over HTTPS in production environments.", baseUrl);
        }
        if (authToken == null || authToken.isBlank()) {
            log.warn("Authentication token is missing. Calls may fail if the site requires authentication.");
        }

        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.authToken = authToken;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * The web addressed by the base URL ({@code <baseUrl>/_api/web}).
     */
    public Web web() {
        return new Web(this, baseUrl);
    }

    /**
     * The site collection addressed by the base URL ({@code <baseUrl>/_api/site}).
     */
    public Site site() {
        return new Site(this, baseUrl);
    }

    /**
     * Sends one request and resolves with the unwrapped OData payload.
     *
     * <p>Responses with status 400 or above complete the future exceptionally with a
     * {@link SharePointRequestException}. 204 and empty bodies resolve to an empty object.
     */
    public CompletableFuture<JsonNode> executeAsync(SharePointRequest request) {
        try {
            URI uri = buildUri(request.getUrl());
            HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", ACCEPT);

            if (authToken != null && !authToken.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + authToken);
            }

            HttpRequest.BodyPublisher bodyPublisher = HttpRequest.BodyPublishers.noBody();
            if (request.getBody() != null) {
                bodyPublisher = HttpRequest.BodyPublishers.ofString(request.getBody());
                requestBuilder.header("Content-Type", VERBOSE_CONTENT_TYPE);
            }
            request.getHeaders().forEach(requestBuilder::setHeader);

            HttpRequest httpRequest = requestBuilder.method(request.getMethod(), bodyPublisher).build();
            log.debug("{} {}", request.getMethod(), uri);

            return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                    .thenApply(response -> parseResponse(request, response));

        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Binds a response tree to {@code type}.
     */
    public <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (IOException e) {
            throw new RuntimeException("Failed to deserialize response into " + type.getSimpleName(), e);
        }
    }

    /**
     * Binds a response array to a list of {@code type}.
     */
    public <T> List<T> convertList(JsonNode node, Class<T> type) {
        CollectionType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, type);
        return objectMapper.convertValue(node, listType);
    }

    private JsonNode parseResponse(SharePointRequest request, HttpResponse<String> response) {
        if (response.statusCode() >= 400) {
            String errorBody = response.body();
            log.warn("{} {} failed with status {}: {}", request.getMethod(), request.getUrl(), response.statusCode(), errorBody);
            throw new SharePointRequestException(request.getMethod(), request.getUrl(), response.statusCode(), errorBody);
        }

        String body = response.body();
        if (response.statusCode() == 204 || body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }

        try {
            return unwrapODataPayload(objectMapper.readTree(body));
        } catch (IOException e) {
            throw new RuntimeException("Failed to deserialize response", e);
        }
    }

    // verbose responses wrap the payload in "d" (collections in "d.results"), minimal metadata ones in "value"
    private static JsonNode unwrapODataPayload(JsonNode json) {
        if (json.has("d")) {
            JsonNode d = json.get("d");
            return d.has("results") ? d.get("results") : d;
        }
        if (json.has("value")) {
            return json.get("value");
        }
        return json;
    }

    URI buildUri(String url) {
        String absolute = ODataUrls.isUrlAbsolute(url) ? url : ODataUrls.combine(baseUrl, url);
        return URI.create(escapeIllegalCharacters(absolute));
    }

    /**
     * Percent-encodes characters that may not appear in a URI path or query, keeping reserved
     * characters and existing {@code %XX} escapes. {@code #}, {@code [} and {@code ]} are always
     * encoded as references never carry fragments or IPv6 hosts.
     */
    static String escapeIllegalCharacters(String url) {
        byte[] bytes = url.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length);
        for (int i = 0; i < bytes.length; i++) {
            int c = bytes[i] & 0xFF;
            if (c == '%' ? isEscapeAt(bytes, i) : isAllowed(c)) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }

    // a '%' is kept only as the start of an existing %XX escape
    private static boolean isEscapeAt(byte[] bytes, int index) {
        return index + 2 < bytes.length && isHexDigit(bytes[index + 1]) && isHexDigit(bytes[index + 2]);
    }

    private static boolean isHexDigit(byte b) {
        return (b >= '0' && b <= '9') || (b >= 'a' && b <= 'f') || (b >= 'A' && b <= 'F');
    }

    private static boolean isAllowed(int c) {
        if (c >= 0x80) {
            return false;
        }
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
            return true;
        }
        return "-._~:/?@!$&'()*+,;=".indexOf(c) >= 0;
    }

    @Override
    public void close() {
        // the JDK client releases its connections when it is garbage collected
    }
}
