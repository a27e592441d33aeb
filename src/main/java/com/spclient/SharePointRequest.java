package com.spclient;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One HTTP call as built by a resource reference: verb, URL (absolute or relative to the
 * client's base URL), extra headers and an optional JSON body.
 */
public final class SharePointRequest {

    private final String method;
    private final String url;
    private final Map<String, String> headers;
    private final String body;

    public SharePointRequest(String method, String url, Map<String, String> headers, String body) {
        this.method = Objects.requireNonNull(method, "method");
        this.url = Objects.requireNonNull(url, "url");
        this.headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
    }

    public static SharePointRequest get(String url) {
        return new SharePointRequest("GET", url, null, null);
    }

    public static SharePointRequest post(String url, String body, Map<String, String> headers) {
        return new SharePointRequest("POST", url, headers, body);
    }

    public static SharePointRequest delete(String url) {
        return new SharePointRequest("DELETE", url, null, null);
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /** JSON text, or {@code null} when the request carries no body. */
    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}
