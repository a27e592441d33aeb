package com.spclient;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Client that records requests instead of sending them and answers with canned payloads,
 * in order. Requests beyond the queued answers get an empty object.
 */
public class RecordingClient extends SharePointClient {

    public static final String BASE_URL = "https://contoso.sharepoint.com/sites/dev";

    private final List<SharePointRequest> requests = new ArrayList<>();
    private final Deque<JsonNode> responses = new ArrayDeque<>();

    public RecordingClient() {
        super(BASE_URL, "test-token", HttpClient.newHttpClient());
    }

    public RecordingClient respondWith(String json) {
        responses.add(readTree(json));
        return this;
    }

    @Override
    public CompletableFuture<JsonNode> executeAsync(SharePointRequest request) {
        requests.add(request);
        JsonNode response = responses.isEmpty() ? getObjectMapper().createObjectNode() : responses.poll();
        return CompletableFuture.completedFuture(response);
    }

    public List<SharePointRequest> getRequests() {
        return requests;
    }

    public SharePointRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    public JsonNode bodyOf(SharePointRequest request) {
        return readTree(request.getBody());
    }

    private JsonNode readTree(String json) {
        try {
            return getObjectMapper().readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
