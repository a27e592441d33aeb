package com.spclient.odata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spclient.SharePointClient;
import com.spclient.SharePointRequest;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;

/**
 * Reference to a remote SharePoint resource: a URL accumulated from its parents plus pending
 * query parameters and an optional batch.
 *
 * <p>Building references never touches the network; only the verb methods
 * ({@link #getAsync()}, {@link #postCoreAsync}, {@link #deleteCoreAsync()}) issue a request.
 * Methods that change the URL or query return a new reference and leave the receiver as it was.
 */
public abstract class SharePointQueryable implements Cloneable {

    private final SharePointClient client;
    private String parentUrl;
    private String url;
    private Map<String, String> query = new LinkedHashMap<>();
    private Batch batch;

    /**
     * Creates a reference from a URL string. The parent URL is derived from its shape:
     * absolute or slash-less urls are their own parent, {@code .../items(19)/fields} has
     * parent {@code .../items(19)} and {@code .../items(19)} has parent {@code .../items}.
     */
    protected SharePointQueryable(SharePointClient client, String baseUrl, String path) {
        this.client = Objects.requireNonNull(client, "client");
        String base = baseUrl == null ? "" : baseUrl;
        if (ODataUrls.isUrlAbsolute(base) || base.lastIndexOf('/') < 0) {
            this.parentUrl = base;
            this.url = ODataUrls.combine(base, path);
        } else if (base.lastIndexOf('/') > base.lastIndexOf('(')) {
            int index = base.lastIndexOf('/');
            this.parentUrl = base.substring(0, index);
            this.url = ODataUrls.combine(parentUrl, ODataUrls.combine(base.substring(index), path));
        } else {
            int index = base.lastIndexOf('(');
            this.parentUrl = base.substring(0, index);
            this.url = ODataUrls.combine(base, path);
        }
    }

    /**
     * Creates a child of {@code parent} at {@code parent.toUrl() + "/" + path}. The child
     * shares the parent's client and batch and keeps its {@code @target} parameter.
     */
    protected SharePointQueryable(SharePointQueryable parent, String path) {
        this.client = parent.client;
        this.parentUrl = parent.url;
        this.url = ODataUrls.combine(parentUrl, path);
        this.batch = parent.batch;
        String target = parent.query.get("@target");
        if (target != null) {
            this.query.put("@target", target);
        }
    }

    public SharePointClient getClient() {
        return client;
    }

    public String getParentUrl() {
        return parentUrl;
    }

    public String toUrl() {
        return url;
    }

    public Map<String, String> getQuery() {
        return Collections.unmodifiableMap(query);
    }

    public Batch getBatch() {
        return batch;
    }

    public boolean hasBatch() {
        return batch != null;
    }

    /**
     * URL with the query parameters appended; values are form-encoded, keys are used as given.
     */
    public String toUrlAndQuery() {
        if (query.isEmpty()) {
            return url;
        }
        StringBuilder sb = new StringBuilder(url).append(url.indexOf('?') > -1 ? '&' : '?');
        query.forEach((key, value) -> sb.append(key).append('=').append(URLEncoder.encode(value, StandardCharsets.UTF_8)).append('&'));
        sb.deleteCharAt(sb.length() - 1);
        return sb.toString();
    }

    /**
     * Builds the child reference {@code factory(this, path)}.
     */
    protected <T extends SharePointQueryable> T child(BiFunction<SharePointQueryable, String, T> factory, String path) {
        return factory.apply(this, path);
    }

    /** Copy whose URL has {@code fragment} appended as is, without a separating slash. */
    public SharePointQueryable concat(String fragment) {
        SharePointQueryable copy = copy();
        copy.url = url + fragment;
        return copy;
    }

    public SharePointQueryable withQuery(String key, String value) {
        SharePointQueryable copy = copy();
        copy.query.put(key, value);
        return copy;
    }

    public SharePointQueryable select(String... fields) {
        return withQuery("$select", String.join(",", fields));
    }

    public SharePointQueryable expand(String... fields) {
        return withQuery("$expand", String.join(",", fields));
    }

    /**
     * Copy whose verbs are queued in {@code batch} instead of being sent straight away.
     */
    public SharePointQueryable inBatch(Batch batch) {
        if (this.batch != null) {
            throw new IllegalStateException("This query is already part of a batch.");
        }
        SharePointQueryable copy = copy();
        copy.batch = Objects.requireNonNull(batch, "batch");
        return copy;
    }

    public CompletableFuture<JsonNode> getAsync() {
        return send(SharePointRequest.get(toUrlAndQuery()));
    }

    public <T> CompletableFuture<T> getAsAsync(Class<T> type) {
        return getAsync().thenApply(node -> client.convert(node, type));
    }

    public CompletableFuture<JsonNode> postCoreAsync() {
        return postCoreAsync(null, null);
    }

    public CompletableFuture<JsonNode> postCoreAsync(JsonNode body) {
        return postCoreAsync(body, null);
    }

    public CompletableFuture<JsonNode> postCoreAsync(JsonNode body, Map<String, String> headers) {
        return send(SharePointRequest.post(toUrlAndQuery(), body == null ? null : body.toString(), headers));
    }

    public CompletableFuture<JsonNode> deleteCoreAsync() {
        return send(SharePointRequest.delete(toUrlAndQuery()));
    }

    /**
     * A new JSON object tagged with the server-side type {@code __metadata.type}.
     */
    protected ObjectNode typedBody(String metadataType) {
        ObjectNode body = client.getObjectMapper().createObjectNode();
        body.putObject("__metadata").put("type", metadataType);
        return body;
    }

    protected ObjectNode newBody() {
        return client.getObjectMapper().createObjectNode();
    }

    protected SharePointQueryable copy() {
        try {
            SharePointQueryable copy = (SharePointQueryable) super.clone();
            copy.query = new LinkedHashMap<>(query);
            return copy;
        } catch (CloneNotSupportedException e) {
            throw new AssertionError(e);
        }
    }

    private CompletableFuture<JsonNode> send(SharePointRequest request) {
        return batch != null ? batch.add(request) : client.executeAsync(request);
    }

    @Override
    public String toString() {
        return toUrlAndQuery();
    }
}
