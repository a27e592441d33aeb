package com.spclient.odata;

import com.fasterxml.jackson.databind.JsonNode;
import com.spclient.SharePointClient;
import com.spclient.SharePointRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Deferred submission context for requests issued by references attached with
 * {@link SharePointQueryable#inBatch(Batch)}.
 *
 * <p>Verbs called on batched references return immediately with a pending future; nothing is
 * sent until {@link #executeAsync()}. Queued requests are then sent in the order they were
 * added and each future completes with its own response or failure.
 */
public class Batch {

    private static final Logger log = LoggerFactory.getLogger(Batch.class);

    private final SharePointClient client;
    private final String baseUrl;
    private final List<PendingRequest> pending = new ArrayList<>();
    private boolean executed;

    public Batch(SharePointClient client, String baseUrl) {
        this.client = client;
        this.baseUrl = baseUrl;
    }

    /** Url of the web the batch was created for. */
    public String getBaseUrl() {
        return baseUrl;
    }

    public synchronized int size() {
        return pending.size();
    }

    synchronized CompletableFuture<JsonNode> add(SharePointRequest request) {
        if (executed) {
            throw new IllegalStateException("Batch has already been executed.");
        }
        PendingRequest entry = new PendingRequest(request);
        pending.add(entry);
        return entry.result;
    }

    /**
     * Sends every queued request. The returned future completes once all of them have
     * finished, whether or not they succeeded.
     */
    public CompletableFuture<Void> executeAsync() {
        List<PendingRequest> requests;
        synchronized (this) {
            if (executed) {
                return CompletableFuture.failedFuture(new IllegalStateException("Batch has already been executed."));
            }
            executed = true;
            requests = new ArrayList<>(pending);
        }
        log.debug("Executing batch of {} requests for {}", requests.size(), baseUrl);

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (PendingRequest entry : requests) {
            chain = chain.thenCompose(v -> client.executeAsync(entry.request)
                    .<Void>handle((response, error) -> {
                        if (error != null) {
                            entry.result.completeExceptionally(unwrap(error));
                        } else {
                            entry.result.complete(response);
                        }
                        return null;
                    }));
        }
        return chain;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static final class PendingRequest {
        private final SharePointRequest request;
        private final CompletableFuture<JsonNode> result = new CompletableFuture<>();

        private PendingRequest(SharePointRequest request) {
            this.request = request;
        }
    }
}
