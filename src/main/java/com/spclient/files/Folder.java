package com.spclient.files;

import com.spclient.SharePointClient;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableInstance;

import java.util.concurrent.CompletableFuture;

/**
 * A single folder.
 */
public class Folder extends SharePointQueryableInstance {

    public Folder(SharePointClient client, String baseUrl) {
        super(client, baseUrl);
    }

    public Folder(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    public Files files() {
        return new Files(this);
    }

    public Folders folders() {
        return new Folders(this);
    }

    /**
     * GET {@code ?$select=ServerRelativeUrl}
     */
    public CompletableFuture<String> serverRelativeUrlAsync() {
        return select("ServerRelativeUrl").getAsync()
                .thenApply(data -> data.path("ServerRelativeUrl").asText());
    }
}
