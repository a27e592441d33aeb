package com.spclient.lists;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spclient.SharePointClient;
import com.spclient.files.File;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableInstance;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A list item, usually obtained from a file's {@code ListItemAllFields}.
 */
public class Item extends SharePointQueryableInstance {

    public Item(SharePointClient client, String baseUrl) {
        super(client, baseUrl);
    }

    public Item(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    public File file() {
        return new File(this, "file");
    }

    /**
     * Merges {@code properties} into the item. The entity type required by the body is read
     * from the parent list first.
     */
    public CompletableFuture<JsonNode> updateAsync(ObjectNode properties) {
        if (getParentUrl().lastIndexOf('/') < 0) {
            return CompletableFuture.failedFuture(new IllegalStateException("Cannot find the list of item " + toUrl() + "."));
        }
        return parentList().select("ListItemEntityTypeFullName").getAsync()
                .thenCompose(list -> {
                    ObjectNode body = typedBody(list.path("ListItemEntityTypeFullName").asText());
                    body.setAll(properties);

                    Map<String, String> headers = new LinkedHashMap<>();
                    headers.put("IF-MATCH", "*");
                    headers.put("X-HTTP-Method", "MERGE");
                    return postCoreAsync(body, headers);
                });
    }

    // .../lists(guid'x')/items(7) -> .../lists(guid'x')
    List parentList() {
        String parent = getParentUrl();
        if (parent.lastIndexOf('/') < 0) {
            throw new IllegalStateException("Cannot find the list of item " + toUrl() + ".");
        }
        return new List(getClient(), parent.substring(0, parent.lastIndexOf('/')));
    }
}
