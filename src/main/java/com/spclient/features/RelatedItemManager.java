package com.spclient.features;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spclient.SharePointClient;
import com.spclient.odata.SharePointQueryableInstance;

import java.util.concurrent.CompletableFuture;

/**
 * Access to {@code SP.RelatedItemManager} for the web a url belongs to.
 */
public class RelatedItemManager extends SharePointQueryableInstance {

    public static final String DEFAULT_PATH = "_api/SP.RelatedItemManager";

    private RelatedItemManager(SharePointClient client, String baseUrl) {
        super(client, baseUrl, DEFAULT_PATH);
    }

    public static RelatedItemManager fromUrl(SharePointClient client, String url) {
        int index = url.indexOf("_api/");
        return new RelatedItemManager(client, index < 0 ? url : url.substring(0, index));
    }

    /**
     * POST {@code SP.RelatedItemManager.GetRelatedItems}
     */
    public CompletableFuture<JsonNode> getRelatedItemsAsync(String sourceListName, int sourceItemId) {
        ObjectNode body = newBody();
        body.put("SourceItemID", sourceItemId);
        body.put("SourceListName", sourceListName);
        return concat(".GetRelatedItems").postCoreAsync(body);
    }
}
