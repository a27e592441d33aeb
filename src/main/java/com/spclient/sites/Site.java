package com.spclient.sites;

import com.fasterxml.jackson.databind.JsonNode;
import com.spclient.SharePointClient;
import com.spclient.odata.ODataUrls;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableInstance;
import com.spclient.webs.Web;

import java.util.concurrent.CompletableFuture;

/**
 * A site collection.
 */
public class Site extends SharePointQueryableInstance {

    public static final String DEFAULT_PATH = "_api/site";

    public Site(SharePointClient client, String baseUrl) {
        super(client, baseUrl, DEFAULT_PATH);
    }

    public Site(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    public Web rootWeb() {
        return new Web(this, "rootweb");
    }

    /**
     * POST {@code _api/site/openWebById('<webId>')}
     *
     * @param webId id of the web to open
     */
    public CompletableFuture<OpenWebResult> openWebByIdAsync(String webId) {
        return child(Site::new, "openWebById(" + ODataUrls.quote(webId) + ")").postCoreAsync()
                .thenApply(data -> new OpenWebResult(data, Web.fromUrl(getClient(), entityId(data))));
    }

    private static String entityId(JsonNode data) {
        return data.hasNonNull("odata.id") ? data.get("odata.id").asText() : data.path("__metadata").path("uri").asText();
    }
}
