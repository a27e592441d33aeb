package com.spclient.features;

import com.spclient.SharePointClient;
import com.spclient.odata.ODataUrls;
import com.spclient.odata.SharePointQueryableCollection;
import com.spclient.odata.SharePointQueryableInstance;

import java.util.concurrent.CompletableFuture;

/**
 * Apps available in the tenant app catalog, addressed relative to a web url.
 */
public class AppCatalog extends SharePointQueryableCollection {

    public static final String DEFAULT_PATH = "_api/web/tenantappcatalog/AvailableApps";

    public AppCatalog(SharePointClient client, String webUrl) {
        super(client, ODataUrls.extractWebUrl(webUrl), DEFAULT_PATH);
    }

    /**
     * {@code AvailableApps/GetById('<id>')}
     */
    public SharePointQueryableInstance getAppById(String id) {
        return new SharePointQueryableInstance(this, "getById(" + ODataUrls.quote(id) + ")");
    }

    /**
     * POST {@code AvailableApps/GetById('<id>')/Install}
     */
    public CompletableFuture<Void> installAsync(String id) {
        return new SharePointQueryableInstance(getAppById(id), "Install").postCoreAsync().thenAccept(v -> {});
    }
}
