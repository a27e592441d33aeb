package com.spclient.users;

import com.spclient.SharePointClient;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableInstance;

import java.util.concurrent.CompletableFuture;

/**
 * A single user of a site.
 */
public class SiteUser extends SharePointQueryableInstance {

    public SiteUser(SharePointClient client, String baseUrl) {
        super(client, baseUrl);
    }

    public SiteUser(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    public SiteGroups groups() {
        return new SiteGroups(this, "groups");
    }

    public CompletableFuture<SiteUserProps> getPropsAsync() {
        return getAsAsync(SiteUserProps.class);
    }
}
