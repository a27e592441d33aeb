package com.spclient.users;

import com.spclient.SharePointClient;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableInstance;

/**
 * A single site group.
 */
public class SiteGroup extends SharePointQueryableInstance {

    public SiteGroup(SharePointClient client, String baseUrl) {
        super(client, baseUrl);
    }

    public SiteGroup(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    public SiteUsers users() {
        return new SiteUsers(this, "users");
    }
}
