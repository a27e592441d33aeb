package com.spclient.odata;

import com.spclient.SharePointClient;

/**
 * Reference to a single entity, such as a web, a list or a user.
 */
public class SharePointQueryableInstance extends SharePointQueryable {

    public SharePointQueryableInstance(SharePointClient client, String baseUrl) {
        super(client, baseUrl, null);
    }

    public SharePointQueryableInstance(SharePointClient client, String baseUrl, String path) {
        super(client, baseUrl, path);
    }

    public SharePointQueryableInstance(SharePointQueryable parent, String path) {
        super(parent, path);
    }
}
