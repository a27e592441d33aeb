package com.spclient.users;

import com.spclient.odata.SharePointQueryable;

/**
 * The user the client is authenticated as.
 */
public class CurrentUser extends SiteUser {

    public static final String DEFAULT_PATH = "currentuser";

    public CurrentUser(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public CurrentUser(SharePointQueryable parent, String path) {
        super(parent, path);
    }
}
