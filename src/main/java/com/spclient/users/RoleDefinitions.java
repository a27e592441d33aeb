package com.spclient.users;

import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;

public class RoleDefinitions extends SharePointQueryableCollection {

    public static final String DEFAULT_PATH = "roledefinitions";

    public RoleDefinitions(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public RoleDefinitions(SharePointQueryable parent, String path) {
        super(parent, path);
    }
}
