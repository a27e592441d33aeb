package com.spclient.features;

import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;

public class UserCustomActions extends SharePointQueryableCollection {

    public static final String DEFAULT_PATH = "usercustomactions";

    public UserCustomActions(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public UserCustomActions(SharePointQueryable parent, String path) {
        super(parent, path);
    }
}
