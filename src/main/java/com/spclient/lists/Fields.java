package com.spclient.lists;

import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;

public class Fields extends SharePointQueryableCollection {

    public static final String DEFAULT_PATH = "fields";

    public Fields(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public Fields(SharePointQueryable parent, String path) {
        super(parent, path);
    }
}
