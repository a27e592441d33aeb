package com.spclient.lists;

import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;

public class ContentTypes extends SharePointQueryableCollection {

    public static final String DEFAULT_PATH = "contenttypes";

    public ContentTypes(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public ContentTypes(SharePointQueryable parent, String path) {
        super(parent, path);
    }
}
