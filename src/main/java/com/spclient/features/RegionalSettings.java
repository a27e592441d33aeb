package com.spclient.features;

import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableInstance;

public class RegionalSettings extends SharePointQueryableInstance {

    public static final String DEFAULT_PATH = "regionalsettings";

    public RegionalSettings(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public RegionalSettings(SharePointQueryable parent, String path) {
        super(parent, path);
    }
}
