package com.spclient.features;

import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;
import com.spclient.odata.SharePointQueryableInstance;

/**
 * Navigation settings of a web.
 */
public class Navigation extends SharePointQueryableInstance {

    public static final String DEFAULT_PATH = "navigation";

    public Navigation(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public Navigation(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    public SharePointQueryableCollection quickLaunch() {
        return new SharePointQueryableCollection(this, "quicklaunch");
    }

    public SharePointQueryableCollection topNavigationBar() {
        return new SharePointQueryableCollection(this, "topnavigationbar");
    }
}
