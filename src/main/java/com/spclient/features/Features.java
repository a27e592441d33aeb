package com.spclient.features;

import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;
import com.spclient.odata.SharePointQueryableInstance;

/**
 * The features activated on a web or site.
 */
public class Features extends SharePointQueryableCollection {

    public static final String DEFAULT_PATH = "features";

    public Features(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public Features(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    /**
     * {@code features('<id>')}
     */
    public SharePointQueryableInstance getById(String id) {
        return (SharePointQueryableInstance) new SharePointQueryableInstance(this, null).concat("('" + id + "')");
    }
}
