package com.spclient.lists;

import com.spclient.odata.ODataUrls;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;

/**
 * The lists of a web.
 */
public class Lists extends SharePointQueryableCollection {

    public static final String DEFAULT_PATH = "lists";

    public Lists(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public Lists(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    /**
     * {@code lists/getByTitle('<title>')}
     */
    public List getByTitle(String title) {
        return new List(this, "getByTitle(" + ODataUrls.quote(title) + ")");
    }

    /**
     * {@code lists('<id>')}
     */
    public List getById(String id) {
        return (List) new List(this, null).concat("('" + id + "')");
    }
}
