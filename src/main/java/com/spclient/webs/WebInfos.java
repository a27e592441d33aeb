package com.spclient.webs;

import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;

/**
 * Lightweight descriptions ({@code SP.WebInformation}) of the subwebs of a web.
 */
public class WebInfos extends SharePointQueryableCollection {

    public static final String DEFAULT_PATH = "webinfos";

    public WebInfos(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public WebInfos(SharePointQueryable parent, String path) {
        super(parent, path);
    }
}
