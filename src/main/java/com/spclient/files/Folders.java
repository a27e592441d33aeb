package com.spclient.files;

import com.spclient.odata.ODataUrls;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;

public class Folders extends SharePointQueryableCollection {

    public static final String DEFAULT_PATH = "folders";

    public Folders(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public Folders(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    public Folder getByName(String name) {
        return (Folder) new Folder(this, null).concat("(" + ODataUrls.quote(name) + ")");
    }
}
