package com.spclient.lists;

import com.spclient.SharePointClient;
import com.spclient.files.Folder;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableInstance;

/**
 * A single list or document library.
 */
public class List extends SharePointQueryableInstance {

    public List(SharePointClient client, String baseUrl) {
        super(client, baseUrl);
    }

    public List(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    public Folder rootFolder() {
        return new Folder(this, "rootFolder");
    }

    @Override
    public List select(String... fields) {
        return (List) super.select(fields);
    }
}
