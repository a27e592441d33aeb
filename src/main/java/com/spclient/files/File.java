package com.spclient.files;

import com.spclient.SharePointClient;
import com.spclient.lists.Item;
import com.spclient.odata.ODataUrls;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableInstance;

import java.util.concurrent.CompletableFuture;

/**
 * A single file.
 */
public class File extends SharePointQueryableInstance {

    public File(SharePointClient client, String baseUrl) {
        super(client, baseUrl);
    }

    public File(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    public SharePointQueryableInstance listItemAllFields() {
        return new SharePointQueryableInstance(this, "ListItemAllFields");
    }

    /**
     * Loads the list item behind this file and returns a reference to it.
     */
    public CompletableFuture<Item> getItemAsync() {
        return listItemAllFields().getAsync()
                .thenApply(data -> new Item(getClient(), ODataUrls.odataUrlFrom(data)));
    }
}
