package com.spclient.odata;

import com.spclient.SharePointClient;

/**
 * Reference to a collection endpoint. {@link #getAsync()} resolves with a JSON array.
 */
public class SharePointQueryableCollection extends SharePointQueryable {

    public SharePointQueryableCollection(SharePointClient client, String baseUrl, String path) {
        super(client, baseUrl, path);
    }

    public SharePointQueryableCollection(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    @Override
    public SharePointQueryableCollection withQuery(String key, String value) {
        return (SharePointQueryableCollection) super.withQuery(key, value);
    }

    @Override
    public SharePointQueryableCollection select(String... fields) {
        return (SharePointQueryableCollection) super.select(fields);
    }

    @Override
    public SharePointQueryableCollection expand(String... fields) {
        return (SharePointQueryableCollection) super.expand(fields);
    }

    public SharePointQueryableCollection filter(String filter) {
        return withQuery("$filter", filter);
    }

    public SharePointQueryableCollection top(int top) {
        return withQuery("$top", Integer.toString(top));
    }

    public SharePointQueryableCollection orderBy(String field, boolean ascending) {
        return withQuery("$orderby", field + (ascending ? " asc" : " desc"));
    }
}
