package com.spclient.webs;

import com.fasterxml.jackson.databind.JsonNode;
import com.spclient.lists.List;

/**
 * Result from retrieving a catalog.
 */
public final class GetCatalogResult {

    private final JsonNode data;
    private final List list;

    public GetCatalogResult(JsonNode data, List list) {
        this.data = data;
        this.list = list;
    }

    public JsonNode getData() {
        return data;
    }

    public List getList() {
        return list;
    }
}
