package com.spclient.sites;

import com.fasterxml.jackson.databind.JsonNode;
import com.spclient.webs.Web;

/**
 * Result from opening a web by id.
 */
public final class OpenWebResult {

    private final JsonNode data;
    private final Web web;

    public OpenWebResult(JsonNode data, Web web) {
        this.data = data;
        this.web = web;
    }

    public JsonNode getData() {
        return data;
    }

    public Web getWeb() {
        return web;
    }
}
