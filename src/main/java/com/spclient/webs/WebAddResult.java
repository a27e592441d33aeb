package com.spclient.webs;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result from adding a web.
 */
public final class WebAddResult {

    private final JsonNode data;
    private final Web web;

    public WebAddResult(JsonNode data, Web web) {
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
