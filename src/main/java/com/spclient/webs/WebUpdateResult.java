package com.spclient.webs;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result from updating a web; {@link #getWeb()} is the updated reference itself.
 */
public final class WebUpdateResult {

    private final JsonNode data;
    private final Web web;

    public WebUpdateResult(JsonNode data, Web web) {
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
