package com.spclient.sites;

import com.spclient.RecordingClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.spclient.RecordingClient.BASE_URL;
import static org.junit.jupiter.api.Assertions.*;

class SiteTest {

    private RecordingClient client;

    @BeforeEach
    void setUp() {
        client = new RecordingClient();
    }

    @Test
    void siteAndRootWebPaths() {
        Site site = client.site();

        assertEquals(BASE_URL + "/_api/site", site.toUrl());
        assertEquals(BASE_URL + "/_api/site/rootweb", site.rootWeb().toUrl());
    }

    @Test
    void openWebByIdUsesEntityId() {
        client.respondWith("{\"odata.type\":\"SP.Web\",\"odata.id\":\"" + BASE_URL + "/sub/_api/Web\",\"Title\":\"Sub\"}");

        OpenWebResult result = client.site().openWebByIdAsync("1f2e").join();

        assertEquals("POST", client.lastRequest().getMethod());
        assertEquals(BASE_URL + "/_api/site/openWebById('1f2e')", client.lastRequest().getUrl());
        assertEquals(BASE_URL + "/sub/_api/web", result.getWeb().toUrl());
        assertEquals("Sub", result.getData().get("Title").asText());
    }

    @Test
    void openWebByIdFallsBackToMetadataUri() {
        client.respondWith("{\"__metadata\":{\"type\":\"SP.Web\",\"uri\":\"" + BASE_URL + "/other/_api/Web\"}}");

        OpenWebResult result = client.site().openWebByIdAsync("9").join();

        assertEquals(BASE_URL + "/other/_api/web", result.getWeb().toUrl());
    }
}
