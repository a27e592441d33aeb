package com.spclient.features;

import com.fasterxml.jackson.databind.JsonNode;
import com.spclient.RecordingClient;
import com.spclient.webs.Web;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.spclient.RecordingClient.BASE_URL;
import static org.junit.jupiter.api.Assertions.*;

class FeaturesTest {

    private static final String WEB_URL = BASE_URL + "/_api/web";
    private static final String CATALOG_URL = BASE_URL + "/_api/web/tenantappcatalog/AvailableApps";

    private RecordingClient client;
    private Web web;

    @BeforeEach
    void setUp() {
        client = new RecordingClient();
        web = client.web();
    }

    @Test
    void webLevelFeatureReferences() {
        assertEquals(WEB_URL + "/features('87294c72')", web.features().getById("87294c72").toUrl());
        assertEquals(WEB_URL + "/navigation/topnavigationbar", web.navigation().topNavigationBar().toUrl());
        assertEquals(WEB_URL + "/regionalsettings", web.regionalSettings().toUrl());
        assertEquals(WEB_URL + "/usercustomactions", web.userCustomActions().toUrl());
    }

    @Test
    void appCatalogFromAnyUrlBelowWeb() {
        AppCatalog catalog = web.getAppCatalog(BASE_URL + "/_api/web/lists");

        assertEquals(CATALOG_URL, catalog.toUrl());
        assertEquals(CATALOG_URL + "/getById('app-1')", catalog.getAppById("app-1").toUrl());
    }

    @Test
    void installPostsToApp() {
        web.getAppCatalog().installAsync("app-1").join();

        assertEquals("POST", client.lastRequest().getMethod());
        assertEquals(CATALOG_URL + "/getById('app-1')/Install", client.lastRequest().getUrl());
    }

    @Test
    void relatedItemsPostsSource() {
        client.respondWith("[{\"ItemId\":4,\"ListId\":\"x\"}]");

        JsonNode related = web.relatedItems().getRelatedItemsAsync("Tasks", 3).join();

        assertEquals(BASE_URL + "/_api/SP.RelatedItemManager.GetRelatedItems", client.lastRequest().getUrl());
        JsonNode body = client.bodyOf(client.lastRequest());
        assertEquals(3, body.get("SourceItemID").asInt());
        assertEquals("Tasks", body.get("SourceListName").asText());
        assertEquals(4, related.get(0).get("ItemId").asInt());
    }

    @Test
    void relatedItemManagerFromWebUrl() {
        assertEquals(BASE_URL + "/_api/SP.RelatedItemManager", RelatedItemManager.fromUrl(client, BASE_URL).toUrl());
    }
}
