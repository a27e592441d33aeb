package com.spclient.lists;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spclient.RecordingClient;
import com.spclient.SharePointRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static com.spclient.RecordingClient.BASE_URL;
import static org.junit.jupiter.api.Assertions.*;

class ItemTest {

    private static final String LIST_URL = BASE_URL + "/_api/Web/Lists(guid'aaaa')";

    private RecordingClient client;
    private Item item;

    @BeforeEach
    void setUp() {
        client = new RecordingClient();
        item = new Item(client, LIST_URL + "/Items(7)");
    }

    @Test
    void parentListIsCutFromItemUrl() {
        assertEquals(LIST_URL, item.parentList().toUrl());
        assertEquals("_api/web/lists(guid'a')", new Item(client, "_api/web/lists(guid'a')/items(3)").parentList().toUrl());
    }

    @Test
    void fileOfItem() {
        assertEquals(LIST_URL + "/Items(7)/file", item.file().toUrl());
    }

    @Test
    void updateReadsEntityTypeThenMerges() {
        client.respondWith("{\"ListItemEntityTypeFullName\":\"SP.Data.TasksListItem\"}");
        ObjectNode properties = client.getObjectMapper().createObjectNode().put("Title", "Done");

        item.updateAsync(properties).join();

        assertEquals(2, client.getRequests().size());
        assertEquals(LIST_URL + "?$select=ListItemEntityTypeFullName", client.getRequests().get(0).getUrl());

        SharePointRequest merge = client.getRequests().get(1);
        assertEquals("POST", merge.getMethod());
        assertEquals(LIST_URL + "/Items(7)", merge.getUrl());
        assertEquals("*", merge.getHeaders().get("IF-MATCH"));
        assertEquals("MERGE", merge.getHeaders().get("X-HTTP-Method"));
        JsonNode body = client.bodyOf(merge);
        assertEquals("SP.Data.TasksListItem", body.get("__metadata").get("type").asText());
        assertEquals("Done", body.get("Title").asText());
    }

    @Test
    void updateOfItemWithoutListUrlFails() {
        Item detached = new Item(client, "");

        CompletableFuture<JsonNode> result = detached.updateAsync(client.getObjectMapper().createObjectNode());

        CompletionException thrown = assertThrows(CompletionException.class, result::join);
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
        assertTrue(client.getRequests().isEmpty());
        assertThrows(IllegalStateException.class, detached::parentList);
    }
}
