package com.spclient.odata;

import com.spclient.RecordingClient;
import com.spclient.SharePointRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SharePointQueryableTest {

    private RecordingClient client;

    @BeforeEach
    void setUp() {
        client = new RecordingClient();
    }

    @Nested
    @DisplayName("construction from a url string")
    class FromString {

        @Test
        void absoluteUrlIsItsOwnParent() {
            SharePointQueryable ref = new SharePointQueryableInstance(client, "https://x/sites/a", "_api/web");

            assertEquals("https://x/sites/a", ref.getParentUrl());
            assertEquals("https://x/sites/a/_api/web", ref.toUrl());
        }

        @Test
        void pathAfterParenthesesHasParentBeforeLastSlash() {
            SharePointQueryable ref = new SharePointQueryableInstance(client, "_api/web/lists(guid'1')/items(19)/fields", null);

            assertEquals("_api/web/lists(guid'1')/items(19)", ref.getParentUrl());
            assertEquals("_api/web/lists(guid'1')/items(19)/fields", ref.toUrl());
        }

        @Test
        void trailingFunctionCallHasParentBeforeParenthesis() {
            SharePointQueryable ref = new SharePointQueryableInstance(client, "_api/web/lists(guid'1')/items(19)", null);

            assertEquals("_api/web/lists(guid'1')/items", ref.getParentUrl());
            assertEquals("_api/web/lists(guid'1')/items(19)", ref.toUrl());
        }

        @Test
        void slashLessUrlIsItsOwnParent() {
            SharePointQueryable ref = new SharePointQueryableInstance(client, "web", "lists");

            assertEquals("web", ref.getParentUrl());
            assertEquals("web/lists", ref.toUrl());
        }
    }

    @Test
    void childAppendsPathToParent() {
        SharePointQueryable web = new SharePointQueryableInstance(client, RecordingClient.BASE_URL, "_api/web");
        SharePointQueryable lists = new SharePointQueryableCollection(web, "lists");

        assertEquals(RecordingClient.BASE_URL + "/_api/web/lists", lists.toUrl());
        assertEquals(web.toUrl(), lists.getParentUrl());
        assertSame(client, lists.getClient());
    }

    @Test
    void concatAppendsWithoutSlash() {
        SharePointQueryable ref = new SharePointQueryableInstance(client, "https://x/_api/web", "applywebtemplate");

        SharePointQueryable called = ref.concat("(@t)");

        assertEquals("https://x/_api/web/applywebtemplate(@t)", called.toUrl());
        assertEquals("https://x/_api/web/applywebtemplate", ref.toUrl());
        assertEquals(SharePointQueryableInstance.class, called.getClass());
    }

    @Test
    void queryMethodsReturnCopies() {
        SharePointQueryable ref = new SharePointQueryableInstance(client, "https://x/_api/web", null);

        SharePointQueryable selected = ref.expand("ParentWeb").select("Title", "ParentWeb/Id");

        assertTrue(ref.getQuery().isEmpty());
        assertEquals("https://x/_api/web?$expand=ParentWeb&$select=Title%2CParentWeb%2FId", selected.toUrlAndQuery());
    }

    @Test
    void queryIsAppendedWithAmpersandWhenUrlHasOne() {
        SharePointQueryable ref = new SharePointQueryableInstance(client, "https://x/_api/web?a=1", null);

        assertEquals("https://x/_api/web?a=1&$top=5", ref.withQuery("$top", "5").toUrlAndQuery());
    }

    @Test
    void collectionQueryOptions() {
        SharePointQueryableCollection lists = new SharePointQueryableCollection(client, "https://x", "_api/web/lists");

        String url = lists.filter("Hidden eq false").top(10).orderBy("Title", true).toUrlAndQuery();

        assertEquals("https://x/_api/web/lists?$filter=Hidden+eq+false&$top=10&$orderby=Title+asc", url);
    }

    @Test
    void collectionKeepsItsOptionsAfterSelectAndExpand() {
        SharePointQueryableCollection lists = new SharePointQueryableCollection(client, "https://x", "_api/web/lists");

        SharePointQueryableCollection shaped = lists.select("Title").expand("RootFolder").top(2).filter("Hidden eq true");

        assertEquals("https://x/_api/web/lists?$select=Title&$expand=RootFolder&$top=2&$filter=Hidden+eq+true",
                shaped.toUrlAndQuery());
        assertTrue(lists.getQuery().isEmpty());
    }

    @Test
    void childKeepsTargetParameterOnly() {
        SharePointQueryable ref = new SharePointQueryableInstance(client, "https://x/_api/web", null)
                .withQuery("@target", "'https://y'")
                .withQuery("$select", "Title");

        SharePointQueryable child = new SharePointQueryableInstance(ref, "lists");

        assertEquals("'https://y'", child.getQuery().get("@target"));
        assertFalse(child.getQuery().containsKey("$select"));
    }

    @Test
    void buildingReferencesSendsNothing() {
        SharePointQueryable web = new SharePointQueryableInstance(client, RecordingClient.BASE_URL, "_api/web");
        new SharePointQueryableCollection(web, "lists").select("Title").top(3);

        assertTrue(client.getRequests().isEmpty());
    }

    @Test
    void verbsIssueRequestsAgainstUrlAndQuery() {
        SharePointQueryable ref = new SharePointQueryableInstance(client, "https://x/_api/web", null).select("Id");

        ref.getAsync().join();
        ref.postCoreAsync().join();
        ref.deleteCoreAsync().join();

        assertEquals(3, client.getRequests().size());
        SharePointRequest get = client.getRequests().get(0);
        assertEquals("GET", get.getMethod());
        assertEquals("https://x/_api/web?$select=Id", get.getUrl());
        assertEquals("POST", client.getRequests().get(1).getMethod());
        assertNull(client.getRequests().get(1).getBody());
        assertEquals("DELETE", client.getRequests().get(2).getMethod());
    }

    @Test
    void cannotJoinTwoBatches() {
        SharePointQueryable ref = new SharePointQueryableInstance(client, "https://x/_api/web", null);
        SharePointQueryable batched = ref.inBatch(new Batch(client, "https://x"));

        assertTrue(batched.hasBatch());
        assertFalse(ref.hasBatch());
        assertThrows(IllegalStateException.class, () -> batched.inBatch(new Batch(client, "https://x")));
    }
}
