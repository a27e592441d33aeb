package com.spclient.odata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ODataUrlsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void combineJoinsWithSingleSlashes() {
        assertEquals("https://x/sites/a/_api/web", ODataUrls.combine("https://x/sites/a/", "/_api/web"));
        assertEquals("a/b/c", ODataUrls.combine("a", null, "", "b/", "c"));
        assertEquals("a/b", ODataUrls.combine("a\\", "b"));
        assertEquals("", ODataUrls.combine());
    }

    @Test
    void detectsAbsoluteUrls() {
        assertTrue(ODataUrls.isUrlAbsolute("https://contoso.sharepoint.com"));
        assertTrue(ODataUrls.isUrlAbsolute("HTTP://contoso"));
        assertTrue(ODataUrls.isUrlAbsolute("//contoso"));
        assertFalse(ODataUrls.isUrlAbsolute("_api/web"));
        assertFalse(ODataUrls.isUrlAbsolute(null));
    }

    @Test
    void extractWebUrlCutsAtApiSegment() {
        assertEquals("https://x/sites/a/", ODataUrls.extractWebUrl("https://x/sites/a/_api/web/lists"));
        assertEquals("https://x/sites/a", ODataUrls.extractWebUrl("https://x/sites/a"));
        assertEquals("", ODataUrls.extractWebUrl(null));
    }

    @Test
    void quoteDoublesSingleQuotes() {
        assertEquals("'O''Neil'", ODataUrls.quote("O'Neil"));
        assertEquals("''", ODataUrls.quote(""));
    }

    @Test
    void webEntitiesUseTheirId() throws Exception {
        JsonNode web = json("{\"odata.type\":\"SP.Web\",\"odata.id\":\"https://x/sites/a/_api/Web\",\"odata.editLink\":\"Web\"}");

        assertEquals("https://x/sites/a/_api/Web", ODataUrls.odataUrlFrom(web));
    }

    @Test
    void verboseWebEntitiesUseMetadataUri() throws Exception {
        JsonNode web = json("{\"__metadata\":{\"type\":\"SP.Web\",\"uri\":\"https://x/sites/a/_api/Web\"},\"Id\":\"1\"}");

        assertEquals("https://x/sites/a/_api/Web", ODataUrls.odataUrlFrom(web));
    }

    @Test
    void minimalMetadataCombinesWebUrlAndEditLink() throws Exception {
        JsonNode list = json("{\"odata.metadata\":\"https://x/sites/a/_api/$metadata#SP.ApiData.Lists/@Element\","
                + "\"odata.type\":\"SP.List\",\"odata.editLink\":\"Web/Lists(guid'1')\"}");

        assertEquals("https://x/sites/a/_api/Web/Lists(guid'1')", ODataUrls.odataUrlFrom(list));
    }

    @Test
    void editLinkAloneIsRelative() throws Exception {
        assertEquals("_api/Web/Lists(guid'1')", ODataUrls.odataUrlFrom(json("{\"odata.editLink\":\"Web/Lists(guid'1')\"}")));
    }

    @Test
    void verboseEntitiesUseMetadataUri() throws Exception {
        JsonNode user = json("{\"__metadata\":{\"type\":\"SP.User\",\"uri\":\"https://x/_api/Web/GetUserById(3)\"}}");

        assertEquals("https://x/_api/Web/GetUserById(3)", ODataUrls.odataUrlFrom(user));
    }

    @Test
    void payloadWithoutUriInformationYieldsEmptyString() throws Exception {
        assertEquals("", ODataUrls.odataUrlFrom(json("{\"Title\":\"x\"}")));
        assertEquals("", ODataUrls.odataUrlFrom(json("[]")));
        assertEquals("", ODataUrls.odataUrlFrom(null));
    }
}
