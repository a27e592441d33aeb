package com.spclient.files;

import com.spclient.RecordingClient;
import com.spclient.lists.Item;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.spclient.RecordingClient.BASE_URL;
import static org.junit.jupiter.api.Assertions.*;

class FilesTest {

    private static final String FOLDER_URL = BASE_URL + "/_api/web/getFolderByServerRelativeUrl('/sites/dev/SitePages')";

    private RecordingClient client;
    private Folder folder;

    @BeforeEach
    void setUp() {
        client = new RecordingClient();
        folder = client.web().getFolderByServerRelativeUrl("/sites/dev/SitePages");
    }

    @Test
    void folderChildren() {
        assertEquals(FOLDER_URL + "/files", folder.files().toUrl());
        assertEquals(FOLDER_URL + "/folders('Forms')", folder.folders().getByName("Forms").toUrl());
        assertEquals(FOLDER_URL + "/folders('Forms')/files", folder.folders().getByName("Forms").files().toUrl());
    }

    @Test
    void serverRelativeUrlIsRead() {
        client.respondWith("{\"ServerRelativeUrl\":\"/sites/dev/SitePages\"}");

        assertEquals("/sites/dev/SitePages", folder.serverRelativeUrlAsync().join());
        assertEquals(FOLDER_URL + "?$select=ServerRelativeUrl", client.lastRequest().getUrl());
    }

    @Test
    void addTemplateFileReturnsFileReference() {
        client.respondWith("{\"odata.metadata\":\"" + BASE_URL + "/_api/$metadata#SP.ApiData.Files12/@Element\","
                + "\"odata.type\":\"SP.File\",\"odata.editLink\":\"Web/GetFileByServerRelativePath(decodedUrl='%2Fsites%2Fdev%2FSitePages%2Fhome.aspx')\","
                + "\"Name\":\"home.aspx\"}");

        FileAddResult result = folder.files().addTemplateFileAsync("/sites/dev/SitePages/home.aspx", TemplateFileType.WIKI_PAGE).join();

        assertEquals("POST", client.lastRequest().getMethod());
        assertEquals(FOLDER_URL + "/files/addTemplateFile(urloffile='/sites/dev/SitePages/home.aspx',templatefiletype=1)",
                client.lastRequest().getUrl());
        assertEquals(BASE_URL + "/_api/Web/GetFileByServerRelativePath(decodedUrl='%2Fsites%2Fdev%2FSitePages%2Fhome.aspx')",
                result.getFile().toUrl());
        assertEquals("home.aspx", result.getData().get("Name").asText());
    }

    @Test
    void itemOfFile() {
        File file = client.web().getFileByServerRelativeUrl("/sites/dev/SitePages/home.aspx");
        client.respondWith("{\"odata.metadata\":\"" + BASE_URL + "/_api/$metadata#SP.ListData.SitePagesItems/@Element\","
                + "\"odata.editLink\":\"Web/Lists(guid'aaaa')/Items(7)\",\"Id\":7}");

        Item item = file.getItemAsync().join();

        assertEquals(BASE_URL + "/_api/web/getFileByServerRelativeUrl('/sites/dev/SitePages/home.aspx')/ListItemAllFields",
                client.lastRequest().getUrl());
        assertEquals(BASE_URL + "/_api/Web/Lists(guid'aaaa')/Items(7)", item.toUrl());
    }

    @Test
    void templateFileTypeValues() {
        assertEquals(0, TemplateFileType.STANDARD_PAGE.getValue());
        assertEquals(3, TemplateFileType.CLIENT_SIDE_PAGE.getValue());
    }
}
