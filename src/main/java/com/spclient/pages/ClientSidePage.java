package com.spclient.pages;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spclient.files.File;
import com.spclient.files.TemplateFileType;
import com.spclient.lists.Item;
import com.spclient.lists.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * A modern (client side) page, backed by an {@code .aspx} file in a pages library.
 */
public class ClientSidePage extends File {

    private static final Logger log = LoggerFactory.getLogger(ClientSidePage.class);

    static final String CLIENT_SIDE_APPLICATION_ID = "b6917cb1-93a0-4b97-a84d-7cf49975d4ec";
    static final String BANNER_IMAGE_URL = "/_layouts/15/images/sitepagethumbnail.png";
    static final String DEFAULT_LAYOUT = "Article";

    private final String pageLayoutType;

    public ClientSidePage(File file, String pageLayoutType) {
        super(file.getClient(), file.toUrl());
        this.pageLayoutType = pageLayoutType;
    }

    public String getPageLayoutType() {
        return pageLayoutType;
    }

    /**
     * {@code news.aspx} becomes {@code news}.
     */
    public static String titleFromPageName(String pageName) {
        return pageName.replaceFirst("\\.[^/.]+$", "");
    }

    public static CompletableFuture<ClientSidePage> createAsync(List library, String pageName, String title) {
        return createAsync(library, pageName, title, DEFAULT_LAYOUT);
    }

    /**
     * Creates the page file from the client side page template in the library's root folder and
     * stamps its list item with the title, layout and the modern page application id.
     *
     * @param library the pages library
     * @param pageName file name of the page, e.g. {@code news.aspx}
     * @param title display title of the page
     * @param pageLayoutType page layout, e.g. {@code Article}
     */
    public static CompletableFuture<ClientSidePage> createAsync(List library, String pageName, String title, String pageLayoutType) {
        return library.rootFolder().serverRelativeUrlAsync()
                .thenCompose(folderUrl -> library.rootFolder().files()
                        .addTemplateFileAsync(folderUrl + "/" + pageName, TemplateFileType.CLIENT_SIDE_PAGE))
                .thenCompose(added -> added.getFile().getItemAsync())
                .thenCompose(item -> item.updateAsync(pageFields(item, title, pageLayoutType))
                        .thenApply(data -> {
                            log.debug("Created client side page {} in {}", pageName, library.toUrl());
                            return new ClientSidePage(item.file(), pageLayoutType);
                        }));
    }

    private static ObjectNode pageFields(Item item, String title, String pageLayoutType) {
        ObjectNode fields = item.getClient().getObjectMapper().createObjectNode();
        ObjectNode banner = fields.putObject("BannerImageUrl");
        banner.putObject("__metadata").put("type", "SP.FieldUrlValue");
        banner.put("Url", BANNER_IMAGE_URL);
        fields.put("ClientSideApplicationId", CLIENT_SIDE_APPLICATION_ID);
        fields.put("PageLayoutType", pageLayoutType);
        fields.put("Title", title);
        return fields;
    }
}
