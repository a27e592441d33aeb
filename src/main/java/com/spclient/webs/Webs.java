package com.spclient.webs;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spclient.odata.ODataUrls;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;

import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * The subwebs of a web.
 */
public class Webs extends SharePointQueryableCollection {

    public static final String DEFAULT_PATH = "webs";

    public static final String DEFAULT_TEMPLATE = "STS";
    public static final int DEFAULT_LANGUAGE = 1033;

    private static final Pattern API_WEB = Pattern.compile("_api/web/?", Pattern.CASE_INSENSITIVE);

    public Webs(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public Webs(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    /**
     * Adds a team site ({@code STS}) in English (1033) that inherits its parent's permissions.
     *
     * @see #addAsync(String, String, String, String, int, boolean)
     */
    public CompletableFuture<WebAddResult> addAsync(String title, String url) {
        return addAsync(title, url, "", DEFAULT_TEMPLATE, DEFAULT_LANGUAGE, true);
    }

    /**
     * POST {@code webs/add}
     * <p>
     * Body: {@code {"parameters": SP.WebCreationInformation}}.
     *
     * @param title the new web's title
     * @param url the new web's url, relative to this collection's web
     * @param description the new web's description
     * @param template internal name of the web template (e.g. {@code STS})
     * @param language locale id of the new web's language (e.g. 1033 for English, US)
     * @param inheritPermissions whether the new web inherits the permissions of its parent
     * @return CompletableFuture with the raw payload and a reference to the new web
     */
    public CompletableFuture<WebAddResult> addAsync(String title, String url, String description,
                                                    String template, int language, boolean inheritPermissions) {
        ObjectNode parameters = typedBody("SP.WebCreationInformation");
        parameters.put("Description", description);
        parameters.put("Language", language);
        parameters.put("Title", title);
        parameters.put("Url", url);
        parameters.put("UseSamePermissionsAsParentSite", inheritPermissions);
        parameters.put("WebTemplate", template);

        ObjectNode body = newBody();
        body.set("parameters", parameters);

        return child(Webs::new, "add").postCoreAsync(body)
                .thenApply(data -> {
                    String webUrl = API_WEB.matcher(ODataUrls.odataUrlFrom(data)).replaceFirst("");
                    return new WebAddResult(data, new Web(getClient(), webUrl));
                });
    }
}
