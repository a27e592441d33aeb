package com.spclient.webs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spclient.SharePointClient;
import com.spclient.features.AppCatalog;
import com.spclient.features.Features;
import com.spclient.features.Navigation;
import com.spclient.features.RegionalSettings;
import com.spclient.features.RelatedItemManager;
import com.spclient.features.UserCustomActions;
import com.spclient.files.File;
import com.spclient.files.Folder;
import com.spclient.files.Folders;
import com.spclient.lists.ContentTypes;
import com.spclient.lists.Fields;
import com.spclient.lists.List;
import com.spclient.lists.Lists;
import com.spclient.odata.Batch;
import com.spclient.odata.ODataUrls;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;
import com.spclient.odata.SharePointQueryableInstance;
import com.spclient.pages.ClientSidePage;
import com.spclient.pages.ClientSidePageComponent;
import com.spclient.sites.OpenWebResult;
import com.spclient.sites.Site;
import com.spclient.users.CurrentUser;
import com.spclient.users.RoleDefinitions;
import com.spclient.users.SiteGroup;
import com.spclient.users.SiteGroups;
import com.spclient.users.SiteUser;
import com.spclient.users.SiteUserProps;
import com.spclient.users.SiteUsers;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A SharePoint web ({@code SP.Web}).
 */
public class Web extends SharePointQueryableInstance {

    public static final String DEFAULT_PATH = "_api/web";

    public static final String DEFAULT_LIBRARY_TITLE = "Site Pages";

    public Web(SharePointClient client, String baseUrl) {
        this(client, baseUrl, null);
    }

    public Web(SharePointClient client, String baseUrl, String path) {
        super(client, baseUrl, path == null ? DEFAULT_PATH : path);
    }

    public Web(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public Web(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    /**
     * Creates a web from any url below it by cutting at the {@code _api/} segment. A url without
     * that segment is taken as the web url itself.
     */
    public static Web fromUrl(SharePointClient client, String url) {
        return fromUrl(client, url, null);
    }

    public static Web fromUrl(SharePointClient client, String url, String path) {
        return new Web(client, ODataUrls.extractWebUrl(url), path);
    }

    // --- Query shaping ---

    @Override
    public Web select(String... fields) {
        return (Web) super.select(fields);
    }

    @Override
    public Web expand(String... fields) {
        return (Web) super.expand(fields);
    }

    @Override
    public Web inBatch(Batch batch) {
        return (Web) super.inBatch(batch);
    }

    /**
     * Selects the given fields and expands the navigation properties they go through.
     */
    public Web select(WebField... fields) {
        String[] navigation = WebField.navigationProperties(fields);
        Web web = navigation.length > 0 ? expand(navigation) : this;
        return web.select(WebField.paths(fields));
    }

    public CompletableFuture<WebProps> getPropsAsync() {
        return getAsAsync(WebProps.class);
    }

    // --- Child resources ---

    public Webs webs() {
        return new Webs(this);
    }

    public WebInfos webinfos() {
        return new WebInfos(this);
    }

    public SharePointQueryableCollection allProperties() {
        return new SharePointQueryableCollection(this, "allproperties");
    }

    public ContentTypes contentTypes() {
        return new ContentTypes(this);
    }

    public Lists lists() {
        return new Lists(this);
    }

    public Fields fields() {
        return new Fields(this);
    }

    public Fields availableFields() {
        return new Fields(this, "availablefields");
    }

    public Features features() {
        return new Features(this);
    }

    public Navigation navigation() {
        return new Navigation(this);
    }

    public SiteUsers siteUsers() {
        return new SiteUsers(this);
    }

    public SiteGroups siteGroups() {
        return new SiteGroups(this);
    }

    public List siteUserInfoList() {
        return new List(this, "siteuserinfolist");
    }

    public RegionalSettings regionalSettings() {
        return new RegionalSettings(this);
    }

    public CurrentUser currentUser() {
        return new CurrentUser(this);
    }

    public Folders folders() {
        return new Folders(this);
    }

    public UserCustomActions userCustomActions() {
        return new UserCustomActions(this);
    }

    public RoleDefinitions roleDefinitions() {
        return new RoleDefinitions(this);
    }

    public RelatedItemManager relatedItems() {
        return RelatedItemManager.fromUrl(getClient(), toUrl());
    }

    public Folder rootFolder() {
        return new Folder(this, "rootFolder");
    }

    public SiteGroup associatedOwnerGroup() {
        return new SiteGroup(this, "associatedownergroup");
    }

    public SiteGroup associatedMemberGroup() {
        return new SiteGroup(this, "associatedmembergroup");
    }

    public SiteGroup associatedVisitorGroup() {
        return new SiteGroup(this, "associatedvisitorgroup");
    }

    public List defaultDocumentLibrary() {
        return new List(this, "DefaultDocumentLibrary");
    }

    public SharePointQueryableCollection customListTemplates() {
        return new SharePointQueryableCollection(this, "getcustomlisttemplates");
    }

    /**
     * A batch bound to this web's url. Attach references with {@link #inBatch(Batch)}.
     */
    public Batch createBatch() {
        return new Batch(getClient(), getParentUrl());
    }

    /**
     * Subsites of this web of which the current user is a member.
     *
     * @param nWebTemplateFilter site definition to filter on, -1 for all
     * @param nConfigurationFilter configuration id to filter on, -1 for all
     */
    public Webs getSubwebsFilteredForCurrentUser(int nWebTemplateFilter, int nConfigurationFilter) {
        return child(Webs::new, "getSubwebsFilteredForCurrentUser(nWebTemplateFilter=" + nWebTemplateFilter
                + ",nConfigurationFilter=" + nConfigurationFilter + ")");
    }

    public Webs getSubwebsFilteredForCurrentUser() {
        return getSubwebsFilteredForCurrentUser(-1, -1);
    }

    /**
     * @param folderRelativeUrl server relative path of the folder, including {@code /sites/...}
     */
    public Folder getFolderByServerRelativeUrl(String folderRelativeUrl) {
        return new Folder(this, "getFolderByServerRelativeUrl(" + ODataUrls.quote(folderRelativeUrl) + ")");
    }

    /**
     * Like {@link #getFolderByServerRelativeUrl(String)} for paths whose names contain {@code #} or
     * {@code %}; those names must already be percent-encoded.
     */
    public Folder getFolderByServerRelativePath(String folderRelativeUrl) {
        return new Folder(this, "getFolderByServerRelativePath(decodedUrl=" + ODataUrls.quote(folderRelativeUrl) + ")");
    }

    public File getFileByServerRelativeUrl(String fileRelativeUrl) {
        return new File(this, "getFileByServerRelativeUrl(" + ODataUrls.quote(fileRelativeUrl) + ")");
    }

    public File getFileByServerRelativePath(String fileRelativeUrl) {
        return new File(this, "getFileByServerRelativePath(decodedUrl=" + ODataUrls.quote(fileRelativeUrl) + ")");
    }

    /**
     * @param listRelativeUrl server relative path of the list's root folder
     */
    public List getList(String listRelativeUrl) {
        return new List(this, "getList(" + ODataUrls.quote(listRelativeUrl) + ")");
    }

    /**
     * Site templates available for this web.
     *
     * @param language locale id of the templates
     * @param includeCrossLanguage whether language-neutral templates are included
     */
    public SharePointQueryableCollection availableWebTemplates(int language, boolean includeCrossLanguage) {
        return new SharePointQueryableCollection(this, "getavailablewebtemplates(lcid=" + language
                + ", doincludecrosslanguage=" + includeCrossLanguage + ")");
    }

    public SharePointQueryableCollection availableWebTemplates() {
        return availableWebTemplates(Webs.DEFAULT_LANGUAGE, true);
    }

    public SiteUser getUserById(int id) {
        return new SiteUser(this, "getUserById(" + id + ")");
    }

    /**
     * The tenant app catalog as seen from this web.
     */
    public AppCatalog getAppCatalog() {
        return new AppCatalog(getClient(), toUrl());
    }

    public AppCatalog getAppCatalog(String url) {
        return new AppCatalog(getClient(), url);
    }

    public AppCatalog getAppCatalog(Web web) {
        return new AppCatalog(getClient(), web.toUrl());
    }

    // --- Operations ---

    /**
     * GET {@code _api/web?$expand=ParentWeb&$select=ParentWeb/Id}, then opens the parent by id
     * through the site collection. Fails with {@link IllegalStateException} for a root web.
     */
    public CompletableFuture<OpenWebResult> getParentWebAsync() {
        return select(WebField.PARENT_WEB_ID).getAsync()
                .thenCompose(data -> {
                    String parentId = data.path("ParentWeb").path("Id").asText("");
                    if (parentId.isEmpty()) {
                        return CompletableFuture.failedFuture(new IllegalStateException("Web " + toUrl() + " has no parent web."));
                    }
                    String url = toUrlAndQuery();
                    int index = url.indexOf("/_api");
                    Site site = new Site(getClient(), index < 0 ? url : url.substring(0, index));
                    return site.openWebByIdAsync(parentId);
                });
    }

    /**
     * POST {@code _api/web} with {@code X-HTTP-Method: MERGE}
     * <p>
     * Body: the properties to change, tagged as {@code SP.Web}.
     *
     * @param properties web properties to update, e.g. {@code Title}
     * @return CompletableFuture with the raw payload and this same reference
     */
    public CompletableFuture<WebUpdateResult> updateAsync(Map<String, ?> properties) {
        ObjectNode body = typedBody("SP.Web");
        properties.forEach((key, value) -> body.set(key, getClient().getObjectMapper().valueToTree(value)));

        return postCoreAsync(body, Collections.singletonMap("X-HTTP-Method", "MERGE"))
                .thenApply(data -> new WebUpdateResult(data, this));
    }

    /**
     * DELETE {@code _api/web}
     */
    public CompletableFuture<Void> deleteAsync() {
        return deleteCoreAsync().thenAccept(data -> {});
    }

    /**
     * POST {@code _api/web/applytheme}
     *
     * @param colorPaletteUrl server relative url of the color palette file
     * @param fontSchemeUrl server relative url of the font scheme
     * @param backgroundImageUrl server relative url of the background image
     * @param shareGenerated whether the generated theme files are stored in the root site instead of this web
     */
    public CompletableFuture<Void> applyThemeAsync(String colorPaletteUrl, String fontSchemeUrl,
                                                   String backgroundImageUrl, boolean shareGenerated) {
        ObjectNode body = newBody();
        body.put("backgroundImageUrl", backgroundImageUrl);
        body.put("colorPaletteUrl", colorPaletteUrl);
        body.put("fontSchemeUrl", fontSchemeUrl);
        body.put("shareGenerated", shareGenerated);

        return child(Web::new, "applytheme").postCoreAsync(body).thenAccept(data -> {});
    }

    /**
     * POST {@code _api/web/applywebtemplate(@t)?@t='<template>'}
     * <p>
     * Only valid for a web that has no template applied yet.
     *
     * @param template name of the site definition or site template, e.g. {@code STS#0}
     */
    public CompletableFuture<Void> applyWebTemplateAsync(String template) {
        return child(Web::new, "applywebtemplate")
                .concat("(@t)")
                .withQuery("@t", ODataUrls.quote(template))
                .postCoreAsync()
                .thenAccept(data -> {});
    }

    /**
     * POST {@code _api/web/ensureuser}
     * <p>
     * Adds the login to the web if it is not a user there yet.
     *
     * @param loginName login name, e.g. {@code i:0#.f|membership|user@domain.onmicrosoft.com}
     * @return CompletableFuture with the user's properties and a reference to the user
     */
    public CompletableFuture<WebEnsureUserResult> ensureUserAsync(String loginName) {
        ObjectNode body = newBody();
        body.put("logonName", loginName);

        return child(Web::new, "ensureuser").postCoreAsync(body)
                .thenApply(data -> new WebEnsureUserResult(
                        getClient().convert(data, SiteUserProps.class),
                        new SiteUser(getClient(), ODataUrls.odataUrlFrom(data))));
    }

    /**
     * GET {@code _api/web/getcatalog(<type>)?$select=Id}
     *
     * @param type gallery type: WebTemplateCatalog = 111, WebPartCatalog = 113, ListTemplateCatalog = 114,
     *             MasterPageCatalog = 116, SolutionCatalog = 121, ThemeCatalog = 123, DesignCatalog = 124,
     *             AppDataCatalog = 125
     * @return CompletableFuture with the raw payload and a reference to the catalog list
     */
    public CompletableFuture<GetCatalogResult> getCatalogAsync(int type) {
        return child(Web::new, "getcatalog(" + type + ")").select("Id").getAsync()
                .thenApply(data -> new GetCatalogResult(data, new List(getClient(), ODataUrls.odataUrlFrom(data))));
    }

    /**
     * POST {@code _api/web/getchanges}
     * <p>
     * Body: {@code {"query": SP.ChangeQuery}}. The response is returned as is.
     */
    public CompletableFuture<JsonNode> getChangesAsync(ChangeQuery query) {
        ObjectNode changeQuery = typedBody("SP.ChangeQuery");
        changeQuery.setAll((ObjectNode) getClient().getObjectMapper().valueToTree(query));

        ObjectNode body = newBody();
        body.set("query", changeQuery);
        return child(Web::new, "getchanges").postCoreAsync(body);
    }

    /**
     * GET {@code _api/web/maptoicon(filename='<f>', progid='<p>', size=<n>)}
     *
     * @param filename the file name; an empty name yields an empty result
     * @param size 0 for 16x16 pixels, 1 for 32x32 pixels
     * @param progId ProgID of the application that created the file
     * @return CompletableFuture with the icon's image file name
     */
    public CompletableFuture<String> mapToIconAsync(String filename, int size, String progId) {
        return child(Web::new, "maptoicon(filename=" + ODataUrls.quote(filename) + ", progid=" + ODataUrls.quote(progId)
                + ", size=" + size + ")").getAsync()
                .thenApply(Web::scalarText);
    }

    public CompletableFuture<String> mapToIconAsync(String filename) {
        return mapToIconAsync(filename, 0, "");
    }

    /**
     * GET {@code _api/web/getStorageEntity('<key>')}
     */
    public CompletableFuture<StorageEntity> getStorageEntityAsync(String key) {
        return child(Web::new, "getStorageEntity(" + ODataUrls.quote(key) + ")").getAsAsync(StorageEntity.class);
    }

    /**
     * POST {@code _api/web/setStorageEntity}
     * <p>
     * Must be called in the context of the app catalog site.
     */
    public CompletableFuture<Void> setStorageEntityAsync(String key, String value, String description, String comments) {
        ObjectNode body = newBody();
        body.put("comments", comments);
        body.put("description", description);
        body.put("key", key);
        body.put("value", value);

        return child(Web::new, "setStorageEntity").postCoreAsync(body).thenAccept(data -> {});
    }

    public CompletableFuture<Void> setStorageEntityAsync(String key, String value) {
        return setStorageEntityAsync(key, value, "", "");
    }

    /**
     * POST {@code _api/web/removeStorageEntity('<key>')}
     */
    public CompletableFuture<Void> removeStorageEntityAsync(String key) {
        return child(Web::new, "removeStorageEntity(" + ODataUrls.quote(key) + ")").postCoreAsync().thenAccept(data -> {});
    }

    /**
     * GET {@code _api/web/GetClientSideWebParts}
     */
    public CompletableFuture<java.util.List<ClientSidePageComponent>> getClientSideWebPartsAsync() {
        return child(SharePointQueryableCollection::new, "GetClientSideWebParts").getAsync()
                .thenApply(data -> getClient().convertList(data, ClientSidePageComponent.class));
    }

    /**
     * Creates a modern page in the library with the given title.
     *
     * @param pageName file name of the new page, e.g. {@code news.aspx}
     * @param title display title; defaults to the page name without its extension
     * @param libraryTitle title of the library holding the page
     */
    public CompletableFuture<ClientSidePage> addClientSidePageAsync(String pageName, String title, String libraryTitle) {
        return ClientSidePage.createAsync(lists().getByTitle(libraryTitle), pageName, title);
    }

    public CompletableFuture<ClientSidePage> addClientSidePageAsync(String pageName) {
        return addClientSidePageAsync(pageName, ClientSidePage.titleFromPageName(pageName), DEFAULT_LIBRARY_TITLE);
    }

    /**
     * Creates a modern page in the library found at {@code listRelativePath}.
     */
    public CompletableFuture<ClientSidePage> addClientSidePageByPathAsync(String pageName, String listRelativePath, String title) {
        return ClientSidePage.createAsync(getList(listRelativePath), pageName, title);
    }

    public CompletableFuture<ClientSidePage> addClientSidePageByPathAsync(String pageName, String listRelativePath) {
        return addClientSidePageByPathAsync(pageName, listRelativePath, ClientSidePage.titleFromPageName(pageName));
    }

    /**
     * POST {@code _api/web/createDefaultAssociatedGroups}
     * <p>
     * Creates the Owners, Members and Visitors groups with their default permissions.
     */
    public CompletableFuture<Void> createDefaultAssociatedGroupsAsync() {
        return child(Web::new, "createDefaultAssociatedGroups").postCoreAsync().thenAccept(data -> {});
    }

    // verbose answers wrap a scalar in {"MapToIcon": "..."}, minimal ones are already unwrapped from "value"
    private static String scalarText(JsonNode data) {
        if (data.isValueNode()) {
            return data.asText();
        }
        return data.size() == 1 ? data.elements().next().asText() : "";
    }
}
