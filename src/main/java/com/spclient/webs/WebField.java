package com.spclient.webs;

import java.util.Arrays;

/**
 * Field paths of a web that can be requested with {@code $select}. Paths below
 * {@code CurrentUser/} and {@code ParentWeb/} also need the matching {@code $expand}.
 */
public enum WebField {
    ALLOW_RSS_FEEDS("AllowRssFeeds"),
    ALTERNATE_CSS_URL("AlternateCssUrl"),
    APP_INSTANCE_ID("AppInstanceId"),
    CONFIGURATION("Configuration"),
    CREATED("Created"),
    CURRENT_CHANGE_TOKEN("CurrentChangeToken"),
    CURRENT_USER_EMAIL("CurrentUser/Email"),
    CURRENT_USER_ID("CurrentUser/Id"),
    CURRENT_USER_IS_EMAIL_AUTHENTICATION_GUEST_USER("CurrentUser/IsEmailAuthenticationGuestUser"),
    CURRENT_USER_IS_HIDDEN_IN_UI("CurrentUser/IsHiddenInUI"),
    CURRENT_USER_IS_SHARE_BY_EMAIL_GUEST_USER("CurrentUser/IsShareByEmailGuestUser"),
    CURRENT_USER_IS_SITE_ADMIN("CurrentUser/IsSiteAdmin"),
    CURRENT_USER_LOGIN_NAME("CurrentUser/LoginName"),
    CURRENT_USER_PRINCIPAL_TYPE("CurrentUser/PrincipalType"),
    CURRENT_USER_TITLE("CurrentUser/Title"),
    CURRENT_USER_USER_ID("CurrentUser/UserId"),
    CURRENT_USER_ODATA_EDIT_LINK("CurrentUser/odata.editLink"),
    CURRENT_USER_ODATA_ID("CurrentUser/odata.id"),
    CURRENT_USER_ODATA_TYPE("CurrentUser/odata.type"),
    CUSTOM_MASTER_URL("CustomMasterUrl"),
    DESCRIPTION("Description"),
    DESIGN_PACKAGE_ID("DesignPackageId"),
    DOCUMENT_LIBRARY_CALLOUT_OFFICE_WEB_APP_PREVIEWERS_DISABLED("DocumentLibraryCalloutOfficeWebAppPreviewersDisabled"),
    ENABLE_MINIMAL_DOWNLOAD("EnableMinimalDownload"),
    FOOTER_ENABLED("FooterEnabled"),
    HEADER_EMPHASIS("HeaderEmphasis"),
    HEADER_LAYOUT("HeaderLayout"),
    HORIZONTAL_QUICK_LAUNCH("HorizontalQuickLaunch"),
    ID("Id"),
    IS_MULTILINGUAL("IsMultilingual"),
    LANGUAGE("Language"),
    LAST_ITEM_MODIFIED_DATE("LastItemModifiedDate"),
    LAST_ITEM_USER_MODIFIED_DATE("LastItemUserModifiedDate"),
    MASTER_URL("MasterUrl"),
    MEGA_MENU_ENABLED("MegaMenuEnabled"),
    NO_CRAWL("NoCrawl"),
    OBJECT_CACHE_ENABLED("ObjectCacheEnabled"),
    OVERWRITE_TRANSLATIONS_ON_CHANGE("OverwriteTranslationsOnChange"),
    QUICK_LAUNCH_ENABLED("QuickLaunchEnabled"),
    PARENT_WEB_CONFIGURATION("ParentWeb/Configuration"),
    PARENT_WEB_CREATED("ParentWeb/Created"),
    PARENT_WEB_DESCRIPTION("ParentWeb/Description"),
    PARENT_WEB_ID("ParentWeb/Id"),
    PARENT_WEB_LANGUAGE("ParentWeb/Language"),
    PARENT_WEB_LAST_ITEM_MODIFIED_DATE("ParentWeb/LastItemModifiedDate"),
    PARENT_WEB_LAST_ITEM_USER_MODIFIED_DATE("ParentWeb/LastItemUserModifiedDate"),
    PARENT_WEB_SERVER_RELATIVE_URL("ParentWeb/ServerRelativeUrl"),
    PARENT_WEB_TITLE("ParentWeb/Title"),
    PARENT_WEB_WEB_TEMPLATE("ParentWeb/WebTemplate"),
    PARENT_WEB_WEB_TEMPLATE_ID("ParentWeb/WebTemplateId"),
    PARENT_WEB_ODATA_EDIT_LINK("ParentWeb/odata.editLink"),
    PARENT_WEB_ODATA_ID("ParentWeb/odata.id"),
    PARENT_WEB_ODATA_TYPE("ParentWeb/odata.type"),
    RECYCLE_BIN_ENABLED("RecycleBinEnabled"),
    RESOURCE_PATH("ResourcePath"),
    SERVER_RELATIVE_URL("ServerRelativeUrl"),
    SITE_LOGO_URL("SiteLogoUrl"),
    SYNDICATION_ENABLED("SyndicationEnabled"),
    TITLE("Title"),
    TREE_VIEW_ENABLED("TreeViewEnabled"),
    UI_VERSION("UIVersion"),
    UI_VERSION_CONFIGURATION_ENABLED("UIVersionConfigurationEnabled"),
    URL("Url"),
    WEB_TEMPLATE("WebTemplate"),
    WELCOME_PAGE("WelcomePage");

    private final String path;

    WebField(String path) {
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    /**
     * The navigation property this path goes through, or {@code null} for a direct field.
     */
    public String getNavigationProperty() {
        int index = path.indexOf('/');
        return index < 0 ? null : path.substring(0, index);
    }

    static String[] paths(WebField... fields) {
        return Arrays.stream(fields).map(WebField::getPath).toArray(String[]::new);
    }

    static String[] navigationProperties(WebField... fields) {
        return Arrays.stream(fields)
                .map(WebField::getNavigationProperty)
                .filter(p -> p != null)
                .distinct()
                .toArray(String[]::new);
    }

    @Override
    public String toString() {
        return path;
    }
}
