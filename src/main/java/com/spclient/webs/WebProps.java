package com.spclient.webs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Typed view of the commonly used scalar properties of {@code SP.Web}. Navigation properties
 * such as {@code ParentWeb} are left to {@link Web#expand(String...)} and raw JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebProps {

    @JsonProperty("Id")
    private String id;

    @JsonProperty("Title")
    private String title;

    @JsonProperty("Description")
    private String description;

    @JsonProperty("Url")
    private String url;

    @JsonProperty("ServerRelativeUrl")
    private String serverRelativeUrl;

    @JsonProperty("WebTemplate")
    private String webTemplate;

    @JsonProperty("Language")
    private int language;

    @JsonProperty("Configuration")
    private int configuration;

    @JsonProperty("Created")
    private String created;

    @JsonProperty("LastItemModifiedDate")
    private String lastItemModifiedDate;

    @JsonProperty("LastItemUserModifiedDate")
    private String lastItemUserModifiedDate;

    @JsonProperty("UIVersion")
    private int uiVersion;

    @JsonProperty("AllowRssFeeds")
    private boolean allowRssFeeds;

    @JsonProperty("QuickLaunchEnabled")
    private boolean quickLaunchEnabled;

    @JsonProperty("RecycleBinEnabled")
    private boolean recycleBinEnabled;

    @JsonProperty("TreeViewEnabled")
    private boolean treeViewEnabled;

    @JsonProperty("NoCrawl")
    private boolean noCrawl;

    @JsonProperty("IsMultilingual")
    private boolean multilingual;

    @JsonProperty("EnableMinimalDownload")
    private boolean enableMinimalDownload;

    @JsonProperty("WelcomePage")
    private String welcomePage;

    @JsonProperty("MasterUrl")
    private String masterUrl;

    @JsonProperty("CustomMasterUrl")
    private String customMasterUrl;

    @JsonProperty("SiteLogoUrl")
    private String siteLogoUrl;

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getUrl() {
        return url;
    }

    public String getServerRelativeUrl() {
        return serverRelativeUrl;
    }

    public String getWebTemplate() {
        return webTemplate;
    }

    public int getLanguage() {
        return language;
    }

    public int getConfiguration() {
        return configuration;
    }

    public String getCreated() {
        return created;
    }

    public String getLastItemModifiedDate() {
        return lastItemModifiedDate;
    }

    public String getLastItemUserModifiedDate() {
        return lastItemUserModifiedDate;
    }

    public int getUiVersion() {
        return uiVersion;
    }

    public boolean isAllowRssFeeds() {
        return allowRssFeeds;
    }

    public boolean isQuickLaunchEnabled() {
        return quickLaunchEnabled;
    }

    public boolean isRecycleBinEnabled() {
        return recycleBinEnabled;
    }

    public boolean isTreeViewEnabled() {
        return treeViewEnabled;
    }

    public boolean isNoCrawl() {
        return noCrawl;
    }

    public boolean isMultilingual() {
        return multilingual;
    }

    public boolean isEnableMinimalDownload() {
        return enableMinimalDownload;
    }

    public String getWelcomePage() {
        return welcomePage;
    }

    public String getMasterUrl() {
        return masterUrl;
    }

    public String getCustomMasterUrl() {
        return customMasterUrl;
    }

    public String getSiteLogoUrl() {
        return siteLogoUrl;
    }
}
