package com.spclient.users;

import com.spclient.odata.ODataUrls;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;

public class SiteGroups extends SharePointQueryableCollection {

    public static final String DEFAULT_PATH = "sitegroups";

    public SiteGroups(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public SiteGroups(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    public SiteGroup getById(int id) {
        return (SiteGroup) new SiteGroup(this, null).concat("(" + id + ")");
    }

    public SiteGroup getByName(String groupName) {
        return new SiteGroup(this, "getByName(" + ODataUrls.quote(groupName) + ")");
    }
}
