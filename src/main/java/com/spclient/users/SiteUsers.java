package com.spclient.users;

import com.spclient.odata.ODataUrls;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;

public class SiteUsers extends SharePointQueryableCollection {

    public static final String DEFAULT_PATH = "siteusers";

    public SiteUsers(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public SiteUsers(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    public SiteUser getById(int id) {
        return new SiteUser(this, "getById(" + id + ")");
    }

    public SiteUser getByEmail(String email) {
        return new SiteUser(this, "getByEmail(" + ODataUrls.quote(email) + ")");
    }

    public SiteUser getByLoginName(String loginName) {
        return (SiteUser) new SiteUser(this, null).concat("(@v)").withQuery("@v", ODataUrls.quote(loginName));
    }
}
