package com.spclient.webs;

import com.spclient.users.SiteUser;
import com.spclient.users.SiteUserProps;

/**
 * Result from ensuring a user.
 */
public final class WebEnsureUserResult {

    private final SiteUserProps data;
    private final SiteUser user;

    public WebEnsureUserResult(SiteUserProps data, SiteUser user) {
        this.data = data;
        this.user = user;
    }

    public SiteUserProps getData() {
        return data;
    }

    public SiteUser getUser() {
        return user;
    }
}
