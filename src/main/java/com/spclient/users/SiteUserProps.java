package com.spclient.users;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Properties of a site user as returned by {@code ensureuser} and {@code siteusers}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SiteUserProps {

    @JsonProperty("Email")
    private String email;

    @JsonProperty("Id")
    private int id;

    @JsonProperty("IsHiddenInUI")
    private boolean hiddenInUi;

    @JsonProperty("IsShareByEmailGuestUser")
    private boolean shareByEmailGuestUser;

    @JsonProperty("IsSiteAdmin")
    private boolean siteAdmin;

    @JsonProperty("LoginName")
    private String loginName;

    @JsonProperty("PrincipalType")
    private int principalType;

    @JsonProperty("Title")
    private String title;

    public String getEmail() {
        return email;
    }

    public int getId() {
        return id;
    }

    public boolean isHiddenInUi() {
        return hiddenInUi;
    }

    public boolean isShareByEmailGuestUser() {
        return shareByEmailGuestUser;
    }

    public boolean isSiteAdmin() {
        return siteAdmin;
    }

    public String getLoginName() {
        return loginName;
    }

    public int getPrincipalType() {
        return principalType;
    }

    public String getTitle() {
        return title;
    }
}
