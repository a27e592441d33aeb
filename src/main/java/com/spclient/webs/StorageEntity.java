package com.spclient.webs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tenant property stored in the app catalog site.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageEntity {

    @JsonProperty("Value")
    private String value;

    @JsonProperty("Comment")
    private String comment;

    @JsonProperty("Description")
    private String description;

    public String getValue() {
        return value;
    }

    public String getComment() {
        return comment;
    }

    public String getDescription() {
        return description;
    }
}
