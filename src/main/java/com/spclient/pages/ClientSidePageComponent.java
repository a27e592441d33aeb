package com.spclient.pages;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A client side web part or extension available to a web.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientSidePageComponent {

    @JsonProperty("ComponentType")
    private int componentType;

    @JsonProperty("Id")
    private String id;

    /** JSON text of the component manifest. */
    @JsonProperty("Manifest")
    private String manifest;

    @JsonProperty("ManifestType")
    private int manifestType;

    @JsonProperty("Name")
    private String name;

    @JsonProperty("Status")
    private int status;

    public int getComponentType() {
        return componentType;
    }

    public String getId() {
        return id;
    }

    public String getManifest() {
        return manifest;
    }

    public int getManifestType() {
        return manifestType;
    }

    public String getName() {
        return name;
    }

    public int getStatus() {
        return status;
    }
}
