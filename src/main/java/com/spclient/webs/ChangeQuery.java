package com.spclient.webs;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Filter for the change log of a web, posted as {@code SP.ChangeQuery}. Only options that were
 * set explicitly are sent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChangeQuery {

    /** Boolean switches of {@code SP.ChangeQuery}, by their server-side property name. */
    public enum Option {
        ACTIVITY("Activity"),
        ADD("Add"),
        ALERT("Alert"),
        CONTENT_TYPE("ContentType"),
        DELETE_OBJECT("DeleteObject"),
        FIELD("Field"),
        FILE("File"),
        FOLDER("Folder"),
        GROUP("Group"),
        GROUP_MEMBERSHIP_ADD("GroupMembershipAdd"),
        GROUP_MEMBERSHIP_DELETE("GroupMembershipDelete"),
        ITEM("Item"),
        LATEST_FIRST("LatestFirst"),
        LIST("List"),
        MOVE("Move"),
        NAVIGATION("Navigation"),
        RECURSIVE_ALL("RecursiveAll"),
        RENAME("Rename"),
        REQUIRE_SECURITY_TRIM("RequireSecurityTrim"),
        RESTORE("Restore"),
        ROLE_ASSIGNMENT_ADD("RoleAssignmentAdd"),
        ROLE_ASSIGNMENT_DELETE("RoleAssignmentDelete"),
        ROLE_DEFINITION_ADD("RoleDefinitionAdd"),
        ROLE_DEFINITION_DELETE("RoleDefinitionDelete"),
        ROLE_DEFINITION_UPDATE("RoleDefinitionUpdate"),
        SECURITY_POLICY("SecurityPolicy"),
        SITE("Site"),
        SYSTEM_UPDATE("SystemUpdate"),
        UPDATE("Update"),
        USER("User"),
        VIEW("View"),
        WEB("Web");

        private final String propertyName;

        Option(String propertyName) {
            this.propertyName = propertyName;
        }

        public String getPropertyName() {
            return propertyName;
        }
    }

    private final Map<Option, Boolean> options = new EnumMap<>(Option.class);

    @JsonProperty("ChangeTokenStart")
    private ChangeToken changeTokenStart;

    @JsonProperty("ChangeTokenEnd")
    private ChangeToken changeTokenEnd;

    public ChangeQuery set(Option option, boolean value) {
        options.put(option, value);
        return this;
    }

    /** Sets every given option to {@code true}. */
    public ChangeQuery include(Option... include) {
        for (Option option : include) {
            options.put(option, Boolean.TRUE);
        }
        return this;
    }

    public ChangeQuery changeTokenStart(String stringValue) {
        this.changeTokenStart = new ChangeToken(stringValue);
        return this;
    }

    public ChangeQuery changeTokenEnd(String stringValue) {
        this.changeTokenEnd = new ChangeToken(stringValue);
        return this;
    }

    public ChangeToken getChangeTokenStart() {
        return changeTokenStart;
    }

    public ChangeToken getChangeTokenEnd() {
        return changeTokenEnd;
    }

    @JsonAnyGetter
    public Map<String, Boolean> getOptions() {
        Map<String, Boolean> byName = new LinkedHashMap<>();
        options.forEach((option, value) -> byName.put(option.getPropertyName(), value));
        return Collections.unmodifiableMap(byName);
    }

    /** {@code SP.ChangeToken}, identified by its string value. */
    public static class ChangeToken {

        @JsonProperty("StringValue")
        private final String stringValue;

        public ChangeToken(String stringValue) {
            this.stringValue = stringValue;
        }

        public String getStringValue() {
            return stringValue;
        }
    }
}
