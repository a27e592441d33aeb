package com.spclient.odata;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * URL helpers shared by the resource references.
 */
public final class ODataUrls {

    private static final Logger log = LoggerFactory.getLogger(ODataUrls.class);

    private ODataUrls() {
    }

    /**
     * Joins path parts with single slashes. Empty parts are skipped and one leading and one
     * trailing slash (or backslash) is trimmed from every part.
     */
    public static String combine(String... paths) {
        return Arrays.stream(paths)
                .filter(p -> p != null && !p.isEmpty())
                .map(p -> p.replaceFirst("^[\\\\/]", "").replaceFirst("[\\\\/]$", ""))
                .collect(Collectors.joining("/"))
                .replace('\\', '/');
    }

    public static boolean isUrlAbsolute(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://") || lower.startsWith("//");
    }

    /**
     * Returns everything before the {@code _api/} segment of {@code url}, or the url itself
     * when there is none.
     */
    public static String extractWebUrl(String url) {
        if (url == null) {
            return "";
        }
        int index = url.indexOf("_api/");
        return index > -1 ? url.substring(0, index) : url;
    }

    /**
     * Quotes a value for use as an OData function argument: {@code O'Neil} becomes {@code 'O''Neil'}.
     */
    public static String quote(String value) {
        return "'" + (value == null ? "" : value.replace("'", "''")) + "'";
    }

    /**
     * Works out the URL of the entity a response describes, for both minimal and verbose metadata.
     * Returns an empty string when the payload carries no URI information.
     */
    public static String odataUrlFrom(JsonNode entity) {
        if (entity != null && entity.isObject()) {
            if (isWeb(entity)) {
                // webs carry an absolute url in their id
                if (entity.hasNonNull("odata.id")) {
                    return entity.get("odata.id").asText();
                }
                if (entity.path("__metadata").hasNonNull("uri")) {
                    return entity.get("__metadata").get("uri").asText();
                }
            } else if (entity.hasNonNull("odata.metadata") && entity.hasNonNull("odata.editLink")) {
                return combine(extractWebUrl(entity.get("odata.metadata").asText()), "_api", entity.get("odata.editLink").asText());
            } else if (entity.hasNonNull("odata.editLink")) {
                return combine("_api", entity.get("odata.editLink").asText());
            } else if (entity.path("__metadata").hasNonNull("uri")) {
                return entity.get("__metadata").get("uri").asText();
            }
        }
        log.warn("No uri information found in OData entity, chaining will fail for this object.");
        return "";
    }

    private static boolean isWeb(JsonNode entity) {
        return "SP.Web".equals(entity.path("odata.type").asText(null))
                || "SP.Web".equals(entity.path("__metadata").path("type").asText(null));
    }
}
