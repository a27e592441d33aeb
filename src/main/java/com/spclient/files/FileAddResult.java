package com.spclient.files;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result from adding a file: the server payload and a reference to the new file.
 */
public final class FileAddResult {

    private final JsonNode data;
    private final File file;

    public FileAddResult(JsonNode data, File file) {
        this.data = data;
        this.file = file;
    }

    public JsonNode getData() {
        return data;
    }

    public File getFile() {
        return file;
    }
}
