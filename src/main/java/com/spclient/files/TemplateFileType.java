package com.spclient.files;

/**
 * Page templates understood by {@code files/addTemplateFile}.
 */
public enum TemplateFileType {
    STANDARD_PAGE(0),
    WIKI_PAGE(1),
    FORM_PAGE(2),
    CLIENT_SIDE_PAGE(3);

    private final int value;

    TemplateFileType(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }
}
