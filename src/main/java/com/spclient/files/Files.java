package com.spclient.files;

import com.spclient.odata.ODataUrls;
import com.spclient.odata.SharePointQueryable;
import com.spclient.odata.SharePointQueryableCollection;

import java.util.concurrent.CompletableFuture;

/**
 * The files of a folder.
 */
public class Files extends SharePointQueryableCollection {

    public static final String DEFAULT_PATH = "files";

    public Files(SharePointQueryable parent) {
        this(parent, DEFAULT_PATH);
    }

    public Files(SharePointQueryable parent, String path) {
        super(parent, path);
    }

    /**
     * POST {@code files/addTemplateFile(urloffile='<url>',templatefiletype=<n>)}
     *
     * @param fileUrl server relative url of the file to create
     * @param templateFileType the page template to create it from
     */
    public CompletableFuture<FileAddResult> addTemplateFileAsync(String fileUrl, TemplateFileType templateFileType) {
        String call = "addTemplateFile(urloffile=" + ODataUrls.quote(fileUrl) + ",templatefiletype=" + templateFileType.getValue() + ")";
        return child(Files::new, call).postCoreAsync()
                .thenApply(data -> new FileAddResult(data, new File(getClient(), ODataUrls.odataUrlFrom(data))));
    }
}
