package com.spclient;

/**
 * Thrown (as the cause of a failed future) when SharePoint answers with a status of 400 or above.
 */
public class SharePointRequestException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;

    public SharePointRequestException(String method, String url, int statusCode, String responseBody) {
        super("HTTP Request Failed with status code: " + statusCode + " (" + method + " " + url + ")");
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
