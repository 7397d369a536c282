package com.configmirror.sdk;

/**
 * The result of a byte-range request for ID list content.
 */
final class RangeResponse {
    private final String content;
    private final long contentLength;

    /**
     * @param content the response body
     * @param contentLength the length declared by the server, or -1 if it did not declare one
     */
    RangeResponse(String content, long contentLength) {
        this.content = content == null ? "" : content;
        this.contentLength = contentLength;
    }

    String getContent() {
        return content;
    }

    long getContentLength() {
        return contentLength;
    }
}
