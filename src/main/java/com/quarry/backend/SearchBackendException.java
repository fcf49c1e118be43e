package com.quarry.backend;

import lombok.Getter;

/**
 * Transport or HTTP failure reported by a {@link SearchBackend}.
 * Carries whatever structured error the backend returned in its body.
 */
@Getter
public class SearchBackendException extends RuntimeException {

    private final int status;
    private final String statusText;
    private final Integer code;
    private final String backendMessage;
    private final String detail;

    public SearchBackendException(int status, String statusText, Integer code,
                                  String backendMessage, String detail, Throwable cause) {
        super(buildMessage(status, statusText, backendMessage), cause);
        this.status = status;
        this.statusText = statusText;
        this.code = code;
        this.backendMessage = backendMessage;
        this.detail = detail;
    }

    public static SearchBackendException transport(Throwable cause) {
        return new SearchBackendException(0, cause.getMessage(), null, null, null, cause);
    }

    /**
     * Whether the backend sent a structured error body.
     */
    public boolean hasBody() {
        return code != null || backendMessage != null || detail != null;
    }

    private static String buildMessage(int status, String statusText, String backendMessage) {
        String text = backendMessage != null ? backendMessage : statusText;
        return status > 0 ? "Search backend returned " + status + ": " + text : "Search backend unreachable: " + text;
    }
}
