package org.telemetrystore.api;

/**
 * Status code plus JSON body, ready for any transport to write out.
 */
public record ApiResponse(int status, String json) {

    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int GONE = 410;
    public static final int INTERNAL_SERVER_ERROR = 500;

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /** Maps the status codes used here to their standard reason phrases. */
    public String reason() {
        return switch (status) {
            case OK -> "OK";
            case BAD_REQUEST -> "Bad Request";
            case NOT_FOUND -> "Not Found";
            case GONE -> "Gone";
            case INTERNAL_SERVER_ERROR -> "Internal Server Error";
            default -> "Unknown";
        };
    }
}
