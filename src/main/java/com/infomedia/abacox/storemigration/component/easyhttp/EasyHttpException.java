package com.infomedia.abacox.storemigration.component.easyhttp;

/**
 * Custom exception for handling HTTP and network-related errors from EasyHttp.
 */
public class EasyHttpException extends RuntimeException {
    public static final int TOO_MANY_REQUESTS = 429;

    private final int statusCode;
    private final String responseBody;
    private final Integer retryAfterSeconds;

    /**
     * Constructor for HTTP errors (e.g., 404, 429, 500) that include a response body.
     * @param message The error message from the response.
     * @param statusCode The HTTP status code.
     * @param responseBody The body of the error response.
     * @param retryAfterSeconds The parsed Retry-After header, or null when the server sent none.
     */
    public EasyHttpException(String message, int statusCode, String responseBody, Integer retryAfterSeconds) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public EasyHttpException(String message, int statusCode, String responseBody) {
        this(message, statusCode, responseBody, null);
    }

    /**
     * Constructor for network or parsing errors.
     * @param message A descriptive message of the failure.
     * @param cause The underlying exception.
     */
    public EasyHttpException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1; // Indicates a non-HTTP error
        this.responseBody = null;
        this.retryAfterSeconds = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public Integer getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public boolean isRateLimited() {
        return statusCode == TOO_MANY_REQUESTS;
    }

    @Override
    public String getMessage() {
        if (statusCode > 0) {
            return String.format("HTTP Error: %d %s\nResponse: %s", statusCode, super.getMessage(), responseBody);
        }
        return super.getMessage();
    }
}
