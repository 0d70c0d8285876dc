package io.coveytown.server.core.handlers;

/**
 * Uniform result of a request handler.
 *
 * @param isOK whether the request succeeded
 * @param message failure description for the client (null on success)
 * @param response payload (null on failure or for requests without a payload)
 */
public record ResponseEnvelope<T>(boolean isOK, String message, T response) {

    public static <T> ResponseEnvelope<T> ok(T response) {
        return new ResponseEnvelope<>(true, null, response);
    }

    public static <T> ResponseEnvelope<T> error(String message) {
        return new ResponseEnvelope<>(false, message, null);
    }
}
