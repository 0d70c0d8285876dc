package io.coveytown.server.spi;

/**
 * Thrown when a {@link VideoTokenProvider} cannot issue a token.
 * Wraps the provider's underlying transport or service failure.
 */
public class VideoProvisioningException extends Exception {

    public VideoProvisioningException(String message) {
        super(message);
    }

    public VideoProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }

    public VideoProvisioningException(Throwable cause) {
        super(cause);
    }
}
