package io.coveytown.core;

/**
 * Base class for Covey Town programming errors.
 *
 * <p>Expected failures (bad input, unknown tokens) are reported through return values; these
 * exceptions signal a caller breaking a contract, such as acting on a player the town never
 * admitted.
 */
public abstract class CoveyTownException extends RuntimeException {

    protected CoveyTownException(String message) {
        super(message);
    }

    protected CoveyTownException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when an operation names a player that is not part of the town's roster.
     */
    public static class UnknownPlayer extends CoveyTownException {
        public UnknownPlayer(String playerId) {
            super("player " + playerId + " is not in this town");
        }
    }

    /**
     * Raised when a registry is asked to hold two towns under the same id.
     */
    public static class DuplicateTown extends CoveyTownException {
        public DuplicateTown(String townId) {
            super("a town with id " + townId + " already exists");
        }
    }
}
