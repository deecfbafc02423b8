package dev.pekelund.shop.collection;

/**
 * Base type for failures of collection operations that a caller can present to the user.
 */
public abstract class CollectionException extends RuntimeException {

    protected CollectionException(String message) {
        super(message);
    }

    protected CollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
