package dev.pekelund.shop.collection;

/**
 * Raised when an operation would break the default-item rules of a collection. Nothing has been written.
 */
public class InvariantViolationException extends CollectionException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
