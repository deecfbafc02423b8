package dev.pekelund.shop.auth;

public class NotAuthenticatedException extends RuntimeException {

    public NotAuthenticatedException() {
        super("No authenticated user");
    }

    public NotAuthenticatedException(String message) {
        super(message);
    }
}
