package dev.pekelund.shop.auth;

/**
 * Supplies the id of the signed-in owner. Every collection operation is scoped to this id.
 */
@FunctionalInterface
public interface AuthenticationContextResolver {

    /**
     * @return the current owner id, never blank
     * @throws NotAuthenticatedException when nobody is signed in
     */
    String requireOwnerId();
}
