package dev.pekelund.shop.security;

/**
 * Principal of a request authenticated with a Firebase ID token.
 */
public record FirebasePrincipal(String uid, String email) {
}
