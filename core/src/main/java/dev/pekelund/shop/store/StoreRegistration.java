package dev.pekelund.shop.store;

/**
 * Handle returned by {@link DocumentStore#subscribe}. Removing it more than once is harmless.
 */
@FunctionalInterface
public interface StoreRegistration {

    void remove();
}
