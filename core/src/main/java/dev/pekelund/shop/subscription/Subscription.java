package dev.pekelund.shop.subscription;

/**
 * Handle to a live collection subscription.
 */
public interface Subscription {

    /**
     * Stops further callbacks. Calling it more than once has no effect.
     */
    void unsubscribe();
}
