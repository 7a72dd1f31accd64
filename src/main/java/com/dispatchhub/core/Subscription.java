package com.dispatchhub.core;

/**
 * Handle returned by listener registration. Calling {@link #unsubscribe()} more than once is harmless.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
