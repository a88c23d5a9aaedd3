package com.example.permchange.service;

/**
 * Handle returned when subscribing to change notifications. Closing it more than once is a no-op.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
