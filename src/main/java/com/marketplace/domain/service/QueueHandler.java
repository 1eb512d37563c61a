package com.marketplace.domain.service;

/**
 * Business logic run for one validated payload. Any exception counts as a failed attempt.
 */
@FunctionalInterface
public interface QueueHandler<T> {

    void handle(T payload) throws Exception;
}
