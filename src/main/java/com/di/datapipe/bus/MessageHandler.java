package com.di.datapipe.bus;

/**
 * Push delivery contract: returning normally acknowledges the delivery; throwing fails it and the
 * bus redelivers after backoff. Handlers must tolerate duplicate and concurrent deliveries.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(PushMessage message);
}
