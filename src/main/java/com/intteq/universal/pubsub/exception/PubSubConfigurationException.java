package com.intteq.universal.pubsub.exception;

/**
 * Raised when a topic or subscription is declared with an invalid configuration,
 * or when a subscription cannot be matched against the deployed configuration.
 *
 * <p>These errors are raised during bootstrap, before any message is delivered.
 * Inside a Spring context they abort the application startup.
 */
public class PubSubConfigurationException extends PubSubException {

    public PubSubConfigurationException(String message) {
        super(message);
    }

    public PubSubConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
