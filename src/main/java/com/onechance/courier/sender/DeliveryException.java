package com.onechance.courier.sender;

/**
 * Single delivery attempt failure.
 * <p>The message is recorded as the queued message's last error.
 */
public class DeliveryException extends Exception {

    /**
     * Constructs a new DeliveryException instance with given message.
     *
     * @param message Human readable reason.
     */
    public DeliveryException(String message) {
        super(message);
    }

    /**
     * Constructs a new DeliveryException instance with given message and cause.
     *
     * @param message Human readable reason.
     * @param cause   Throwable.
     */
    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
