package com.beacon.notification.common.provider;

/**
 * Delivery failure that is likely to succeed on a later attempt.
 */
public class TransientDeliveryException extends RuntimeException {

    private final boolean rateLimited;

    public TransientDeliveryException(String message) {
        this(message, false);
    }

    public TransientDeliveryException(String message, boolean rateLimited) {
        super(message);
        this.rateLimited = rateLimited;
    }

    public TransientDeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.rateLimited = false;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }
}
