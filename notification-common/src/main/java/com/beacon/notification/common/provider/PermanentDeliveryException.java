package com.beacon.notification.common.provider;

/**
 * Delivery failure that will not succeed no matter how often it is attempted.
 */
public class PermanentDeliveryException extends RuntimeException {

    private final ProviderErrorCategory category;

    public PermanentDeliveryException(String message) {
        this(message, ProviderErrorCategory.PERMANENT);
    }

    public PermanentDeliveryException(String message, ProviderErrorCategory category) {
        super(message);
        this.category = category;
    }

    public ProviderErrorCategory getCategory() {
        return category;
    }
}
