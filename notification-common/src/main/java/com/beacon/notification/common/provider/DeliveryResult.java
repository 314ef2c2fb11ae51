package com.beacon.notification.common.provider;

/**
 * Outcome of a single provider send call.
 * 
 * <pre>
 * DeliveryResult result = emailProvider.send(message);
 * if (!result.success()) {
 *     throw result.toException();
 * }
 * </pre>
 */
public record DeliveryResult(
    boolean success,
    String providerMessageId,
    String errorMessage,
    ProviderErrorCategory errorCategory
) {

    public DeliveryResult {
        if (!success && errorCategory == null) {
            errorCategory = ProviderErrorCategory.TEMPORARY;
        }
    }

    public static DeliveryResult createSuccess(String providerMessageId) {
        return new DeliveryResult(true, providerMessageId, null, null);
    }

    public static DeliveryResult createFailure(String errorMessage, ProviderErrorCategory errorCategory) {
        return new DeliveryResult(false, null, errorMessage, errorCategory);
    }

    /**
     * Converts a failed result into the exception kind the retry machinery understands.
     * Retryable categories become {@link TransientDeliveryException}, all others
     * {@link PermanentDeliveryException}.
     */
    public RuntimeException toException() {
        if (success) {
            throw new IllegalStateException("Result is successful");
        }
        String message = errorMessage != null ? errorMessage : "Provider reported failure";
        if (errorCategory.isRetryable()) {
            return new TransientDeliveryException(message, errorCategory == ProviderErrorCategory.RATE_LIMITED);
        }
        return new PermanentDeliveryException(message, errorCategory);
    }
}
