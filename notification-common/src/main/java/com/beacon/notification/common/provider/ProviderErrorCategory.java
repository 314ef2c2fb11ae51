package com.beacon.notification.common.provider;

/**
 * Provider error category used to pick the failure kind raised by a channel handler.
 * 
 * - TEMPORARY: timeouts, 5xx, connection resets; retried with backoff
 * - RATE_LIMITED: provider throttling; retried with backoff
 * - PERMANENT: invalid request or recipient; not retried
 * - AUTH: invalid or revoked credentials; not retried
 * - CONFIG: missing or invalid provider settings; not retried
 */
public enum ProviderErrorCategory {
    TEMPORARY,
    RATE_LIMITED,
    PERMANENT,
    AUTH,
    CONFIG;

    public boolean isRetryable() {
        return this == TEMPORARY || this == RATE_LIMITED;
    }
}
