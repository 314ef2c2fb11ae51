package com.beacon.notification.common.messaging;

import lombok.extern.slf4j.Slf4j;

@Slf4j
final class FailureMarkers {

    private FailureMarkers() {
    }

    static <T> void markQuietly(FailureMarker<T> marker, T message, Throwable cause) {
        if (marker == null || message == null) {
            return;
        }
        try {
            marker.markFailed(message, cause);
        } catch (Exception e) {
            log.error("Failed to mark {} as failed, continuing with failure handling", message, e);
        }
    }
}
