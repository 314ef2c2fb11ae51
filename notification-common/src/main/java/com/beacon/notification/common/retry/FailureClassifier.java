package com.beacon.notification.common.retry;

import com.beacon.notification.common.provider.PermanentDeliveryException;
import com.beacon.notification.common.provider.TransientDeliveryException;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.dao.TransientDataAccessException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies failures raised while processing a message.
 * 
 * Classification rules:
 * - RATE_LIMIT: {@link TransientDeliveryException} flagged as rate limited
 * - TRANSIENT: timeouts, cancellation/interruption, I/O and network errors,
 *   transient data access and broker connection failures, {@link TransientDeliveryException}
 * - PERMANENT: everything else, including {@link PermanentDeliveryException}
 * 
 * The cause chain is walked so wrapped failures (e.g. an I/O error inside a
 * runtime exception) keep their classification.
 */
public final class FailureClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    private FailureClassifier() {
    }

    public static FailureClassification classify(Throwable failure) {
        Throwable current = failure;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof PermanentDeliveryException) {
                return FailureClassification.PERMANENT;
            }
            if (current instanceof TransientDeliveryException transientFailure) {
                return transientFailure.isRateLimited()
                        ? FailureClassification.RATE_LIMIT
                        : FailureClassification.TRANSIENT;
            }
            if (isTransientKind(current)) {
                return FailureClassification.TRANSIENT;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return FailureClassification.PERMANENT;
    }

    public static boolean isTransient(Throwable failure) {
        return failure != null && classify(failure).isRetryable();
    }

    private static boolean isTransientKind(Throwable t) {
        return t instanceof TimeoutException
                || t instanceof CancellationException
                || t instanceof InterruptedException
                || t instanceof IOException
                || t instanceof UncheckedIOException
                || t instanceof TransientDataAccessException
                || t instanceof AmqpConnectException;
    }
}
