package com.beacon.notification.common.retry;

import com.beacon.notification.common.provider.PermanentDeliveryException;
import com.beacon.notification.common.provider.TransientDeliveryException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

    @Test
    void testClassify_NetworkAndCancellationFailures_AreTransient() {
        assertEquals(FailureClassification.TRANSIENT, FailureClassifier.classify(new ConnectException("refused")));
        assertEquals(FailureClassification.TRANSIENT, FailureClassifier.classify(new CancellationException()));
        assertEquals(FailureClassification.TRANSIENT, FailureClassifier.classify(new InterruptedException()));
        assertEquals(FailureClassification.TRANSIENT, FailureClassifier.classify(new QueryTimeoutException("db")));
    }

    @Test
    void testClassify_WrappedIoFailure_FollowsCauseChain() {
        RuntimeException wrapped = new RuntimeException("send failed",
            new UncheckedIOException(new IOException("broken pipe")));

        assertEquals(FailureClassification.TRANSIENT, FailureClassifier.classify(wrapped));
    }

    @Test
    void testClassify_RateLimitedDelivery_IsRateLimit() {
        assertEquals(FailureClassification.RATE_LIMIT,
            FailureClassifier.classify(new TransientDeliveryException("429", true)));
        assertTrue(FailureClassifier.isTransient(new TransientDeliveryException("429", true)));
    }

    @Test
    void testClassify_PermanentDeliveryWrappingIo_IsPermanent() {
        PermanentDeliveryException failure = new PermanentDeliveryException("invalid address");
        failure.initCause(new IOException("ignored"));

        assertEquals(FailureClassification.PERMANENT, FailureClassifier.classify(failure));
    }

    @Test
    void testClassify_OtherFailures_ArePermanent() {
        assertEquals(FailureClassification.PERMANENT, FailureClassifier.classify(new IllegalStateException()));
        assertEquals(FailureClassification.PERMANENT, FailureClassifier.classify(new NullPointerException()));
        assertFalse(FailureClassifier.isTransient(null));
    }
}
