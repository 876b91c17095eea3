package com.adtech.common.retry;

import com.adtech.common.error.ConnectionException;
import com.adtech.common.error.DecodeException;
import com.adtech.common.error.TransformException;
import com.adtech.common.error.WriteException;
import io.github.resilience4j.core.IntervalFunction;
import org.junit.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * RetryPolicy 단위 테스트
 */
public class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.immediate(3);

    @Test
    public void testRetriesConnectionFailuresUntilSuccess() throws Exception {
        // Given: 두 번 실패 후 성공
        AtomicInteger calls = new AtomicInteger();

        // When
        String result = policy.execute("extract", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ConnectionException("reset");
            }
            return "ok";
        });

        // Then
        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    public void testGivesUpAfterMaxAttemptsWithLastFailure() {
        AtomicInteger calls = new AtomicInteger();
        try {
            policy.execute("extract", () -> {
                throw new ConnectionException("down #" + calls.incrementAndGet());
            });
            fail("Expected ConnectionException");
        } catch (Exception e) {
            assertEquals(ConnectionException.class, e.getClass());
            assertEquals("down #3", e.getMessage());
        }
        assertEquals(3, calls.get());
    }

    @Test
    public void testRejectedWriteIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        try {
            policy.execute("load", () -> {
                calls.incrementAndGet();
                throw new WriteException("Code: 53. Type mismatch");
            });
            fail("Expected WriteException");
        } catch (Exception e) {
            assertEquals(WriteException.class, e.getClass());
        }
        assertEquals(1, calls.get());
    }

    @Test
    public void testNonRetriableFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        try {
            policy.execute("transform", () -> {
                calls.incrementAndGet();
                throw new TransformException("bad row");
            });
            fail("Expected TransformException");
        } catch (Exception e) {
            assertEquals(TransformException.class, e.getClass());
        }
        assertEquals(1, calls.get());
    }

    @Test
    public void testRuntimeFailureIsPropagatedWithoutRetry() {
        AtomicInteger calls = new AtomicInteger();
        try {
            policy.execute("transform", () -> {
                calls.incrementAndGet();
                throw new IllegalArgumentException("boom");
            });
            fail("Expected IllegalArgumentException");
        } catch (Exception e) {
            assertEquals(IllegalArgumentException.class, e.getClass());
        }
        assertEquals(1, calls.get());
    }

    @Test
    public void testRetriablePredicateFollowsException() {
        assertTrue(RetryPolicy.RETRIABLE.test(new ConnectionException("reset")));
        assertFalse(RetryPolicy.RETRIABLE.test(new WriteException("rejected")));
        assertFalse(RetryPolicy.RETRIABLE.test(new DecodeException("bad json")));
        assertFalse(RetryPolicy.RETRIABLE.test(new IllegalStateException("bug")));
    }

    @Test
    public void testExponentialBackoffDoublesUpToCap() {
        // Given
        IntervalFunction interval = RetryPolicy.exponentialInterval(100L);

        // Then
        assertEquals(Long.valueOf(100L), interval.apply(1));
        assertEquals(Long.valueOf(200L), interval.apply(2));
        assertEquals(Long.valueOf(400L), interval.apply(3));
        assertEquals(Long.valueOf(RetryPolicy.MAX_BACKOFF_MS), interval.apply(20));
    }

    @Test
    public void testZeroBackoffMeansNoWait() {
        assertEquals(Long.valueOf(0L), RetryPolicy.exponentialInterval(0L).apply(2));
    }

    @Test
    public void testMaxAttemptsExposed() {
        assertEquals(5, RetryPolicy.exponential(5, 100L).getMaxAttempts());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAtLeastOneAttempt() {
        RetryPolicy.exponential(0, 100L);
    }
}
