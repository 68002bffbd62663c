package gr.imsi.athenarc.tsdb.util;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Caller-side retry with exponential backoff. Only exceptions of the given
 * classes are retried; anything else is rethrown at once.
 */
public final class RetryableOperation {

    private static final Logger LOG = LoggerFactory.getLogger(RetryableOperation.class);

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_DELAY_MILLIS = 100;
    public static final double DEFAULT_BACKOFF_FACTOR = 2.0;

    private RetryableOperation() {
    }

    @SafeVarargs
    public static <T> T execute(Callable<T> operation, Class<? extends Exception>... retryable) throws Exception {
        return execute(operation, DEFAULT_MAX_RETRIES, DEFAULT_DELAY_MILLIS, DEFAULT_BACKOFF_FACTOR, retryable);
    }

    /**
     * @param maxRetries attempts after the first one
     * @return the first successful result
     * @throws Exception the first non-retryable failure, or the last failure once retries run out
     */
    @SafeVarargs
    public static <T> T execute(Callable<T> operation, int maxRetries, long delayMillis, double backoffFactor,
                                Class<? extends Exception>... retryable) throws Exception {
        Preconditions.checkNotNull(operation, "operation");
        Preconditions.checkArgument(maxRetries >= 0, "maxRetries must not be negative");
        Preconditions.checkArgument(delayMillis >= 0, "delayMillis must not be negative");
        Preconditions.checkArgument(backoffFactor >= 1.0, "backoffFactor must be at least 1");
        List<Class<? extends Exception>> retryOn = Arrays.asList(retryable);
        long delay = delayMillis;
        int attempt = 0;
        while (true) {
            try {
                return operation.call();
            } catch (Exception e) {
                if (!isRetryable(e, retryOn) || attempt >= maxRetries) {
                    throw e;
                }
                attempt++;
                LOG.warn("Attempt {} of {} failed, retrying in {} ms: {}", attempt, maxRetries + 1, delay, e.getMessage());
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(interrupted);
                    throw e;
                }
                delay = (long) (delay * backoffFactor);
            }
        }
    }

    private static boolean isRetryable(Exception e, List<Class<? extends Exception>> retryOn) {
        for (Class<? extends Exception> type : retryOn) {
            if (type.isInstance(e)) {
                return true;
            }
        }
        return false;
    }
}
