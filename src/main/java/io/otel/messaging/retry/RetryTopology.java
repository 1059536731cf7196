package io.otel.messaging.retry;

/**
 * Names and limits of one queue's retry layout. Fixed once built by {@link RetryPolicy}.
 *
 * <pre>
 * primary --(reject)--&gt; deadLetterExchange --(primary key)--&gt; delayQueue
 * delayQueue --(ttl expires)--&gt; default exchange --&gt; primary
 * primary --(retries exhausted)--&gt; deadLetterExchange --(parked key)--&gt; parkingQueue
 * </pre>
 */
public final class RetryTopology {

    private final String primaryQueue;
    private final String delayQueue;
    private final String deadLetterExchange;
    private final String parkingQueue;
    private final long delayMs;
    private final int maxAttempts;

    RetryTopology(String primaryQueue, long delayMs, int maxAttempts) {
        this.primaryQueue = primaryQueue;
        this.delayQueue = primaryQueue + ".dlq";
        this.deadLetterExchange = primaryQueue + ".dlx";
        this.parkingQueue = primaryQueue + ".parked";
        this.delayMs = delayMs;
        this.maxAttempts = maxAttempts;
    }

    public String getPrimaryQueue() { return primaryQueue; }

    public String getDelayQueue() { return delayQueue; }

    public String getDeadLetterExchange() { return deadLetterExchange; }

    /**
     * Terminal queue for messages that used up their retries. Its routing key on the
     * dead-letter exchange is the queue name itself.
     */
    public String getParkingQueue() { return parkingQueue; }

    public long getDelayMs() { return delayMs; }

    public int getMaxAttempts() { return maxAttempts; }

    @Override
    public String toString() {
        return "RetryTopology{primary=" + primaryQueue + ", delay=" + delayQueue + ", dlx=" + deadLetterExchange
                + ", parked=" + parkingQueue + ", delayMs=" + delayMs + ", maxAttempts=" + maxAttempts + '}';
    }
}
