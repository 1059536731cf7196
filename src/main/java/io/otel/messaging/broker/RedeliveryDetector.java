package io.otel.messaging.broker;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recognises messages that came back to their queue through a dead-letter path.
 *
 * RabbitMQ stamps {@code x-first-death-exchange} (and the {@code x-death} history) on a
 * message the first time it is dead-lettered. Brokers with a different convention need a
 * different marker header, hence the constructor argument.
 */
public class RedeliveryDetector {

    public static final String DEFAULT_MARKER_HEADER = "x-first-death-exchange";
    public static final String DEATH_HISTORY_HEADER = "x-death";

    private final String markerHeader;

    public RedeliveryDetector() {
        this(DEFAULT_MARKER_HEADER);
    }

    public RedeliveryDetector(String markerHeader) {
        this.markerHeader = Objects.requireNonNull(markerHeader, "markerHeader");
    }

    public boolean isRedelivery(Map<String, ?> headers) {
        return headers != null && headers.containsKey(markerHeader);
    }

    public String getMarkerHeader() {
        return markerHeader;
    }

    /**
     * Number of times the message was dead-lettered out of {@code queue}, according to the
     * broker's {@code x-death} history. A null queue sums every entry. 0 when absent or unreadable.
     */
    public static long deathCount(Map<String, ?> headers, String queue) {
        if (headers == null) {
            return 0;
        }
        Object history = headers.get(DEATH_HISTORY_HEADER);
        if (!(history instanceof List)) {
            return 0;
        }
        long total = 0;
        for (Object entry : (List<?>) history) {
            if (!(entry instanceof Map)) {
                continue;
            }
            Map<?, ?> death = (Map<?, ?>) entry;
            Object deathQueue = death.get("queue");
            if (queue != null && (deathQueue == null || !queue.equals(deathQueue.toString()))) {
                continue;
            }
            Object count = death.get("count");
            if (count instanceof Number) {
                total += ((Number) count).longValue();
            }
        }
        return total;
    }
}
