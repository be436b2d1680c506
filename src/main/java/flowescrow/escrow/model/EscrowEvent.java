package flowescrow.escrow.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One committed entry of the audit event stream.
 *
 * @param sequence position in the stream, starting at 1; 0 before the event is appended
 * @param taskId   affected task, 0 for configuration events
 * @param actor    caller that triggered the operation
 * @param details  amounts and parties, in insertion order
 */
public record EscrowEvent(
        long sequence,
        EscrowEventType type,
        long taskId,
        String actor,
        Map<String, Object> details,
        Instant createdAt) {

    public EscrowEvent {
        Objects.requireNonNull(type, "type is required");
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /** Event not yet appended to the stream */
    public static EscrowEvent pending(EscrowEventType type, long taskId, String actor, Map<String, Object> details) {
        return new EscrowEvent(0, type, taskId, actor, details, Instant.now());
    }

    public EscrowEvent withSequence(long sequence) {
        return new EscrowEvent(sequence, type, taskId, actor, details, createdAt);
    }

    /** Numeric detail, e.g. an amount */
    public long longDetail(String key) {
        Object value = details.get(key);
        if (!(value instanceof Number n)) {
            throw new IllegalArgumentException("no numeric detail '" + key + "' in " + type);
        }
        return n.longValue();
    }
}
