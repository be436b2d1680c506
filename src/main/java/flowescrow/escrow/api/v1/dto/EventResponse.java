package flowescrow.escrow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import flowescrow.escrow.model.EscrowEvent;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for one audit event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventResponse(
        @JsonProperty("sequence") long sequence,
        @JsonProperty("type") String type,
        @JsonProperty("taskId") Long taskId,
        @JsonProperty("actor") String actor,
        @JsonProperty("details") Map<String, Object> details,
        @JsonProperty("createdAt") Instant createdAt) {

    public static EventResponse from(EscrowEvent event) {
        return new EventResponse(
                event.sequence(),
                event.type().name(),
                event.taskId() > 0 ? event.taskId() : null,
                event.actor(),
                event.details(),
                event.createdAt());
    }
}
