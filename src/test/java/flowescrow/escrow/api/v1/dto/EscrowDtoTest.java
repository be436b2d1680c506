package flowescrow.escrow.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import flowescrow.escrow.model.EscrowEvent;
import flowescrow.escrow.model.EscrowEventType;
import flowescrow.escrow.model.FeePolicy;
import flowescrow.escrow.model.Role;
import flowescrow.escrow.model.Task;
import flowescrow.escrow.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EscrowDtoTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    @Test
    void fundRequestRequiresAmount() throws Exception {
        FundRequest ok = mapper.readValue("{\"amount\": 100000}", FundRequest.class);
        assertEquals(100_000L, ok.amount());
        ok.validate();

        FundRequest missing = mapper.readValue("{}", FundRequest.class);
        assertThrows(IllegalArgumentException.class, missing::validate);
    }

    @Test
    void approveRequestFromJson() throws Exception {
        ApproveSubtaskRequest req = mapper.readValue("""
                { "worker": "bob", "amount": 20000 }
                """, ApproveSubtaskRequest.class);

        assertEquals("bob", req.worker());
        assertEquals(20_000L, req.amount());
        assertThrows(IllegalArgumentException.class, () -> new ApproveSubtaskRequest("bob", null).validate());
    }

    @Test
    void roleRequestParsesRoleCaseInsensitively() {
        assertEquals(Role.ADMIN, new RoleRequest("admin", "bob").parsedRole());
        assertEquals(Role.DEFAULT_ADMIN, new RoleRequest(" DEFAULT_ADMIN ", "bob").parsedRole());
        assertThrows(IllegalArgumentException.class, () -> new RoleRequest("root", "bob").parsedRole());
        assertThrows(IllegalArgumentException.class, () -> new RoleRequest(null, "bob").parsedRole());
    }

    @Test
    void taskResponseSerialization() throws Exception {
        Task task = Task.builder()
                .id(1)
                .client("alice")
                .totalAmount(100_000)
                .releasedAmount(20_000)
                .status(TaskStatus.IN_PROGRESS)
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(TaskResponse.from(task)));

        assertEquals(1, json.get("taskId").asLong());
        assertEquals("alice", json.get("client").asText());
        assertEquals(80_000, json.get("remainingAmount").asLong());
        assertEquals("IN_PROGRESS", json.get("status").asText());
        assertEquals("2024-05-01T10:00:00Z", json.get("createdAt").asText());
        assertFalse(json.has("updatedAt"));
    }

    @Test
    void feeResponseIncludesCeiling() {
        FeeResponse response = FeeResponse.from(new FeePolicy(500, "treasury"));
        assertEquals(500, response.feeBps());
        assertEquals("treasury", response.feeRecipient());
        assertEquals(FeePolicy.MAX_FEE_BPS, response.maxFeeBps());
    }

    @Test
    void configEventOmitsTaskId() throws Exception {
        EscrowEvent event = EscrowEvent.pending(EscrowEventType.FEE_UPDATED, 0, "admin",
                Map.of("newFeeBps", 700)).withSequence(12);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(EventResponse.from(event)));

        assertEquals(12, json.get("sequence").asLong());
        assertEquals("FEE_UPDATED", json.get("type").asText());
        assertFalse(json.has("taskId"));
        assertEquals(700, json.get("details").get("newFeeBps").asInt());
    }

    @Test
    void mintRequestValidation() {
        new MintRequest("alice", 1L).validate();
        assertThrows(IllegalArgumentException.class, () -> new MintRequest("alice", 0L).validate());
        assertThrows(IllegalArgumentException.class, () -> new MintRequest(" ", 5L).validate());
    }

    @Test
    void unhealthyResponseOmitsStats() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(HealthResponse.unhealthy("connection failed")));
        assertEquals("unhealthy", json.get("status").asText());
        assertFalse(json.has("taskCount"));
    }
}
