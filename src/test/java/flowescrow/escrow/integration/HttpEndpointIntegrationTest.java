package flowescrow.escrow.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import flowescrow.escrow.config.Dependencies;
import flowescrow.escrow.config.EscrowConfig;
import flowescrow.escrow.model.EscrowEvent;
import flowescrow.escrow.model.EscrowEventType;
import flowescrow.escrow.server.EscrowNettyServer;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints.
 * Runs the full path through Netty, controllers, service and database.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();
        private static final int TEST_PORT = 18480;
        private static final String BASE_URL = "http://localhost:" + TEST_PORT;

        private Dependencies deps;
        private EscrowNettyServer server;
        private HttpClient httpClient;

        @BeforeEach
        void setUp() throws Exception {
                EscrowConfig config = EscrowConfig.defaults()
                                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                                .withDeployer("admin")
                                .withInitialFeeBps(1000)
                                .withInitialFeeRecipient("treasury");

                deps = Dependencies.create(config);
                deps.tokenLedger().mint("client", 1_000_000);

                server = new EscrowNettyServer(deps);
                assertTrue(server.start("127.0.0.1", TEST_PORT));

                // Wait for server to be ready
                TimeUnit.MILLISECONDS.sleep(200);

                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                server.stop();
                deps.close();
        }

        private HttpResponse<String> send(String method, String path, String caller, String body) throws Exception {
                HttpRequest.Builder builder = HttpRequest.newBuilder()
                                .uri(URI.create(BASE_URL + path))
                                .header("Content-Type", "application/json")
                                .method(method, body == null
                                                ? HttpRequest.BodyPublishers.noBody()
                                                : HttpRequest.BodyPublishers.ofString(body));
                if (caller != null) {
                        builder.header("X-Caller", caller);
                }
                return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        }

        private JsonNode json(HttpResponse<String> response) throws Exception {
                return MAPPER.readTree(response.body());
        }

        @Test
        @DisplayName("Full HTTP flow: fund, approve, complete, verify balances and events")
        void fundApproveComplete() throws Exception {
                HttpResponse<String> fund = send("POST", "/api/v1/tasks", "client", "{\"amount\": 100000}");
                assertEquals(201, fund.statusCode(), "Fund should return 201. Body: " + fund.body());
                long taskId = json(fund).get("taskId").asLong();
                assertEquals(1, taskId);

                HttpResponse<String> approve = send("POST", "/api/v1/tasks/1/subtasks/0/approve", "client",
                                "{\"worker\": \"worker\", \"amount\": 20000}");
                assertEquals(200, approve.statusCode(), "Approve should succeed. Body: " + approve.body());
                JsonNode task = json(approve);
                assertEquals("IN_PROGRESS", task.get("status").asText());
                assertEquals(20_000, task.get("releasedAmount").asLong());

                assertEquals(18_000, json(send("GET", "/api/v1/balances/worker", null, null)).get("balance").asLong());
                assertEquals(2_000, json(send("GET", "/api/v1/balances/treasury", null, null)).get("balance").asLong());

                HttpResponse<String> payment = send("GET", "/api/v1/tasks/1/subtasks/0", null, null);
                assertEquals(200, payment.statusCode());
                assertTrue(json(payment).get("paid").asBoolean());
                assertEquals(404, send("GET", "/api/v1/tasks/1/subtasks/5", null, null).statusCode());

                HttpResponse<String> complete = send("POST", "/api/v1/tasks/1/complete", "client", null);
                assertEquals(200, complete.statusCode(), "Complete should succeed. Body: " + complete.body());
                assertEquals("COMPLETED", json(complete).get("status").asText());
                assertEquals(980_000, json(send("GET", "/api/v1/balances/client", null, null)).get("balance").asLong());

                JsonNode events = json(send("GET", "/api/v1/tasks/1/events", null, null)).get("events");
                assertEquals(3, events.size());
                assertEquals("TASK_FUNDED", events.get(0).get("type").asText());
                assertEquals("SUBTASK_APPROVED", events.get(1).get("type").asText());
                assertEquals("TASK_COMPLETED", events.get(2).get("type").asText());
        }

        @Test
        @DisplayName("Rejections map to HTTP statuses with error codes")
        void errorMapping() throws Exception {
                send("POST", "/api/v1/tasks", "client", "{\"amount\": 100000}");

                HttpResponse<String> invalidAmount = send("POST", "/api/v1/tasks", "client", "{\"amount\": 0}");
                assertEquals(400, invalidAmount.statusCode());
                assertEquals("INVALID_AMOUNT", json(invalidAmount).get("error").asText());

                HttpResponse<String> notFound = send("POST", "/api/v1/tasks/99/complete", "client", null);
                assertEquals(404, notFound.statusCode());
                assertEquals("TASK_NOT_FOUND", json(notFound).get("error").asText());

                HttpResponse<String> unauthorized = send("POST", "/api/v1/tasks/1/subtasks/0/approve", "stranger",
                                "{\"worker\": \"w\", \"amount\": 1}");
                assertEquals(403, unauthorized.statusCode());
                assertEquals("UNAUTHORIZED", json(unauthorized).get("error").asText());

                HttpResponse<String> overBudget = send("POST", "/api/v1/tasks/1/subtasks/0/approve", "client",
                                "{\"worker\": \"w\", \"amount\": 100001}");
                assertEquals(409, overBudget.statusCode());
                assertEquals("EXCEEDS_BUDGET", json(overBudget).get("error").asText());

                HttpResponse<String> broke = send("POST", "/api/v1/tasks", "nobody", "{\"amount\": 5}");
                assertEquals(422, broke.statusCode());
                assertEquals("TRANSFER_FAILED", json(broke).get("error").asText());

                HttpResponse<String> malformed = send("POST", "/api/v1/tasks", "client", "{not json");
                assertEquals(400, malformed.statusCode());

                HttpResponse<String> unknown = send("GET", "/api/v1/nothing", null, null);
                assertEquals(404, unknown.statusCode());
        }

        @Test
        @DisplayName("Dispute flow and admin-only fee changes")
        void disputeAndAdmin() throws Exception {
                send("POST", "/api/v1/tasks", "client", "{\"amount\": 100000}");

                assertEquals(200, send("POST", "/api/v1/tasks/1/dispute", "anyone", null).statusCode());

                HttpResponse<String> notAdmin = send("POST", "/api/v1/tasks/1/resolve", "client",
                                "{\"winner\": \"worker\", \"winnerAmount\": 60000}");
                assertEquals(403, notAdmin.statusCode());

                HttpResponse<String> resolved = send("POST", "/api/v1/tasks/1/resolve", "admin",
                                "{\"winner\": \"worker\", \"winnerAmount\": 60000}");
                assertEquals(200, resolved.statusCode(), "Resolve should succeed. Body: " + resolved.body());
                assertEquals("RESOLVED", json(resolved).get("status").asText());
                assertEquals(60_000, json(send("GET", "/api/v1/balances/worker", null, null)).get("balance").asLong());

                HttpResponse<String> again = send("POST", "/api/v1/tasks/1/resolve", "admin",
                                "{\"winner\": \"worker\", \"winnerAmount\": 1}");
                assertEquals(409, again.statusCode());
                assertEquals("INVALID_STATUS", json(again).get("error").asText());

                assertEquals(403, send("PUT", "/api/v1/fee", "client", "{\"feeBps\": 100}").statusCode());
                HttpResponse<String> tooHigh = send("PUT", "/api/v1/fee", "admin", "{\"feeBps\": 2500}");
                assertEquals(400, tooHigh.statusCode());
                assertEquals("FEE_TOO_HIGH", json(tooHigh).get("error").asText());

                HttpResponse<String> fee = send("PUT", "/api/v1/fee", "admin", "{\"feeBps\": 250}");
                assertEquals(200, fee.statusCode());
                assertEquals(250, json(fee).get("feeBps").asInt());

                HttpResponse<String> grant = send("POST", "/api/v1/roles/grant", "admin",
                                "{\"role\": \"ADMIN\", \"account\": \"ops\"}");
                assertEquals(200, grant.statusCode(), grant.body());
                assertTrue(json(grant).get("changed").asBoolean());
                assertTrue(json(send("GET", "/api/v1/roles/admins/ops", null, null)).get("admin").asBoolean());
        }

        @Test
        @DisplayName("Event stream paging, minting and health")
        void eventsMintAndHealth() throws Exception {
                assertEquals(403, send("POST", "/api/v1/balances/mint", "client",
                                "{\"account\": \"client\", \"amount\": 5}").statusCode());
                HttpResponse<String> mint = send("POST", "/api/v1/balances/mint", "admin",
                                "{\"account\": \"newbie\", \"amount\": 500}");
                assertEquals(200, mint.statusCode(), mint.body());
                assertEquals(500, json(mint).get("balance").asLong());
                assertEquals(400, send("POST", "/api/v1/balances/mint", "admin",
                                "{\"account\": \"escrow\", \"amount\": 5}").statusCode());

                EscrowEvent minted = deps.escrowService().events(0, 100).stream()
                                .filter(e -> e.type() == EscrowEventType.TOKENS_MINTED)
                                .findFirst()
                                .orElseThrow();
                assertEquals("admin", minted.actor());
                assertEquals(500, minted.longDetail("amount"));

                send("POST", "/api/v1/tasks", "newbie", "{\"amount\": 500}");
                send("POST", "/api/v1/tasks/1/cancel", "newbie", null);

                JsonNode all = json(send("GET", "/api/v1/events?after=0&limit=100", null, null));
                int total = all.get("count").asInt();
                // bootstrap events precede the task events
                assertTrue(total >= 2);
                long lastSeq = all.get("events").get(total - 1).get("sequence").asLong();
                assertEquals("TASK_CANCELLED", all.get("events").get(total - 1).get("type").asText());

                JsonNode tail = json(send("GET", "/api/v1/events?after=" + (lastSeq - 1), null, null));
                assertEquals(1, tail.get("count").asInt());
                assertEquals(200, send("GET", "/api/v1/events/" + lastSeq, null, null).statusCode());
                assertEquals(404, send("GET", "/api/v1/events/" + (lastSeq + 100), null, null).statusCode());

                JsonNode tasks = json(send("GET", "/api/v1/tasks?client=newbie", null, null));
                assertEquals(1, tasks.get("count").asInt());
                assertEquals("CANCELLED", tasks.get("tasks").get(0).get("status").asText());

                HttpResponse<String> health = send("GET", "/api/v1/health", null, null);
                assertEquals(200, health.statusCode());
                JsonNode h = json(health);
                assertEquals("healthy", h.get("status").asText());
                assertEquals(1, h.get("taskCount").asLong());
        }
}
