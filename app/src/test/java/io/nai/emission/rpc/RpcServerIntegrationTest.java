package io.nai.emission.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nai.emission.node.EmissionConfig;
import io.nai.emission.node.EmissionNode;
import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.AddressFormat;
import io.nai.emission.protocol.NodeId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RpcServerIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private final NodeId validator = NodeId.derive("validator");
    private final Address owner = Address.derive("owner");
    private final Address alice = Address.derive("alice");

    private RpcServer server;
    private EmissionNode node;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        node = EmissionNode.inMemory(EmissionConfig.defaultLocal(), T0);
        long start = T0.getEpochSecond() + 1;
        assertTrue(node.actions().registerValidatorStake(owner, validator, new byte[48], start,
                start + Duration.ofDays(365).getSeconds(), node.config().staking.minValidatorStake(), 10, owner).success());
        assertTrue(node.actions().delegateUserStake(alice, validator, node.config().staking.minDelegatorStake(), alice).success());
        node.validatorSet().put(validator, new byte[48]);
        node.validatorSet().put(NodeId.derive("observer"), new byte[48]);
        for (long h = 1; h <= 20; h++) {
            node.acceptBlock(h, T0.plusSeconds(h * 3), 10);
        }

        port = freePort();
        server = new RpcServer(node.emission(), node.metrics(), "127.0.0.1", port, "rpc-secret");
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (node != null) {
            node.close();
        }
    }

    private HttpResponse<String> get(String pathAndQuery, boolean authorized) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(new URI("http://127.0.0.1:" + port + pathAndQuery)).GET();
        if (authorized) {
            builder.header("Authorization", "Bearer rpc-secret");
        }
        return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void requiresTokenWhenConfigured() throws Exception {
        assertEquals(401, get("/emission/info", false).statusCode());

        HttpRequest apiKey = HttpRequest.newBuilder(new URI("http://127.0.0.1:" + port + "/emission/info"))
                .header("X-API-Key", "rpc-secret")
                .GET()
                .build();
        assertEquals(200, http.send(apiKey, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    @Test
    void infoReportsLedgerTotals() throws Exception {
        HttpResponse<String> response = get("/emission/info", true);
        assertEquals(200, response.statusCode());

        JsonNode body = mapper.readTree(response.body());
        assertEquals(node.emission().snapshot().totalSupply(), body.get("totalSupply").asLong());
        assertEquals(node.emission().snapshot().totalStaked(), body.get("totalStaked").asLong());
        assertEquals(2_500, body.get("aprBps").asLong());
        assertEquals(20, body.get("lastAcceptedHeight").asLong());
        assertEquals(1, body.get("delegatorCount").asInt());
        assertEquals(AddressFormat.format(EmissionConfig.DEFAULT_EMISSION_ADDRESS),
                body.get("emissionAccount").get("address").asText());
        assertEquals(100, body.get("emissionAccount").get("unclaimedBalance").asLong());
        assertEquals(10, body.get("epochTracker").get("epochLength").asLong());
    }

    @Test
    void validatorViews() throws Exception {
        JsonNode staked = mapper.readTree(get("/validators/staked?nodeId=" + validator.hex(), true).body());
        assertEquals(1, staked.size());
        assertEquals(validator.hex(), staked.get(0).get("nodeId").asText());
        assertTrue(staked.get(0).get("active").asBoolean());
        assertEquals(1, staked.get(0).get("delegatorCount").asInt());

        JsonNode all = mapper.readTree(get("/validators/all", true).body());
        assertEquals(2, all.size());

        assertEquals(400, get("/validators/staked?nodeId=zz", true).statusCode());
    }

    @Test
    void delegatorViews() throws Exception {
        JsonNode count = mapper.readTree(get("/delegators/count", true).body());
        assertEquals(1, count.get("count").asInt());

        String query = "/delegators/rewards?nodeId=" + validator.hex() + "&delegator=" + AddressFormat.format(alice);
        HttpResponse<String> rewards = get(query, true);
        assertEquals(200, rewards.statusCode());
        assertEquals(node.emission().calculateUserDelegationRewards(validator, alice, 20),
                mapper.readTree(rewards.body()).get("reward").asLong());

        HttpResponse<String> unknown = get("/delegators/rewards?nodeId=" + validator.hex()
                + "&delegator=" + AddressFormat.format(Address.derive("nobody")), true);
        assertEquals(404, unknown.statusCode());
        assertEquals("delegator_not_found", mapper.readTree(unknown.body()).get("error").asText());

        assertEquals(400, get("/delegators/rewards?nodeId=" + validator.hex(), true).statusCode());
    }

    @Test
    void metricsAndOpenApi() throws Exception {
        HttpResponse<String> metrics = get("/metrics", true);
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("emission.minted"));

        HttpResponse<String> openApi = get("/openapi.json", true);
        assertEquals(200, openApi.statusCode());
        assertTrue(mapper.readTree(openApi.body()).get("paths").has("/delegators/rewards"));

        HttpRequest post = HttpRequest.newBuilder(new URI("http://127.0.0.1:" + port + "/emission/info"))
                .header("Authorization", "Bearer rpc-secret")
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        assertEquals(405, http.send(post, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
