package io.nai.emission.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.nai.emission.ledger.Emission;
import io.nai.emission.ledger.EmissionSnapshot;
import io.nai.emission.ledger.StakingException;
import io.nai.emission.ledger.ValidatorSnapshot;
import io.nai.emission.metrics.EmissionMetrics;
import io.nai.emission.metrics.HttpMetrics;
import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.AddressFormat;
import io.nai.emission.protocol.Hex;
import io.nai.emission.protocol.NodeId;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only JSON view of the emission ledger. Node ids are hex, addresses
 * bech32 with the {@code nai} prefix.
 */
public final class RpcServer {
    private static final Logger LOG = Logger.getLogger(RpcServer.class.getName());
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "NAI Emission RPC API",
    "version": "1.0.0"
  },
  "paths": {
    "/emission/info": {
      "get": {
        "summary": "Supply, stake, APR and emission account",
        "responses": { "200": { "description": "Emission info" }, "401": { "description": "Auth required" } }
      }
    },
    "/validators/staked": {
      "get": {
        "summary": "Staked validators, all or one",
        "parameters": [
          { "name": "nodeId", "in": "query", "required": false, "schema": { "type": "string" } }
        ],
        "responses": { "200": { "description": "Validator list" }, "400": { "description": "Invalid node id" } }
      }
    },
    "/validators/all": {
      "get": {
        "summary": "Consensus validators merged with staking data",
        "responses": { "200": { "description": "Validator list" } }
      }
    },
    "/delegators/count": {
      "get": {
        "summary": "Number of delegators, all or for one validator",
        "parameters": [
          { "name": "nodeId", "in": "query", "required": false, "schema": { "type": "string" } }
        ],
        "responses": { "200": { "description": "Delegator count" } }
      }
    },
    "/delegators/rewards": {
      "get": {
        "summary": "Pending delegation reward at the last accepted height",
        "parameters": [
          { "name": "nodeId", "in": "query", "required": true, "schema": { "type": "string" } },
          { "name": "delegator", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Pending reward" },
          "400": { "description": "Invalid parameters" },
          "404": { "description": "Validator, delegator or stake not found" }
        }
      }
    },
    "/metrics": {
      "get": {
        "summary": "Micrometer meters in text form",
        "responses": { "200": { "description": "Metrics" } }
      }
    },
    "/openapi.json": {
      "get": {
        "summary": "This document",
        "responses": { "200": { "description": "OpenAPI document" } }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final Emission emission;
    private final EmissionMetrics metrics;
    private final HttpMetrics httpMetrics;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public RpcServer(Emission emission, EmissionMetrics metrics, String bindAddress, int port, String authToken) {
        this.emission = emission;
        this.metrics = metrics;
        this.httpMetrics = new HttpMetrics(metrics.registry());
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper();
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("RPC server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/emission/info", new InfoHandler());
        server.createContext("/validators/staked", new StakedValidatorsHandler());
        server.createContext("/validators/all", new AllValidatorsHandler());
        server.createContext("/delegators/count", new DelegatorCountHandler());
        server.createContext("/delegators/rewards", new DelegatorRewardsHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/openapi.json", new OpenApiHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "RPC server listening on http://" + bindAddress + ':' + port() + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    /** GET-only endpoint with auth, timing and error mapping. */
    private abstract class GetHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = httpMetrics.start();
            int status = 500;
            try {
                if (!"GET".equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use GET for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = respond(exchange);
            } catch (StakingException e) {
                status = sendError(exchange, 404, e.kind().name().toLowerCase(Locale.ROOT), e.getMessage());
            } catch (IllegalArgumentException e) {
                status = sendError(exchange, 400, "invalid_argument", e.getMessage());
            } catch (Exception e) {
                LOG.log(Level.WARNING, path + " handler failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                httpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }

        abstract int respond(HttpExchange exchange) throws IOException;
    }

    final class InfoHandler extends GetHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            EmissionSnapshot snap = emission.snapshot();
            ObjectNode resp = mapper.createObjectNode();
            resp.put("totalSupply", snap.totalSupply());
            resp.put("maxSupply", snap.maxSupply());
            resp.put("totalStaked", snap.totalStaked());
            resp.put("validatorCount", snap.validatorCount());
            resp.put("delegatorCount", emission.getNumDelegators(NodeId.EMPTY));
            resp.put("aprBps", emission.getAprForValidators());
            resp.put("rewardsPerEpoch", emission.getRewardsPerEpoch());
            resp.put("lastAcceptedHeight", emission.getLastAcceptedBlockHeight());
            resp.put("lastAcceptedTimestamp", emission.getLastAcceptedBlockTimestamp().toString());
            resp.putObject("emissionAccount")
                    .put("address", AddressFormat.format(snap.emissionAccount().address()))
                    .put("unclaimedBalance", snap.emissionAccount().unclaimedBalance());
            resp.putObject("epochTracker")
                    .put("baseAprBps", snap.epochTracker().baseAprBps())
                    .put("baseValidators", snap.epochTracker().baseValidators())
                    .put("epochLength", snap.epochTracker().epochLength())
                    .put("secondsPerBlock", snap.epochTracker().secondsPerBlock());
            return sendJson(exchange, 200, resp);
        }
    }

    final class StakedValidatorsHandler extends GetHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            NodeId nodeId = optionalNodeId(exchange.getRequestURI());
            return sendJson(exchange, 200, validatorsJson(emission.getStakedValidators(nodeId)));
        }
    }

    final class AllValidatorsHandler extends GetHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, validatorsJson(emission.getAllValidators()));
        }
    }

    final class DelegatorCountHandler extends GetHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            NodeId nodeId = optionalNodeId(exchange.getRequestURI());
            ObjectNode resp = mapper.createObjectNode();
            resp.put("nodeId", nodeId.isEmpty() ? null : nodeId.hex());
            resp.put("count", emission.getNumDelegators(nodeId));
            return sendJson(exchange, 200, resp);
        }
    }

    final class DelegatorRewardsHandler extends GetHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            String nodeParam = queryParam(exchange.getRequestURI(), "nodeId");
            String delegatorParam = queryParam(exchange.getRequestURI(), "delegator");
            if (nodeParam == null || nodeParam.isBlank() || delegatorParam == null || delegatorParam.isBlank()) {
                return sendError(exchange, 400, "missing_fields", "Query parameters 'nodeId' and 'delegator' are required");
            }
            NodeId nodeId = NodeId.fromHex(nodeParam);
            Address delegator = AddressFormat.parse(delegatorParam);
            long height = emission.getLastAcceptedBlockHeight();
            long reward = emission.calculateUserDelegationRewards(nodeId, delegator, height);
            ObjectNode resp = mapper.createObjectNode()
                    .put("nodeId", nodeId.hex())
                    .put("delegator", AddressFormat.format(delegator))
                    .put("height", height)
                    .put("reward", reward);
            return sendJson(exchange, 200, resp);
        }
    }

    final class MetricsHandler extends GetHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            byte[] payload = metrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
            return 200;
        }
    }

    final class OpenApiHandler extends GetHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, OPENAPI_SPEC);
        }
    }

    private ArrayNode validatorsJson(List<ValidatorSnapshot> validators) {
        ArrayNode array = mapper.createArrayNode();
        for (ValidatorSnapshot v : validators) {
            ObjectNode node = array.addObject()
                    .put("nodeId", v.nodeId().hex())
                    .put("publicKey", Hex.encode(v.publicKey()))
                    .put("active", v.active())
                    .put("stakedAmount", v.stakedAmount())
                    .put("unclaimedStakedReward", v.unclaimedStakedReward())
                    .put("delegationFeeRate", v.delegationFeeRate())
                    .put("delegatedAmount", v.delegatedAmount())
                    .put("unclaimedDelegatedReward", v.unclaimedDelegatedReward())
                    .put("delegatorCount", v.delegatorCount());
            if (v.staked()) {
                node.put("stakeStartTime", v.stakeStartTime().toString());
                node.put("stakeEndTime", v.stakeEndTime().toString());
            }
        }
        return array;
    }

    private NodeId optionalNodeId(URI uri) {
        String value = queryParam(uri, "nodeId");
        return (value == null || value.isBlank()) ? NodeId.EMPTY : NodeId.fromHex(value);
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
        } else {
            payload = mapper.writeValueAsBytes(body);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }

    private static String queryParam(URI uri, String name) {
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] kv = pair.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String key = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (name.equals(key)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
