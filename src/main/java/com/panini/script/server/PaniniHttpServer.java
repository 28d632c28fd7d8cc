package com.panini.script.server;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.panini.debug.Debug;
import com.panini.script.PaniniScript;
import com.panini.script.parser.Interpreter;
import com.panini.script.parser.RunResult;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * HTTP front end for the evaluator.
 *
 * Endpoints:
 *  - POST /api/run  {"code": "..."} -> {"output": "...", "errors": ["Line 1: ...", ...]}
 *  - GET  /health   -> {"status":"healthy","service":"paanini-ide","version":"0.1.0"}
 *
 * Every request runs on its own copy of an empty template context, so no
 * state survives from one request to the next.
 */
public final class PaniniHttpServer implements Closeable {

    private static final String TAG = "PaniniHttpServer";
    private static final String JSON = "application/json; charset=utf-8";
    private static final int MAX_BODY = 1024 * 1024;

    private final ObjectMapper om = new ObjectMapper();
    private final Interpreter template;
    private final HttpServer server;
    private final ExecutorService pool;

    public PaniniHttpServer(PaniniScript engine, int port, int threads) throws IOException {
        this.template = engine.newSession();
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.pool = Executors.newFixedThreadPool(Math.max(1, threads));
        server.setExecutor(pool);
        server.createContext("/api/run", this::handleRun);
        server.createContext("/health", this::handleHealth);
    }

    public void start() {
        server.start();
        Debug.get().i(TAG, "Panini IDE server running at http://localhost:" + port());
    }

    /** Bound port; differs from the requested one when 0 was requested. */
    public int port() {
        return server.getAddress().getPort();
    }

    /** Runs one request body against a fresh context. */
    ObjectNode process(JsonNode req) {
        JsonNode code = req.get("code");
        if (code == null || !code.isTextual()) {
            throw new IllegalArgumentException("request requires a string field 'code'");
        }
        RunResult result = template.copy().run(code.asText());

        ObjectNode resp = om.createObjectNode();
        resp.put("output", result.output());
        ArrayNode errors = resp.putArray("errors");
        for (String e : result.errors()) errors.add(e);
        return resp;
    }

    private void handleRun(HttpExchange exchange) throws IOException {
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "method not allowed: " + exchange.getRequestMethod());
                return;
            }
            byte[] body;
            try (InputStream in = exchange.getRequestBody()) {
                body = in.readNBytes(MAX_BODY + 1);
            }
            if (body.length > MAX_BODY) {
                sendError(exchange, 413, "request body too large");
                return;
            }

            ObjectNode resp;
            try {
                resp = process(om.readTree(body));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                Debug.get().w(TAG, "bad request from " + exchange.getRemoteAddress() + ": " + e.getMessage());
                sendError(exchange, 400, e.getMessage());
                return;
            }
            send(exchange, 200, resp);
        } catch (IOException | RuntimeException e) {
            Debug.get().e(TAG, "request failed", e);
            throw e;
        } finally {
            exchange.close();
        }
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        try {
            ObjectNode resp = om.createObjectNode();
            resp.put("status", "healthy");
            resp.put("service", "paanini-ide");
            resp.put("version", PaniniScript.VERSION);
            send(exchange, 200, resp);
        } finally {
            exchange.close();
        }
    }

    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        ObjectNode resp = om.createObjectNode();
        resp.put("error", message);
        send(exchange, status, resp);
    }

    private void send(HttpExchange exchange, int status, JsonNode body) throws IOException {
        byte[] bytes = om.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", JSON);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
        pool.shutdownNow();
        Debug.get().i(TAG, "stopped");
    }
}
