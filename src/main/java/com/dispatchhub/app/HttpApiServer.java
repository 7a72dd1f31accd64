package com.dispatchhub.app;

import com.dispatchhub.engine.JobQueueScheduler;
import com.dispatchhub.notify.NotificationDispatcher;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.json.JSONException;
import org.json.JSONObject;

// HTTP server exposing health, queue/notification metrics and webhook ingestion
public class HttpApiServer {
    private static final Logger logger = Logger.getLogger(HttpApiServer.class.getName());

    private final JobQueueScheduler scheduler;
    private final NotificationDispatcher dispatcher;
    private final SessionEventRelay relay;
    private final int port;
    private final long startTime;
    private HttpServer server;
    private ExecutorService executor;

    // Create server; port 0 picks a free port
    public HttpApiServer(JobQueueScheduler scheduler, NotificationDispatcher dispatcher,
                         SessionEventRelay relay, int port) {
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.relay = relay;
        this.port = port;
        this.startTime = System.currentTimeMillis();
    }

    // Start HTTP server and register endpoints
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/webhook", new WebhookHandler());

        executor = Executors.newFixedThreadPool(4);
        server.setExecutor(executor);
        server.start();

        logger.info("HTTP API started on port " + getPort());
    }

    // Stop HTTP server gracefully
    public void stop() {
        if (server != null) {
            server.stop(2);
            executor.shutdownNow();
            logger.info("HTTP API stopped");
        }
    }

    // Actual bound port, useful when started with port 0
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            JSONObject json = new JSONObject();
            json.put("status", "ok");
            json.put("timestamp", Instant.now().toString());
            sendJson(exchange, 200, json);
        }
    }

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            try {
                JSONObject json = new JSONObject();
                json.put("queue", scheduler.getStats().toJson());
                json.put("notifications", dispatcher.getStats().toJson());
                json.put("uptime_seconds", (System.currentTimeMillis() - startTime) / 1000);
                sendJson(exchange, 200, json);
                logger.fine("Served metrics request");
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Failed to gather metrics", e);
                sendError(exchange, 500, "Failed to gather metrics");
            }
        }
    }

    private class WebhookHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            JSONObject event;
            try (InputStream in = exchange.getRequestBody()) {
                event = new JSONObject(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            } catch (JSONException e) {
                logger.warning("Rejected malformed webhook body: " + e.getMessage());
                sendError(exchange, 400, "Malformed JSON body");
                return;
            }

            try {
                relay.relay(event);
                JSONObject json = new JSONObject();
                json.put("success", true);
                sendJson(exchange, 200, json);
            } catch (IllegalArgumentException e) {
                logger.warning("Rejected webhook event: " + e.getMessage());
                sendError(exchange, 400, e.getMessage());
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Error processing webhook", e);
                sendError(exchange, 500, "Failed to process webhook");
            }
        }
    }

    private static void sendJson(HttpExchange exchange, int statusCode, JSONObject json) throws IOException {
        byte[] response = json.toString().getBytes(StandardCharsets.UTF_8);

        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, response.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }

    private static void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        JSONObject json = new JSONObject();
        json.put("error", message);
        sendJson(exchange, statusCode, json);
    }
}
