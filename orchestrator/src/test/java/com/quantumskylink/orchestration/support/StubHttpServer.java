package com.quantumskylink.orchestration.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Local HTTP server standing in for a collaborator service.
 *
 * Answers with scripted responses in order; once the script runs out the
 * last response repeats. Every request is recorded.
 */
public class StubHttpServer implements AutoCloseable {

    public record Recorded(String method, String path, String body) {}

    private record Scripted(int status, String body) {}

    private final HttpServer                server;
    private final Queue<Scripted>           script   = new ConcurrentLinkedQueue<>();
    private final List<Recorded>            requests = new CopyOnWriteArrayList<>();
    private final BlockingQueue<Recorded>   arrivals = new LinkedBlockingQueue<>();
    private volatile Scripted               last     = new Scripted(200, "");

    public StubHttpServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    public StubHttpServer respond(int status, String body) {
        script.add(new Scripted(status, body));
        return this;
    }

    public String baseUrl() {
        return "http://localhost:" + server.getAddress().getPort();
    }

    public List<Recorded> requests() {
        return requests;
    }

    /** Waits for the next request to arrive; null on timeout. */
    public Recorded awaitRequest(long timeout, TimeUnit unit) throws InterruptedException {
        return arrivals.poll(timeout, unit);
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        Recorded recorded = new Recorded(exchange.getRequestMethod(), exchange.getRequestURI().getPath(), body);
        requests.add(recorded);
        arrivals.add(recorded);

        Scripted next = script.poll();
        if (next != null) {
            last = next;
        } else {
            next = last;
        }
        byte[] out = next.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(next.status(), out.length == 0 ? -1 : out.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(out);
        }
    }
}
