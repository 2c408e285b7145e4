package com.p14n.livefeed.vertx;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.livefeed.catchup.CatchupQuery;
import com.p14n.livefeed.stream.Caller;
import com.p14n.livefeed.stream.ClientConnection;
import com.p14n.livefeed.stream.StreamMultiplexer;

import io.vertx.core.Context;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Serves the live feed as {@code text/event-stream} over a Vert.x
 * {@link HttpServer}.
 *
 * <p>
 * Request handling:
 * </p>
 * <ul>
 * <li>no {@code x-user-id} header: 401</li>
 * <li>a caller other than a platform administrator without
 * {@code x-restaurant-id}: 403</li>
 * <li>{@code since} that is not epoch milliseconds, or an unknown
 * {@code mode}: 400</li>
 * </ul>
 * <p>
 * Opening the stream runs catchup, so it happens on a worker thread; the
 * response stays on its event loop.
 * </p>
 */
public class VertxEventStreamServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(VertxEventStreamServer.class);

    public static final String DEFAULT_PATH = "/api/events/orders";

    private static final Map<String, String> STREAM_HEADERS = Map.of(
            "Content-Type", "text/event-stream",
            "Cache-Control", "no-cache",
            "X-Accel-Buffering", "no",
            "Access-Control-Allow-Origin", "*",
            "Access-Control-Allow-Headers", "Cache-Control");

    private final Vertx vertx;
    private final StreamMultiplexer multiplexer;
    private final String path;
    private final CallerResolver callers = new CallerResolver();
    private final ObjectMapper mapper = new ObjectMapper();
    private HttpServer server;

    public VertxEventStreamServer(Vertx vertx, StreamMultiplexer multiplexer) {
        this(vertx, multiplexer, DEFAULT_PATH);
    }

    public VertxEventStreamServer(Vertx vertx, StreamMultiplexer multiplexer, String path) {
        this.vertx = vertx;
        this.multiplexer = multiplexer;
        this.path = path;
    }

    /**
     * Starts listening and waits for the socket to be bound.
     *
     * @param port the port, or 0 for any free port
     * @return the bound port
     */
    public synchronized int start(int port) throws InterruptedException, ExecutionException, TimeoutException {
        if (server != null) {
            throw new IllegalStateException("Server already started");
        }
        server = vertx.createHttpServer()
                .requestHandler(this::handle)
                .listen(port)
                .toCompletionStage()
                .toCompletableFuture()
                .get(10, TimeUnit.SECONDS);
        logger.atInfo()
                .addArgument(server.actualPort())
                .addArgument(path)
                .log("Event stream server listening on port {} at {}");
        return server.actualPort();
    }

    void handle(HttpServerRequest request) {
        HttpServerResponse response = request.response();
        if (!path.equals(request.path())) {
            error(response, 404, "Not found");
            return;
        }
        if (request.method() != HttpMethod.GET) {
            error(response, 405, "Method not allowed");
            return;
        }
        Optional<Caller> resolved = callers.resolve(request.headers());
        if (resolved.isEmpty()) {
            error(response, 401, "Unauthorized");
            return;
        }
        Caller caller = resolved.get();
        if (!caller.isPlatformAdmin() && caller.tenantId() == null) {
            error(response, 403, "Restaurant access required");
            return;
        }
        CatchupQuery query;
        try {
            query = catchupQuery(request.getParam("since"), request.getParam("mode"));
        } catch (IllegalArgumentException e) {
            error(response, 400, e.getMessage());
            return;
        }
        openStream(caller, query, response);
    }

    private void openStream(Caller caller, CatchupQuery query, HttpServerResponse response) {
        response.setStatusCode(200).setChunked(true);
        STREAM_HEADERS.forEach(response::putHeader);

        Context context = vertx.getOrCreateContext();
        VertxEventSink sink = new VertxEventSink(context, response);
        AtomicReference<String> connectionId = new AtomicReference<>();

        response.closeHandler(v -> {
            sink.markClosed();
            String id = connectionId.get();
            if (id != null) {
                multiplexer.close(id);
            }
        });

        vertx.executeBlocking(() -> multiplexer.open(caller, sink, query), false)
                .onSuccess(connection -> registered(connection, sink, connectionId))
                .onFailure(e -> {
                    logger.atError()
                            .setCause(e)
                            .addArgument(caller.callerId())
                            .log("Failed to open stream for caller {}");
                    if (!response.headWritten()) {
                        error(response, 503, "Stream unavailable");
                    } else if (!response.ended() && !response.closed()) {
                        response.end();
                    }
                });
    }

    private void registered(ClientConnection connection, VertxEventSink sink, AtomicReference<String> connectionId) {
        connectionId.set(connection.connectionId());
        // the client may have gone while catchup ran
        if (sink.isClosed()) {
            multiplexer.close(connection.connectionId());
        }
    }

    static CatchupQuery catchupQuery(String since, String mode) {
        Instant checkpoint = null;
        if (since != null && !since.isBlank()) {
            try {
                checkpoint = Instant.ofEpochMilli(Long.parseLong(since.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("since must be epoch milliseconds");
            }
        }
        if (mode == null || mode.isBlank() || mode.equalsIgnoreCase("since")) {
            return CatchupQuery.since(checkpoint);
        }
        if (mode.equalsIgnoreCase("undelivered")) {
            return CatchupQuery.undelivered(checkpoint);
        }
        throw new IllegalArgumentException("mode must be since or undelivered");
    }

    private void error(HttpServerResponse response, int status, String message) {
        String body = mapper.createObjectNode().put("error", message).toString();
        response.setStatusCode(status)
                .putHeader("Content-Type", "application/json")
                .end(body);
    }

    @Override
    public synchronized void close() {
        if (server == null) {
            return;
        }
        try {
            server.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
            logger.atInfo().log("Event stream server stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.atWarn().setCause(e).log("Error stopping event stream server");
        }
        server = null;
    }
}
