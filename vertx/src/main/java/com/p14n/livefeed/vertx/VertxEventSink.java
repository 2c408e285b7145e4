package com.p14n.livefeed.vertx;

import com.p14n.livefeed.stream.EventSink;

import io.vertx.core.Context;
import io.vertx.core.http.HttpServerResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Writes frames to a chunked HTTP response. Every write is handed to the
 * response's own context, which runs them in submission order; callers on any
 * thread never block on the socket.
 */
class VertxEventSink implements EventSink {

    private static final Logger logger = LoggerFactory.getLogger(VertxEventSink.class);

    private final Context context;
    private final HttpServerResponse response;
    private volatile boolean closed;

    VertxEventSink(Context context, HttpServerResponse response) {
        this.context = context;
        this.response = response;
    }

    @Override
    public void send(String frame) throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        context.runOnContext(v -> {
            if (response.closed() || response.ended()) {
                return;
            }
            if (response.writeQueueFull()) {
                // a client this far behind is dropped; it catches up on reconnect
                logger.atWarn().log("Client not reading, closing stream");
                closed = true;
                response.close();
                return;
            }
            response.write(frame);
        });
    }

    @Override
    public void close() {
        closed = true;
        context.runOnContext(v -> {
            if (!response.closed() && !response.ended()) {
                response.end();
            }
        });
    }

    void markClosed() {
        closed = true;
    }

    boolean isClosed() {
        return closed;
    }
}
