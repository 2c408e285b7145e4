package com.p14n.livefeed;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.livefeed.data.ConfigData;
import com.p14n.livefeed.data.EventType;
import com.p14n.livefeed.db.DatabaseSetup;
import com.p14n.livefeed.vertx.VertxEventStreamServer;

import io.opentelemetry.instrumentation.jdbc.datasource.JdbcTelemetry;
import io.vertx.core.Vertx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import javax.sql.DataSource;

/**
 * Runs the live feed with its HTTP stream endpoint.
 *
 * <p>
 * Environment:
 * </p>
 * <ul>
 * <li>APP_DB_HOST, APP_DB_PORT, APP_DB_USER, APP_DB_PASSWORD, APP_DB_NAME</li>
 * <li>APP_HTTP_PORT (default 8080)</li>
 * <li>APP_KEEPALIVE_SECONDS (default 15), APP_RETENTION_DAYS (default 7)</li>
 * <li>APP_OTLP_ENDPOINT (default http://localhost:4317)</li>
 * <li>APP_DEMO_TENANTS: comma separated restaurant ids to publish sample
 * order events for</li>
 * </ul>
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static String env(String name, String defaultValue) {
        var e = System.getenv(name);
        if (e != null && !e.isBlank()) {
            return e.trim();
        }
        return defaultValue;
    }

    private static String[] envVals(String name) {
        var e = System.getenv(name);
        if (e != null && !e.isBlank()) {
            return e.split(",");
        }
        return new String[] {};
    }

    static ConfigData config() {
        return new ConfigData(
                env("APP_DB_HOST", "localhost"),
                Integer.parseInt(env("APP_DB_PORT", "5432")),
                env("APP_DB_USER", "postgres"),
                env("APP_DB_PASSWORD", "postgres"),
                env("APP_DB_NAME", "postgres"),
                Integer.parseInt(env("APP_KEEPALIVE_SECONDS", "15")),
                Integer.parseInt(env("APP_RETENTION_DAYS", "7")));
    }

    public static void main(String[] args) throws Exception {
        var cfg = config();
        int httpPort = Integer.parseInt(env("APP_HTTP_PORT", "8080"));
        var demoTenants = envVals("APP_DEMO_TENANTS");
        var ot = Opentelemetry.create("livefeed", env("APP_OTLP_ENDPOINT", "http://localhost:4317"));
        DataSource ds = JdbcTelemetry.create(ot).wrap(DatabaseSetup.createPool(cfg));
        var vertx = Vertx.vertx();
        var feed = new LiveFeedServer(ds, cfg, ot);
        VertxEventStreamServer http = null;
        var stopped = new CountDownLatch(1);
        var done = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.atInfo().log("Shutdown requested");
            stopped.countDown();
            try {
                done.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "livefeed-shutdown"));

        try {
            feed.start();
            http = new VertxEventStreamServer(vertx, feed.multiplexer());
            http.start(httpPort);
            if (demoTenants.length > 0) {
                publishContinuously(feed.publisher(), demoTenants, stopped);
            } else {
                stopped.await();
            }
        } finally {
            close(http);
            close(feed);
            vertx.close().toCompletionStage().toCompletableFuture().join();
            close(ot);
            done.countDown();
        }
    }

    /**
     * Publishes a sample order lifecycle for each tenant with a varying gap,
     * so a dashboard has something to show.
     */
    private static void publishContinuously(EventPublisher publisher, String[] tenants, CountDownLatch stopped)
            throws InterruptedException {
        var gap = 1000;
        var direction = -1;
        var statuses = new String[] { "confirmed", "preparing", "ready", "served" };
        while (stopped.getCount() > 0) {
            for (var t : tenants) {
                var tenant = t.trim();
                var orderId = UUID.randomUUID().toString();
                try {
                    publisher.publish(EventType.ORDER_CREATED, order(orderId, "pending"), tenant);
                    for (var status : statuses) {
                        publisher.publish(EventType.ORDER_STATUS_CHANGED, order(orderId, status), tenant);
                    }
                } catch (SQLException e) {
                    logger.atError()
                            .setCause(e)
                            .addArgument(tenant)
                            .log("Failed to publish sample events for {}");
                }
            }
            gap += direction * 10;
            if (gap < 10) {
                direction = 1;
            } else if (gap > 1000) {
                direction = -1;
            }
            stopped.await(gap, TimeUnit.MILLISECONDS);
        }
    }

    private static ObjectNode order(String orderId, String status) {
        return JsonNodeFactory.instance.objectNode()
                .put("orderId", orderId)
                .put("status", status);
    }

    private static void close(AutoCloseable c) {
        try {
            if (c != null)
                c.close();
        } catch (Exception e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(c.getClass().getSimpleName())
                    .log("Error closing {}");
        }
    }
}
