package com.p14n.livefeed.db;

import com.p14n.livefeed.data.LiveFeedConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public class DatabaseSetup {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseSetup.class);

    private final DataSource ds;

    public DatabaseSetup(DataSource ds) {
        this.ds = ds;
    }

    public DatabaseSetup setupAll() {
        createSchemaIfNotExists();
        createPendingEventsTableIfNotExists();
        createIndexesIfNotExist();
        return this;
    }

    public DatabaseSetup createSchemaIfNotExists() {
        try (Connection conn = ds.getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute("CREATE SCHEMA IF NOT EXISTS livefeed");
            logger.atInfo().log("Schema creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating schema");
            throw new RuntimeException("Failed to create schema", e);
        }
        return this;
    }

    public DatabaseSetup createPendingEventsTableIfNotExists() {
        try (Connection conn = ds.getConnection();
                Statement stmt = conn.createStatement()) {

            String sql = """
                    CREATE TABLE IF NOT EXISTS livefeed.pending_events (
                        id VARCHAR(32) PRIMARY KEY,
                        event_type VARCHAR(50) NOT NULL,
                        payload JSONB NOT NULL,
                        tenant_id VARCHAR(255) NOT NULL,
                        emitted_at TIMESTAMP WITH TIME ZONE NOT NULL,
                        delivered_at TIMESTAMP WITH TIME ZONE,
                        traceparent VARCHAR(55)
                    )""";

            stmt.execute(sql);
            logger.atInfo().log("Pending events table creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating pending events table");
            throw new RuntimeException("Failed to create pending_events table", e);
        }
        return this;
    }

    public DatabaseSetup createIndexesIfNotExist() {
        try (Connection conn = ds.getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute("""
                    CREATE INDEX IF NOT EXISTS idx_pending_events_tenant
                        ON livefeed.pending_events (tenant_id, emitted_at)""");
            stmt.execute("""
                    CREATE INDEX IF NOT EXISTS idx_pending_events_delivered
                        ON livefeed.pending_events (delivered_at)""");
            logger.atInfo().log("Pending events index creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating pending events indexes");
            throw new RuntimeException("Failed to create pending_events indexes", e);
        }
        return this;
    }

    public static DataSource createPool(LiveFeedConfig cfg) {
        HikariDataSource ds = new HikariDataSource();
        ds.setJdbcUrl(cfg.jdbcUrl());
        ds.setUsername(cfg.dbUser());
        ds.setPassword(cfg.dbPassword());
        ds.setPoolName("livefeed");
        return ds;
    }
}
