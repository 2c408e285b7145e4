package com.p14n.livefeed.data;

import java.util.Properties;

public record ConfigData(String dbHost,
        int dbPort,
        String dbUser,
        String dbPassword,
        String dbName,
        int keepAliveSeconds,
        int retentionDays,
        int sweepIntervalMinutes,
        int catchupBatchSize,
        int maxReplayEvents,
        long reconnectInitialMillis,
        long reconnectMaxMillis,
        Properties overrideProps) implements LiveFeedConfig {

    public ConfigData(String dbHost,
                      int dbPort,
                      String dbUser,
                      String dbPassword,
                      String dbName,
                      int keepAliveSeconds,
                      int retentionDays) {
        this(dbHost, dbPort, dbUser, dbPassword, dbName, keepAliveSeconds, retentionDays, 60, 100, 1000, 500,
                30_000, null);
    }

    public ConfigData(String dbHost,
                      int dbPort,
                      String dbUser,
                      String dbPassword,
                      String dbName) {
        this(dbHost, dbPort, dbUser, dbPassword, dbName, 15, 7);
    }
}
