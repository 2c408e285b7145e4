package com.p14n.livefeed.data;

import java.util.Properties;

/**
 * Configuration interface for the live feed.
 * Defines the database connectivity and the timing parameters of streaming,
 * catchup and retention.
 */
public interface LiveFeedConfig {

    /**
     * Gets the database host address.
     *
     * @return The database host address
     */
    String dbHost();

    /**
     * Gets the database port number.
     *
     * @return The database port number
     */
    int dbPort();

    /**
     * Gets the database username.
     *
     * @return The database username
     */
    String dbUser();

    /**
     * Gets the database password.
     *
     * @return The database password
     */
    String dbPassword();

    /**
     * Gets the database name.
     *
     * @return The database name
     */
    String dbName();

    /**
     * Gets additional JDBC properties for the notification listener connection.
     *
     * @return Properties object containing override values, may be null
     */
    Properties overrideProps();

    /**
     * Interval between keep-alive frames on an open stream. Must stay below the
     * shortest idle timeout of any proxy in front of the server.
     *
     * @return keep-alive interval in seconds
     */
    default int keepAliveSeconds() {
        return 15;
    }

    /**
     * How long delivered events are kept before the retention sweep removes them.
     *
     * @return retention in days
     */
    default int retentionDays() {
        return 7;
    }

    /**
     * @return how often the retention sweep runs, in minutes
     */
    default int sweepIntervalMinutes() {
        return 60;
    }

    /**
     * @return page size used when reading the event log during catchup
     */
    default int catchupBatchSize() {
        return 100;
    }

    /**
     * @return upper bound on events replayed to one connection
     */
    default int maxReplayEvents() {
        return 1000;
    }

    /**
     * @return first delay before the notification listener reconnects
     */
    default long reconnectInitialMillis() {
        return 500;
    }

    /**
     * @return ceiling of the notification listener reconnect delay
     */
    default long reconnectMaxMillis() {
        return 30_000;
    }

    /**
     * Constructs the JDBC URL for database connection.
     *
     * @return The complete JDBC URL string
     */
    default String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s",
                dbHost(), dbPort(), dbName());
    }
}
