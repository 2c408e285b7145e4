package com.p14n.livefeed.bus;

import com.p14n.livefeed.data.LiveFeedConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens the dedicated connection the notification listener subscribes on. It
 * must not come from a pool: the listener keeps it for its whole life and a
 * pooled connection would be recycled under it.
 */
@FunctionalInterface
public interface ListenerConnectionFactory {

    Connection open() throws SQLException;

    static ListenerConnectionFactory fromConfig(LiveFeedConfig cfg) {
        return () -> {
            Properties props = new Properties();
            if (cfg.overrideProps() != null) {
                props.putAll(cfg.overrideProps());
            }
            props.setProperty("user", cfg.dbUser());
            props.setProperty("password", cfg.dbPassword());
            props.putIfAbsent("ApplicationName", "livefeed-listener");
            props.putIfAbsent("tcpKeepAlive", "true");
            return DriverManager.getConnection(cfg.jdbcUrl(), props);
        };
    }
}
