package org.assetwatch.anomaly.datamodel.store.jdbc;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class DataSourceFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(DataSourceFactory.class);

  static final String URL = "url";
  static final String USER = "user";
  static final String PASSWORD = "password";
  static final String DRIVER_CLASS_NAME = "driverClassName";
  static final String MAXIMUM_POOL_SIZE = "maximumPoolSize";
  static final String CONNECTION_TIMEOUT_MILLIS = "connectionTimeoutMillis";
  static final String POOL_NAME = "anomaly-store";

  static final int DEFAULT_MAXIMUM_POOL_SIZE = 10;
  static final long DEFAULT_CONNECTION_TIMEOUT_MILLIS = 30_000;

  static HikariDataSource create(Config jdbcConfig) {
    String url = jdbcConfig.getString(URL);
    LOGGER.info("Creating connection pool for {}", sanitizeUrl(url));

    HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setPoolName(POOL_NAME);
    hikariConfig.setJdbcUrl(url);
    if (jdbcConfig.hasPath(USER)) {
      hikariConfig.setUsername(jdbcConfig.getString(USER));
    }
    if (jdbcConfig.hasPath(PASSWORD)) {
      hikariConfig.setPassword(jdbcConfig.getString(PASSWORD));
    }
    if (jdbcConfig.hasPath(DRIVER_CLASS_NAME)) {
      hikariConfig.setDriverClassName(jdbcConfig.getString(DRIVER_CLASS_NAME));
    }
    hikariConfig.setMaximumPoolSize(
        jdbcConfig.hasPath(MAXIMUM_POOL_SIZE)
            ? jdbcConfig.getInt(MAXIMUM_POOL_SIZE)
            : DEFAULT_MAXIMUM_POOL_SIZE);
    hikariConfig.setConnectionTimeout(
        jdbcConfig.hasPath(CONNECTION_TIMEOUT_MILLIS)
            ? jdbcConfig.getLong(CONNECTION_TIMEOUT_MILLIS)
            : DEFAULT_CONNECTION_TIMEOUT_MILLIS);
    if (url.contains("postgresql")) {
      hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
    }
    return new HikariDataSource(hikariConfig);
  }

  static String sanitizeUrl(String url) {
    int queryStart = url.indexOf('?');
    return queryStart < 0 ? url : url.substring(0, queryStart);
  }
}
