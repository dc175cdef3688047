package org.assetwatch.anomaly.datamodel.store.jdbc;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.assetwatch.anomaly.datamodel.store.FindingsRepository;
import org.assetwatch.anomaly.datamodel.store.Store;
import org.assetwatch.anomaly.datamodel.store.TelemetryStore;

public class JdbcStore implements Store {
  static final String INIT_SCHEMA = "initSchema";
  static final String QUERY_TIMEOUT_SECONDS = "queryTimeoutSeconds";
  static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 30;

  private final HikariDataSource dataSource;
  private final JdbcTelemetryStore telemetryStore;
  private final JdbcFindingsRepository findingsRepository;

  JdbcStore(HikariDataSource dataSource, int queryTimeoutSeconds) {
    this.dataSource = dataSource;
    this.telemetryStore = new JdbcTelemetryStore(dataSource, queryTimeoutSeconds);
    this.findingsRepository = new JdbcFindingsRepository(dataSource, queryTimeoutSeconds);
  }

  public static JdbcStore create(Config jdbcConfig) {
    HikariDataSource dataSource = DataSourceFactory.create(jdbcConfig);
    int queryTimeoutSeconds =
        jdbcConfig.hasPath(QUERY_TIMEOUT_SECONDS)
            ? jdbcConfig.getInt(QUERY_TIMEOUT_SECONDS)
            : DEFAULT_QUERY_TIMEOUT_SECONDS;
    if (!jdbcConfig.hasPath(INIT_SCHEMA) || jdbcConfig.getBoolean(INIT_SCHEMA)) {
      try {
        JdbcSchemaInitializer.initialize(dataSource);
      } catch (SQLException e) {
        dataSource.close();
        throw new IllegalStateException("Unable to initialize anomaly store schema", e);
      }
    }
    return new JdbcStore(dataSource, queryTimeoutSeconds);
  }

  public DataSource getDataSource() {
    return dataSource;
  }

  @Override
  public TelemetryStore getTelemetryStore() {
    return telemetryStore;
  }

  @Override
  public FindingsRepository getFindingsRepository() {
    return findingsRepository;
  }

  @Override
  public void close() {
    dataSource.close();
  }
}
