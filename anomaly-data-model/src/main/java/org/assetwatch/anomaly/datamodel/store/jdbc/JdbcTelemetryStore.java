package org.assetwatch.anomaly.datamodel.store.jdbc;

import static org.assetwatch.anomaly.datamodel.store.jdbc.JdbcSupport.readInstant;
import static org.assetwatch.anomaly.datamodel.store.jdbc.JdbcSupport.readTags;
import static org.assetwatch.anomaly.datamodel.store.jdbc.JdbcSupport.toTimestamp;
import static org.assetwatch.anomaly.datamodel.store.jdbc.JdbcSupport.writeJson;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import javax.sql.DataSource;
import org.assetwatch.anomaly.datamodel.ScanPair;
import org.assetwatch.anomaly.datamodel.TelemetrySample;
import org.assetwatch.anomaly.datamodel.store.StoreUnavailableException;
import org.assetwatch.anomaly.datamodel.store.TelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JdbcTelemetryStore implements TelemetryStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcTelemetryStore.class);

  private static final String INSERT_SAMPLE =
      "INSERT INTO telemetry_samples (id, asset_id, metric, observed_at, sample_value, unit, tags)"
          + " VALUES (?, ?, ?, ?, ?, ?, ?)";
  private static final String SELECT_WINDOW =
      "SELECT id, asset_id, metric, observed_at, sample_value, unit, tags FROM telemetry_samples"
          + " WHERE asset_id = ? AND metric = ? AND observed_at >= ? AND observed_at <= ?"
          + " ORDER BY observed_at ASC, id ASC";
  private static final String SELECT_DISTINCT_PAIRS =
      "SELECT DISTINCT asset_id, metric FROM telemetry_samples"
          + " WHERE observed_at >= ? AND observed_at <= ?";

  private final DataSource dataSource;
  private final int queryTimeoutSeconds;

  public JdbcTelemetryStore(DataSource dataSource, int queryTimeoutSeconds) {
    this.dataSource = dataSource;
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  @Override
  public void append(List<TelemetrySample> samples) throws StoreUnavailableException {
    if (samples.isEmpty()) {
      return;
    }
    try (Connection connection = dataSource.getConnection()) {
      boolean autoCommit = connection.getAutoCommit();
      connection.setAutoCommit(false);
      try (PreparedStatement statement = connection.prepareStatement(INSERT_SAMPLE)) {
        statement.setQueryTimeout(queryTimeoutSeconds);
        for (TelemetrySample sample : samples) {
          statement.setObject(1, sample.getId());
          statement.setString(2, sample.getAssetId());
          statement.setString(3, sample.getMetric());
          statement.setObject(4, toTimestamp(sample.getTimestamp()));
          statement.setDouble(5, sample.getValue());
          if (sample.getUnit() == null) {
            statement.setNull(6, Types.VARCHAR);
          } else {
            statement.setString(6, sample.getUnit());
          }
          statement.setString(7, writeJson(sample.getTags()));
          statement.addBatch();
        }
        statement.executeBatch();
        connection.commit();
      } catch (SQLException e) {
        connection.rollback();
        throw e;
      } finally {
        connection.setAutoCommit(autoCommit);
      }
      LOGGER.debug("Appended {} telemetry samples", samples.size());
    } catch (SQLException e) {
      throw new StoreUnavailableException(
          String.format("Unable to append %d telemetry samples", samples.size()), e);
    }
  }

  @Override
  public List<TelemetrySample> querySamples(
      String assetId, String metric, Instant start, Instant end)
      throws StoreUnavailableException {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(SELECT_WINDOW)) {
      statement.setQueryTimeout(queryTimeoutSeconds);
      statement.setString(1, assetId);
      statement.setString(2, metric);
      statement.setObject(3, toTimestamp(start));
      statement.setObject(4, toTimestamp(end));
      List<TelemetrySample> samples = new ArrayList<>();
      try (ResultSet resultSet = statement.executeQuery()) {
        while (resultSet.next()) {
          samples.add(toSample(resultSet));
        }
      }
      return samples;
    } catch (SQLException e) {
      throw new StoreUnavailableException(
          String.format(
              "Unable to query samples for %s/%s in [%s, %s]", assetId, metric, start, end),
          e);
    }
  }

  @Override
  public Set<ScanPair> findDistinctPairs(Instant start, Instant end)
      throws StoreUnavailableException {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(SELECT_DISTINCT_PAIRS)) {
      statement.setQueryTimeout(queryTimeoutSeconds);
      statement.setObject(1, toTimestamp(start));
      statement.setObject(2, toTimestamp(end));
      Set<ScanPair> pairs = new HashSet<>();
      try (ResultSet resultSet = statement.executeQuery()) {
        while (resultSet.next()) {
          pairs.add(ScanPair.of(resultSet.getString("asset_id"), resultSet.getString("metric")));
        }
      }
      return pairs;
    } catch (SQLException e) {
      throw new StoreUnavailableException(
          String.format("Unable to list asset/metric pairs in [%s, %s]", start, end), e);
    }
  }

  private static TelemetrySample toSample(ResultSet resultSet) throws SQLException {
    return TelemetrySample.builder()
        .id(resultSet.getObject("id", UUID.class))
        .assetId(resultSet.getString("asset_id"))
        .metric(resultSet.getString("metric"))
        .timestamp(readInstant(resultSet, "observed_at"))
        .value(resultSet.getDouble("sample_value"))
        .unit(resultSet.getString("unit"))
        .tags(readTags(resultSet.getString("tags")))
        .build();
  }
}
